package io.b2mash.b2b.vatledger.vatperiod;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.b2b.vatledger.exception.InvalidPeriodKeyException;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class PeriodKeyTest {

  private static final UUID CLIENT_ID = UUID.randomUUID();

  @Test
  void monthlyPeriod_coversCalendarMonth() {
    var key = PeriodKey.of(CLIENT_ID, PeriodType.MONTHLY, 2024, 2);

    assertThat(key.startDate()).isEqualTo(LocalDate.of(2024, 2, 1));
    assertThat(key.endDate()).isEqualTo(LocalDate.of(2024, 2, 29));
    assertThat(key.monthsInPeriod()).isEqualTo(1);
    assertThat(key.display()).isEqualTo("02/2024");
  }

  @Test
  void quarterlyPeriod_coversThreeMonths() {
    var key = PeriodKey.of(CLIENT_ID, PeriodType.QUARTERLY, 2023, 4);

    assertThat(key.startDate()).isEqualTo(LocalDate.of(2023, 10, 1));
    assertThat(key.endDate()).isEqualTo(LocalDate.of(2023, 12, 31));
    assertThat(key.monthsInPeriod()).isEqualTo(3);
    assertThat(key.display()).isEqualTo("Q4 2023");
  }

  @Test
  void rejectsPeriodOutOfRangeForType() {
    assertThatThrownBy(() -> PeriodKey.of(CLIENT_ID, PeriodType.QUARTERLY, 2024, 5))
        .isInstanceOf(InvalidPeriodKeyException.class)
        .hasMessageContaining("quarterly");
    assertThatThrownBy(() -> PeriodKey.of(CLIENT_ID, PeriodType.MONTHLY, 2024, 13))
        .isInstanceOf(InvalidPeriodKeyException.class);
    assertThatThrownBy(() -> PeriodKey.of(CLIENT_ID, PeriodType.MONTHLY, 2024, 0))
        .isInstanceOf(InvalidPeriodKeyException.class);
  }

  @Test
  void rejectsMissingPartsAndImplausibleYear() {
    assertThatThrownBy(() -> PeriodKey.of(null, PeriodType.MONTHLY, 2024, 1))
        .isInstanceOf(InvalidPeriodKeyException.class);
    assertThatThrownBy(() -> PeriodKey.of(CLIENT_ID, null, 2024, 1))
        .isInstanceOf(InvalidPeriodKeyException.class);
    assertThatThrownBy(() -> PeriodKey.of(CLIENT_ID, PeriodType.MONTHLY, 24, 1))
        .isInstanceOf(InvalidPeriodKeyException.class);
  }

  @Test
  void keysWithSameComponentsAreEqual() {
    assertThat(PeriodKey.of(CLIENT_ID, PeriodType.MONTHLY, 2024, 3))
        .isEqualTo(PeriodKey.of(CLIENT_ID, PeriodType.MONTHLY, 2024, 3))
        .isNotEqualTo(PeriodKey.of(CLIENT_ID, PeriodType.QUARTERLY, 2024, 3));
  }

  @Test
  void periodType_parsesCaseInsensitively() {
    assertThat(PeriodType.from("Monthly")).isEqualTo(PeriodType.MONTHLY);
    assertThat(PeriodType.from(" QUARTERLY ")).isEqualTo(PeriodType.QUARTERLY);
    assertThat(PeriodType.MONTHLY.value()).isEqualTo("monthly");
    assertThatThrownBy(() -> PeriodType.from("weekly"))
        .isInstanceOf(InvalidPeriodKeyException.class)
        .hasMessageContaining("weekly");
  }
}
