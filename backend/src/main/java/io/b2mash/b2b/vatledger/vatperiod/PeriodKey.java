package io.b2mash.b2b.vatledger.vatperiod;

import io.b2mash.b2b.vatledger.exception.InvalidPeriodKeyException;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Identifies one reconciliation unit: a client's monthly or quarterly period of a given year.
 * Construction validates the period number against the type, so every instance is well formed.
 */
public record PeriodKey(UUID clientId, PeriodType periodType, int year, int period) {

  public static final int MIN_YEAR = 1900;
  public static final int MAX_YEAR = 2999;

  public PeriodKey {
    if (clientId == null) {
      throw new InvalidPeriodKeyException("Client id is required");
    }
    if (periodType == null) {
      throw new InvalidPeriodKeyException("Period type is required");
    }
    if (year < MIN_YEAR || year > MAX_YEAR) {
      throw new InvalidPeriodKeyException(
          "Year " + year + " is outside " + MIN_YEAR + ".." + MAX_YEAR);
    }
    if (!periodType.isValidPeriod(period)) {
      throw new InvalidPeriodKeyException(
          "Period "
              + period
              + " is not valid for "
              + periodType.value()
              + " periods (1.."
              + periodType.periodsPerYear()
              + ")");
    }
  }

  public static PeriodKey of(UUID clientId, PeriodType periodType, int year, int period) {
    return new PeriodKey(clientId, periodType, year, period);
  }

  public LocalDate startDate() {
    return periodType.startDate(year, period);
  }

  public LocalDate endDate() {
    return periodType.endDate(year, period);
  }

  public int monthsInPeriod() {
    return periodType.monthsPerPeriod();
  }

  public String display() {
    return periodType.display(year, period);
  }
}
