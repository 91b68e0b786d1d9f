package io.b2mash.b2b.vatledger.vatperiod;

import static io.b2mash.b2b.vatledger.testutil.VatTestData.createClient;
import static io.b2mash.b2b.vatledger.testutil.VatTestData.memberJwt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.b2b.vatledger.TestcontainersConfiguration;
import io.b2mash.b2b.vatledger.aggregator.VatAggregator;
import io.b2mash.b2b.vatledger.aggregator.VatTotals;
import io.b2mash.b2b.vatledger.audit.AuditEvent;
import io.b2mash.b2b.vatledger.audit.AuditService;
import io.b2mash.b2b.vatledger.exception.AggregatorUnavailableException;
import io.b2mash.b2b.vatledger.exception.PeriodLockedException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class VatPeriodLedgerIntegrationTest {

  @Autowired private VatPeriodLedger ledger;
  @Autowired private VatPeriodResultRepository repository;
  @Autowired private AuditService auditService;
  @Autowired private JdbcTemplate jdbc;
  @Autowired private MockMvc mockMvc;
  @MockitoBean private VatAggregator aggregator;

  private void aggregatorReturns(UUID clientId, String output, String input) {
    when(aggregator.getTotals(eq(clientId), any(), any()))
        .thenReturn(new VatTotals(new BigDecimal(output), new BigDecimal(input)));
  }

  @Test
  void aggregatorFailureOnFirstCalculateLeavesNoRecord() throws Exception {
    UUID clientId = createClient(jdbc, "Offline Co", null);
    when(aggregator.getTotals(eq(clientId), any(), any()))
        .thenThrow(new AggregatorUnavailableException("VAT aggregator could not be reached"));

    mockMvc
        .perform(
            post("/api/vat-periods/calculate")
                .with(memberJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"clientId": "%s", "periodType": "monthly", "year": 2024, "period": 9}
                    """
                        .formatted(clientId)))
        .andExpect(status().isServiceUnavailable())
        .andExpect(header().string("Retry-After", "7"))
        .andExpect(jsonPath("$.errorCode").value("AGGREGATOR_UNAVAILABLE"));

    assertThat(repository.findByClientIdOrderByPeriodYearDescPeriodNumberDescPeriodTypeAsc(clientId))
        .isEmpty();
  }

  @Test
  void aggregatorFailureOnRecalculateKeepsPreviousValues() {
    UUID clientId = createClient(jdbc, "Flaky Co", null);
    var key = PeriodKey.of(clientId, PeriodType.MONTHLY, 2024, 10);
    aggregatorReturns(clientId, "500.00", "100.00");
    var created = ledger.calculateForRequest(key, false).result();

    when(aggregator.getTotals(eq(clientId), any(), any()))
        .thenThrow(new AggregatorUnavailableException("timeout"));

    assertThatThrownBy(() -> ledger.calculate(created.getId(), true))
        .isInstanceOf(AggregatorUnavailableException.class);

    var reloaded = ledger.get(created.getId());
    assertThat(reloaded.getVatOutput()).isEqualByComparingTo("500.00");
    assertThat(reloaded.getFinalResult()).isEqualByComparingTo("400.00");
    assertThat(reloaded.getVersion()).isEqualTo(created.getVersion());
  }

  @Test
  void concurrentCalculateForSameKeyCreatesOneRecord() throws Exception {
    UUID clientId = createClient(jdbc, "Busy Co", null);
    var key = PeriodKey.of(clientId, PeriodType.QUARTERLY, 2024, 2);
    aggregatorReturns(clientId, "300.00", "120.00");

    int threads = 6;
    var ready = new CountDownLatch(threads);
    var start = new CountDownLatch(1);
    var executor = Executors.newFixedThreadPool(threads);
    try {
      List<Future<VatPeriodLedger.PeriodEntry>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<VatPeriodLedger.PeriodEntry> task =
            () -> {
              ready.countDown();
              start.await();
              return ledger.calculateForRequest(key, true);
            };
        futures.add(executor.submit(task));
      }
      ready.await(10, TimeUnit.SECONDS);
      start.countDown();

      int createdCount = 0;
      for (var future : futures) {
        var entry = future.get(30, TimeUnit.SECONDS);
        if (entry.created()) {
          createdCount++;
        }
        assertThat(entry.result().getFinalResult()).isEqualByComparingTo("180.00");
      }
      assertThat(createdCount).isEqualTo(1);
    } finally {
      executor.shutdownNow();
    }

    assertThat(repository.findByClientIdOrderByPeriodYearDescPeriodNumberDescPeriodTypeAsc(clientId))
        .hasSize(1);
  }

  @Test
  void carryForwardSpansPeriodTypesAndGaps() {
    UUID clientId = createClient(jdbc, "Switch Co", null);
    aggregatorReturns(clientId, "0.00", "250.00");
    var q4 = ledger.calculateForRequest(PeriodKey.of(clientId, PeriodType.QUARTERLY, 2023, 4), false);
    ledger.lock(q4.result().getId());

    var march = PeriodKey.of(clientId, PeriodType.MONTHLY, 2024, 3);
    assertThat(ledger.carryForward(march)).isEqualByComparingTo("250.00");

    aggregatorReturns(clientId, "100.00", "0.00");
    var entry = ledger.calculateForRequest(march, false);
    assertThat(entry.result().getPreviousCredit()).isEqualByComparingTo("250.00");
    assertThat(entry.result().getFinalResult()).isEqualByComparingTo("-150.00");
    assertThat(entry.result().getCreditToNext()).isEqualByComparingTo("150.00");
  }

  @Test
  void lockedPeriodIsNotChangedByLaterCalculations() {
    UUID clientId = createClient(jdbc, "Frozen Co", null);
    var key = PeriodKey.of(clientId, PeriodType.MONTHLY, 2024, 11);
    aggregatorReturns(clientId, "80.00", "20.00");
    var id = ledger.calculateForRequest(key, false).result().getId();
    ledger.lock(key);

    aggregatorReturns(clientId, "999.00", "0.00");
    assertThatThrownBy(() -> ledger.calculate(key, true))
        .isInstanceOf(PeriodLockedException.class);
    assertThatThrownBy(() -> ledger.setCredit(id, BigDecimal.TEN, true))
        .isInstanceOf(PeriodLockedException.class);

    var reloaded = ledger.get(id);
    assertThat(reloaded.getVatOutput()).isEqualByComparingTo("80.00");
    assertThat(reloaded.getFinalResult()).isEqualByComparingTo("60.00");

    ledger.unlock(key);
    assertThat(ledger.calculate(key, true).getVatOutput()).isEqualByComparingTo("999.00");
  }

  @Test
  void mutationsAreAudited() {
    UUID clientId = createClient(jdbc, "Audit Co", null);
    var key = PeriodKey.of(clientId, PeriodType.MONTHLY, 2024, 12);
    aggregatorReturns(clientId, "10.00", "0.00");
    var id = ledger.calculateForRequest(key, false).result().getId();
    ledger.setCredit(id, new BigDecimal("4.00"), false);
    ledger.lock(id);
    ledger.unlock(id);

    List<AuditEvent> events = auditService.findForEntity(VatPeriodLedger.ENTITY_TYPE, id);

    assertThat(events)
        .extracting(AuditEvent::getEventType)
        .containsExactlyInAnyOrder(
            "vat_period.created",
            "vat_period.calculated",
            "vat_period.credit_set",
            "vat_period.locked",
            "vat_period.unlocked");
    var creditSet =
        events.stream()
            .filter(e -> e.getEventType().equals("vat_period.credit_set"))
            .findFirst()
            .orElseThrow();
    assertThat(creditSet.getDetails())
        .containsEntry("previous_credit_after", "4.00")
        .containsEntry("forced", "false");
    assertThat(events).allSatisfy(e -> assertThat(e.getActorType()).isEqualTo("SYSTEM"));
    assertThat(events).allSatisfy(e -> assertThat(e.getSource()).isEqualTo("INTERNAL"));
  }
}
