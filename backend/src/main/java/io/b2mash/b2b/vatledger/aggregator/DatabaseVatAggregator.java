package io.b2mash.b2b.vatledger.aggregator;

import io.b2mash.b2b.vatledger.exception.AggregatorUnavailableException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceException;
import jakarta.persistence.Tuple;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Sums non-cancelled rows of {@code vat_records}: {@code rec_type = 1} are sales (output VAT),
 * {@code rec_type = 2} are purchases (input VAT). Rows are filtered on issue date, both bounds
 * inclusive.
 */
@Component
@ConditionalOnProperty(name = "vat.aggregator.mode", havingValue = "database", matchIfMissing = true)
public class DatabaseVatAggregator implements VatAggregator {

  private static final Logger log = LoggerFactory.getLogger(DatabaseVatAggregator.class);

  private static final String TOTALS_SQL =
      """
      SELECT
          COALESCE(SUM(CASE WHEN vr.rec_type = 1 THEN vr.vat_amount END), 0) AS output_vat,
          COALESCE(SUM(CASE WHEN vr.rec_type = 2 THEN vr.vat_amount END), 0) AS input_vat
      FROM vat_records vr
      WHERE vr.client_id = :clientId
        AND vr.is_cancelled = false
        AND vr.issue_date >= :dateFrom
        AND vr.issue_date <= :dateTo
      """;

  private final EntityManager entityManager;
  private final AggregatorProperties properties;

  public DatabaseVatAggregator(EntityManager entityManager, AggregatorProperties properties) {
    this.entityManager = entityManager;
    this.properties = properties;
  }

  @Override
  public String aggregatorId() {
    return "database";
  }

  @Override
  public VatTotals getTotals(UUID clientId, LocalDate from, LocalDate to) {
    try {
      var tuple =
          (Tuple)
              entityManager
                  .createNativeQuery(TOTALS_SQL, Tuple.class)
                  .setParameter("clientId", clientId)
                  .setParameter("dateFrom", from)
                  .setParameter("dateTo", to)
                  .setHint(
                      "jakarta.persistence.query.timeout",
                      (int) properties.readTimeout().toMillis())
                  .getSingleResult();
      return new VatTotals(
          toBigDecimal(tuple.get("output_vat")), toBigDecimal(tuple.get("input_vat")));
    } catch (PersistenceException e) {
      log.warn(
          "VAT totals query failed for client {} ({} to {}): {}",
          clientId,
          from,
          to,
          e.getMessage());
      throw new AggregatorUnavailableException(
          "VAT records could not be summed for " + from + " to " + to, e);
    }
  }

  private static BigDecimal toBigDecimal(Object value) {
    if (value == null) {
      return BigDecimal.ZERO;
    }
    if (value instanceof BigDecimal bd) {
      return bd;
    }
    return new BigDecimal(value.toString());
  }
}
