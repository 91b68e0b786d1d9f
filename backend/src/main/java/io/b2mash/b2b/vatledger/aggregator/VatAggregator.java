package io.b2mash.b2b.vatledger.aggregator;

import io.b2mash.b2b.vatledger.exception.AggregatorUnavailableException;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Port for the component that sums a client's invoice-level VAT into period totals. Exactly one
 * adapter is active, selected by {@code vat.aggregator.mode}.
 */
public interface VatAggregator {

  /** Adapter identifier ("database", "http"). */
  String aggregatorId();

  /**
   * Returns output and input VAT for the client over the inclusive date range.
   *
   * @throws AggregatorUnavailableException when the totals cannot be obtained
   */
  VatTotals getTotals(UUID clientId, LocalDate from, LocalDate to);
}
