package io.b2mash.b2b.vatledger.vatperiod;

/** Where a period's {@code previousCredit} came from. */
public enum CreditSource {
  /** Carried from the latest locked prior period (or zero). Refreshed on every calculation. */
  AUTO,
  /** Set explicitly; calculations keep it until it is set again. */
  MANUAL
}
