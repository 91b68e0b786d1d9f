package io.b2mash.b2b.vatledger.vatperiod;

import java.math.BigDecimal;

/**
 * Derived fields of one reconciliation. {@code isPayable} and {@code isCredit} are always
 * complementary; {@code creditToNext} is zero whenever the period is payable.
 */
public record VatReconciliation(
    BigDecimal vatDifference,
    BigDecimal finalResult,
    boolean isPayable,
    boolean isCredit,
    BigDecimal creditToNext) {}
