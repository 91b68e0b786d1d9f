package io.b2mash.b2b.vatledger.vatperiod;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Service;

/** Stateless service computing the net VAT position of a period. No I/O. */
@Service
public class VatReconciliationCalculator {

  static final int SCALE = 2;

  /**
   * Reconciles one period.
   *
   * <p>{@code difference = output - input}, truncated to two decimals toward zero, and {@code final
   * = difference - previousCredit}. A final result of exactly zero is a credit (nothing owed).
   * Callers pass amounts already cut to two decimals, so {@code final} equals the stored difference
   * minus the stored credit exactly.
   *
   * @param vatOutput VAT collected on sales, non-negative
   * @param vatInput VAT paid on purchases, non-negative
   * @param previousCredit credit carried into the period, non-negative
   * @throws IllegalArgumentException if any amount is null or negative
   */
  public VatReconciliation reconcile(
      BigDecimal vatOutput, BigDecimal vatInput, BigDecimal previousCredit) {
    requireNonNegative(vatOutput, "vatOutput");
    requireNonNegative(vatInput, "vatInput");
    requireNonNegative(previousCredit, "previousCredit");

    BigDecimal difference = truncate(vatOutput.subtract(vatInput));
    BigDecimal finalResult = truncate(difference.subtract(previousCredit));

    boolean payable = finalResult.signum() > 0;
    BigDecimal creditToNext = payable ? truncate(BigDecimal.ZERO) : finalResult.negate();

    return new VatReconciliation(difference, finalResult, payable, !payable, creditToNext);
  }

  /** Cuts an amount to the stored two decimals, toward zero. */
  static BigDecimal truncate(BigDecimal value) {
    return value.setScale(SCALE, RoundingMode.DOWN);
  }

  private static void requireNonNegative(BigDecimal value, String name) {
    if (value == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    if (value.signum() < 0) {
      throw new IllegalArgumentException(name + " must not be negative: " + value);
    }
  }
}
