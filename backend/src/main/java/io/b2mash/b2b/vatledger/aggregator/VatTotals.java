package io.b2mash.b2b.vatledger.aggregator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** Output VAT (collected on sales) and input VAT (paid on purchases) for one date range. */
public record VatTotals(BigDecimal outputVat, BigDecimal inputVat) {

  public boolean isValid() {
    return outputVat != null
        && inputVat != null
        && outputVat.signum() >= 0
        && inputVat.signum() >= 0;
  }

  /** Both totals cut to {@code scale} decimals toward zero. */
  public VatTotals truncated(int scale) {
    return new VatTotals(
        outputVat.setScale(scale, RoundingMode.DOWN), inputVat.setScale(scale, RoundingMode.DOWN));
  }
}
