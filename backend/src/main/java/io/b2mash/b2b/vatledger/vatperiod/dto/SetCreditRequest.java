package io.b2mash.b2b.vatledger.vatperiod.dto;

import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;

/** Manual credit override. Negative amounts are rejected by the ledger with INVALID_CREDIT. */
public record SetCreditRequest(@NotNull BigDecimal previousCredit, Boolean force) {

  public boolean forced() {
    return Boolean.TRUE.equals(force);
  }
}
