package io.b2mash.b2b.vatledger.vatperiod.dto;

import io.b2mash.b2b.vatledger.vatperiod.PeriodType;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;

public record CalculateVatPeriodRequest(
    @NotNull UUID clientId,
    @NotNull PeriodType periodType,
    @NotNull Integer year,
    @NotNull Integer period,
    Boolean recalculate) {

  public boolean recalculateRequested() {
    return Boolean.TRUE.equals(recalculate);
  }
}
