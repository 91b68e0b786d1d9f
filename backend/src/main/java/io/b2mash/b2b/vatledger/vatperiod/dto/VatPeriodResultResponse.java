package io.b2mash.b2b.vatledger.vatperiod.dto;

import io.b2mash.b2b.vatledger.client.Client;
import io.b2mash.b2b.vatledger.vatperiod.CreditSource;
import io.b2mash.b2b.vatledger.vatperiod.PeriodType;
import io.b2mash.b2b.vatledger.vatperiod.VatPeriodResult;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

public record VatPeriodResultResponse(
    UUID id,
    UUID clientId,
    String clientName,
    String clientTaxId,
    PeriodType periodType,
    int year,
    int period,
    String periodDisplay,
    LocalDate periodStartDate,
    LocalDate periodEndDate,
    int monthsInPeriod,
    BigDecimal vatOutput,
    BigDecimal vatInput,
    BigDecimal previousCredit,
    CreditSource creditSource,
    BigDecimal vatDifference,
    BigDecimal finalResult,
    boolean payable,
    boolean credit,
    BigDecimal creditToNext,
    boolean locked,
    Instant lockedAt,
    String lockedBy,
    Instant lastCalculatedAt,
    Instant createdAt,
    Instant updatedAt,
    boolean created) {

  public static VatPeriodResultResponse from(VatPeriodResult r, Client client, boolean created) {
    return new VatPeriodResultResponse(
        r.getId(),
        r.getClientId(),
        client != null ? client.getName() : null,
        client != null ? client.getTaxId() : null,
        r.getPeriodType(),
        r.getPeriodYear(),
        r.getPeriodNumber(),
        r.getPeriodDisplay(),
        r.getPeriodStart(),
        r.getPeriodEnd(),
        r.getMonthsInPeriod(),
        r.getVatOutput(),
        r.getVatInput(),
        r.getPreviousCredit(),
        r.getCreditSource(),
        r.getVatDifference(),
        r.getFinalResult(),
        r.isPayable(),
        r.isCredit(),
        r.getCreditToNext(),
        r.isLocked(),
        r.getLockedAt(),
        r.getLockedBy(),
        r.getLastCalculatedAt(),
        r.getCreatedAt(),
        r.getUpdatedAt(),
        created);
  }
}
