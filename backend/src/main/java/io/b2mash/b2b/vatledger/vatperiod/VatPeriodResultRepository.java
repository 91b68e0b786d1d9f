package io.b2mash.b2b.vatledger.vatperiod;

import jakarta.persistence.LockModeType;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface VatPeriodResultRepository extends JpaRepository<VatPeriodResult, UUID> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT r FROM VatPeriodResult r WHERE r.id = :id")
  Optional<VatPeriodResult> findByIdForUpdate(@Param("id") UUID id);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      """
      SELECT r FROM VatPeriodResult r
      WHERE r.clientId = :clientId
        AND r.periodType = :periodType
        AND r.periodYear = :periodYear
        AND r.periodNumber = :periodNumber
      """)
  Optional<VatPeriodResult> findByKeyForUpdate(
      @Param("clientId") UUID clientId,
      @Param("periodType") PeriodType periodType,
      @Param("periodYear") int periodYear,
      @Param("periodNumber") int periodNumber);

  /**
   * Inserts {@code draft} unless a record already exists for its key. Returns 1 when this call
   * created the row, 0 when a concurrent or earlier call did. The draft itself stays unmanaged;
   * callers reload the row through {@link #findByKeyForUpdate}.
   */
  default int insertIfAbsent(VatPeriodResult draft) {
    return insertRowIfAbsent(
        draft.getId(),
        draft.getClientId(),
        draft.getPeriodType().name(),
        draft.getPeriodYear(),
        draft.getPeriodNumber(),
        draft.getPeriodStart(),
        draft.getPeriodEnd(),
        draft.getVatOutput(),
        draft.getVatInput(),
        draft.getPreviousCredit(),
        draft.getCreditSource().name(),
        draft.getVatDifference(),
        draft.getFinalResult(),
        draft.getCreditToNext(),
        draft.isLocked(),
        draft.getCreatedAt(),
        draft.getUpdatedAt());
  }

  @Modifying
  @Query(
      nativeQuery = true,
      value =
          """
          INSERT INTO vat_period_results (
              id, client_id, period_type, period_year, period_number, period_start, period_end,
              vat_output, vat_input, previous_credit, credit_source,
              vat_difference, final_result, credit_to_next,
              locked, created_at, updated_at, version)
          VALUES (
              :id, :clientId, :periodType, :periodYear, :periodNumber, :periodStart, :periodEnd,
              :vatOutput, :vatInput, :previousCredit, :creditSource,
              :vatDifference, :finalResult, :creditToNext,
              :locked, :createdAt, :updatedAt, 0)
          ON CONFLICT (client_id, period_type, period_year, period_number) DO NOTHING
          """)
  int insertRowIfAbsent(
      @Param("id") UUID id,
      @Param("clientId") UUID clientId,
      @Param("periodType") String periodType,
      @Param("periodYear") int periodYear,
      @Param("periodNumber") int periodNumber,
      @Param("periodStart") LocalDate periodStart,
      @Param("periodEnd") LocalDate periodEnd,
      @Param("vatOutput") BigDecimal vatOutput,
      @Param("vatInput") BigDecimal vatInput,
      @Param("previousCredit") BigDecimal previousCredit,
      @Param("creditSource") String creditSource,
      @Param("vatDifference") BigDecimal vatDifference,
      @Param("finalResult") BigDecimal finalResult,
      @Param("creditToNext") BigDecimal creditToNext,
      @Param("locked") boolean locked,
      @Param("createdAt") Instant createdAt,
      @Param("updatedAt") Instant updatedAt);

  /** Latest locked period of the client that ends before {@code date}. */
  Optional<VatPeriodResult>
      findFirstByClientIdAndLockedTrueAndPeriodEndBeforeOrderByPeriodEndDescLockedAtDesc(
          UUID clientId, LocalDate date);

  boolean existsByClientIdAndLockedTrueAndPeriodStartAfter(UUID clientId, LocalDate date);

  List<VatPeriodResult> findByClientIdOrderByPeriodYearDescPeriodNumberDescPeriodTypeAsc(
      UUID clientId);
}
