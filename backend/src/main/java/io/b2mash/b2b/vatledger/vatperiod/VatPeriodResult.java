package io.b2mash.b2b.vatledger.vatperiod;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Reconciliation result of one client period. Unlocked records are recalculated freely; a locked
 * record is frozen and every mutator other than {@link #unlock()} refuses to run.
 */
@Entity
@Table(
    name = "vat_period_results",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_vat_period_results_key",
            columnNames = {"client_id", "period_type", "period_year", "period_number"}))
public class VatPeriodResult {

  @Id private UUID id;

  @Column(name = "client_id", nullable = false, updatable = false)
  private UUID clientId;

  @Enumerated(EnumType.STRING)
  @Column(name = "period_type", nullable = false, updatable = false, length = 20)
  private PeriodType periodType;

  @Column(name = "period_year", nullable = false, updatable = false)
  private int periodYear;

  @Column(name = "period_number", nullable = false, updatable = false)
  private int periodNumber;

  @Column(name = "period_start", nullable = false, updatable = false)
  private LocalDate periodStart;

  @Column(name = "period_end", nullable = false, updatable = false)
  private LocalDate periodEnd;

  @Column(name = "vat_output", nullable = false, precision = 15, scale = 2)
  private BigDecimal vatOutput;

  @Column(name = "vat_input", nullable = false, precision = 15, scale = 2)
  private BigDecimal vatInput;

  @Column(name = "previous_credit", nullable = false, precision = 15, scale = 2)
  private BigDecimal previousCredit;

  @Enumerated(EnumType.STRING)
  @Column(name = "credit_source", nullable = false, length = 10)
  private CreditSource creditSource;

  @Column(name = "vat_difference", nullable = false, precision = 15, scale = 2)
  private BigDecimal vatDifference;

  @Column(name = "final_result", nullable = false, precision = 15, scale = 2)
  private BigDecimal finalResult;

  @Column(name = "credit_to_next", nullable = false, precision = 15, scale = 2)
  private BigDecimal creditToNext;

  @Column(name = "locked", nullable = false)
  private boolean locked;

  @Column(name = "locked_at")
  private Instant lockedAt;

  @Column(name = "locked_by", length = 255)
  private String lockedBy;

  @Column(name = "last_calculated_at")
  private Instant lastCalculatedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected VatPeriodResult() {}

  /**
   * New unlocked record with zero totals and an automatically carried credit. Derived fields are
   * taken from {@code initial}, which must be the reconciliation of (0, 0, previousCredit). The
   * ledger inserts it with {@link VatPeriodResultRepository#insertIfAbsent(VatPeriodResult)}.
   */
  public VatPeriodResult(
      UUID id, PeriodKey key, BigDecimal previousCredit, VatReconciliation initial) {
    this.id = id;
    this.clientId = key.clientId();
    this.periodType = key.periodType();
    this.periodYear = key.year();
    this.periodNumber = key.period();
    this.periodStart = key.startDate();
    this.periodEnd = key.endDate();
    this.vatOutput = BigDecimal.ZERO.setScale(2);
    this.vatInput = BigDecimal.ZERO.setScale(2);
    this.previousCredit = previousCredit;
    this.creditSource = CreditSource.AUTO;
    this.vatDifference = initial.vatDifference();
    this.finalResult = initial.finalResult();
    this.creditToNext = initial.creditToNext();
    this.locked = false;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  public void applyTotals(BigDecimal newVatOutput, BigDecimal newVatInput) {
    requireUnlocked("update totals");
    this.vatOutput = newVatOutput;
    this.vatInput = newVatInput;
    this.updatedAt = Instant.now();
  }

  /** Replaces the credit with the carried-forward value and marks it automatic. */
  public void carryCredit(BigDecimal carried) {
    requireUnlocked("carry credit");
    this.previousCredit = carried;
    this.creditSource = CreditSource.AUTO;
    this.updatedAt = Instant.now();
  }

  /** Replaces the credit with a manually entered value that later calculations keep. */
  public void overrideCredit(BigDecimal amount) {
    requireUnlocked("override credit");
    this.previousCredit = amount;
    this.creditSource = CreditSource.MANUAL;
    this.updatedAt = Instant.now();
  }

  public void applyReconciliation(VatReconciliation reconciliation, Instant calculatedAt) {
    requireUnlocked("recalculate");
    this.vatDifference = reconciliation.vatDifference();
    this.finalResult = reconciliation.finalResult();
    this.creditToNext = reconciliation.creditToNext();
    this.lastCalculatedAt = calculatedAt;
    this.updatedAt = calculatedAt;
  }

  public void lock(String actor) {
    if (this.locked) {
      throw new IllegalStateException("Period is already locked");
    }
    this.locked = true;
    this.lockedAt = Instant.now();
    this.lockedBy = actor;
    this.updatedAt = this.lockedAt;
  }

  /**
   * Clears the lock.
   *
   * @return {@code false} if the record was not locked (nothing changed)
   */
  public boolean unlock() {
    if (!this.locked) {
      return false;
    }
    this.locked = false;
    this.lockedAt = null;
    this.lockedBy = null;
    this.updatedAt = Instant.now();
    return true;
  }

  private void requireUnlocked(String action) {
    if (this.locked) {
      throw new IllegalStateException("Cannot " + action + " on a locked period");
    }
  }

  public PeriodKey getPeriodKey() {
    return new PeriodKey(clientId, periodType, periodYear, periodNumber);
  }

  public String getPeriodDisplay() {
    return periodType.display(periodYear, periodNumber);
  }

  public int getMonthsInPeriod() {
    return periodType.monthsPerPeriod();
  }

  public boolean isPayable() {
    return finalResult.signum() > 0;
  }

  public boolean isCredit() {
    return !isPayable();
  }

  public UUID getId() {
    return id;
  }

  public UUID getClientId() {
    return clientId;
  }

  public PeriodType getPeriodType() {
    return periodType;
  }

  public int getPeriodYear() {
    return periodYear;
  }

  public int getPeriodNumber() {
    return periodNumber;
  }

  public LocalDate getPeriodStart() {
    return periodStart;
  }

  public LocalDate getPeriodEnd() {
    return periodEnd;
  }

  public BigDecimal getVatOutput() {
    return vatOutput;
  }

  public BigDecimal getVatInput() {
    return vatInput;
  }

  public BigDecimal getPreviousCredit() {
    return previousCredit;
  }

  public CreditSource getCreditSource() {
    return creditSource;
  }

  public BigDecimal getVatDifference() {
    return vatDifference;
  }

  public BigDecimal getFinalResult() {
    return finalResult;
  }

  public BigDecimal getCreditToNext() {
    return creditToNext;
  }

  public boolean isLocked() {
    return locked;
  }

  public Instant getLockedAt() {
    return lockedAt;
  }

  public String getLockedBy() {
    return lockedBy;
  }

  public Instant getLastCalculatedAt() {
    return lastCalculatedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public long getVersion() {
    return version;
  }
}
