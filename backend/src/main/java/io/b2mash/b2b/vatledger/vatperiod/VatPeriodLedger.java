package io.b2mash.b2b.vatledger.vatperiod;

import io.b2mash.b2b.vatledger.aggregator.VatAggregator;
import io.b2mash.b2b.vatledger.aggregator.VatTotals;
import io.b2mash.b2b.vatledger.audit.AuditEventBuilder;
import io.b2mash.b2b.vatledger.audit.AuditService;
import io.b2mash.b2b.vatledger.client.ClientRepository;
import io.b2mash.b2b.vatledger.exception.AggregatorUnavailableException;
import io.b2mash.b2b.vatledger.exception.CreditOverrideRefusedException;
import io.b2mash.b2b.vatledger.exception.InvalidCreditException;
import io.b2mash.b2b.vatledger.exception.LaterPeriodLockedException;
import io.b2mash.b2b.vatledger.exception.PeriodAlreadyLockedException;
import io.b2mash.b2b.vatledger.exception.PeriodLockedException;
import io.b2mash.b2b.vatledger.exception.ResourceNotFoundException;
import io.b2mash.b2b.vatledger.security.CurrentActor;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the persisted {@link VatPeriodResult} records: one per period key, carry-forward of credit
 * from the latest locked prior period, and the lock state machine.
 *
 * <p>Every mutating operation takes a row lock ({@code SELECT ... FOR UPDATE}) on the record and
 * holds it until commit, so operations on the same period key are serialized while other keys
 * proceed in parallel. A calculation whose aggregator call fails rolls back entirely.
 */
@Service
public class VatPeriodLedger {

  private static final Logger log = LoggerFactory.getLogger(VatPeriodLedger.class);

  static final String ENTITY_TYPE = "vat_period";

  private final VatPeriodResultRepository repository;
  private final ClientRepository clientRepository;
  private final VatAggregator aggregator;
  private final VatReconciliationCalculator calculator;
  private final AuditService auditService;

  public VatPeriodLedger(
      VatPeriodResultRepository repository,
      ClientRepository clientRepository,
      VatAggregator aggregator,
      VatReconciliationCalculator calculator,
      AuditService auditService) {
    this.repository = repository;
    this.clientRepository = clientRepository;
    this.aggregator = aggregator;
    this.calculator = calculator;
    this.auditService = auditService;
  }

  /** A ledger record plus whether this call created it. */
  public record PeriodEntry(VatPeriodResult result, boolean created) {}

  /**
   * Loads the record for {@code key} with a row lock, creating it first if absent. A new record
   * has zero totals and the carried-forward credit.
   */
  @Transactional
  public PeriodEntry getOrCreate(PeriodKey key) {
    requireClient(key.clientId());

    var existing =
        repository.findByKeyForUpdate(
            key.clientId(), key.periodType(), key.year(), key.period());
    if (existing.isPresent()) {
      return new PeriodEntry(existing.get(), false);
    }

    BigDecimal carried = carryForward(key);
    var draft =
        new VatPeriodResult(
            UUID.randomUUID(),
            key,
            carried,
            calculator.reconcile(BigDecimal.ZERO, BigDecimal.ZERO, carried));
    int inserted = repository.insertIfAbsent(draft);

    VatPeriodResult result =
        repository
            .findByKeyForUpdate(key.clientId(), key.periodType(), key.year(), key.period())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "VAT period " + key.display() + " vanished after insert"));

    boolean created = inserted == 1;
    if (created) {
      log.info(
          "Created VAT period {} for client {} with carried credit {}",
          key.display(),
          key.clientId(),
          carried);
      audit(
          "vat_period.created",
          result,
          Map.of("period", key.display(), "previous_credit", carried.toPlainString()));
    }
    return new PeriodEntry(result, created);
  }

  /**
   * Returns {@code creditToNext} of the client's most recent locked period ending before the
   * period's start date, or zero when there is none.
   */
  @Transactional(readOnly = true)
  public BigDecimal carryForward(PeriodKey key) {
    return repository
        .findFirstByClientIdAndLockedTrueAndPeriodEndBeforeOrderByPeriodEndDescLockedAtDesc(
            key.clientId(), key.startDate())
        .map(
            source -> {
              log.debug(
                  "Carrying {} into {} from locked period {}",
                  source.getCreditToNext(),
                  key.display(),
                  source.getPeriodDisplay());
              return source.getCreditToNext();
            })
        .orElseGet(
            () -> {
              log.debug("No locked period before {}; carrying zero", key.display());
              return BigDecimal.ZERO.setScale(VatReconciliationCalculator.SCALE);
            });
  }

  /**
   * Request-level calculate: creates the record when absent and recomputes it (fetching totals)
   * when it was just created or {@code recalculate} is set. Otherwise returns the stored record.
   */
  @Transactional
  public PeriodEntry calculateForRequest(PeriodKey key, boolean recalculate) {
    PeriodEntry entry = getOrCreate(key);
    if (entry.created() || recalculate) {
      recompute(entry.result(), true);
    }
    return entry;
  }

  /** Recomputes the record for {@code key}, creating it if absent. */
  @Transactional
  public VatPeriodResult calculate(PeriodKey key, boolean fetchTotals) {
    PeriodEntry entry = getOrCreate(key);
    recompute(entry.result(), fetchTotals);
    return entry.result();
  }

  /** Recomputes an existing record. */
  @Transactional
  public VatPeriodResult calculate(UUID id, boolean fetchTotals) {
    VatPeriodResult result = lockForUpdate(id);
    recompute(result, fetchTotals);
    return result;
  }

  /**
   * Overrides {@code previousCredit}, cut to two decimals, and recomputes from the stored totals.
   * Refused when a locked prior period exists for the client, unless {@code force} is set.
   */
  @Transactional
  public VatPeriodResult setCredit(UUID id, BigDecimal requested, boolean force) {
    if (requested == null || requested.signum() < 0) {
      throw new InvalidCreditException(requested);
    }
    BigDecimal amount = VatReconciliationCalculator.truncate(requested);

    VatPeriodResult result = lockForUpdate(id);
    requireUnlocked(result);

    if (!force) {
      var source =
          repository.findFirstByClientIdAndLockedTrueAndPeriodEndBeforeOrderByPeriodEndDescLockedAtDesc(
              result.getClientId(), result.getPeriodStart());
      if (source.isPresent()) {
        log.warn(
            "Refused manual credit on {} for client {}: locked period {} already carries credit",
            result.getPeriodDisplay(),
            result.getClientId(),
            source.get().getPeriodDisplay());
        throw new CreditOverrideRefusedException(
            result.getPeriodDisplay(), source.get().getPeriodDisplay());
      }
    }

    BigDecimal before = result.getPreviousCredit();
    result.overrideCredit(amount);
    result.applyReconciliation(
        calculator.reconcile(result.getVatOutput(), result.getVatInput(), amount), Instant.now());
    repository.save(result);

    log.info(
        "Set manual credit {} on VAT period {} for client {} (force={})",
        amount,
        result.getPeriodDisplay(),
        result.getClientId(),
        force);
    var details = new LinkedHashMap<String, String>();
    details.put("period", result.getPeriodDisplay());
    details.put("previous_credit_before", before.toPlainString());
    details.put("previous_credit_after", amount.toPlainString());
    details.put("forced", String.valueOf(force));
    audit("vat_period.credit_set", result, details);
    return result;
  }

  @Transactional
  public VatPeriodResult lock(UUID id) {
    return doLock(lockForUpdate(id));
  }

  @Transactional
  public VatPeriodResult lock(PeriodKey key) {
    return doLock(lockForUpdate(key));
  }

  /**
   * Clears the lock. A no-op on an unlocked record. Refused while a later period of the same client
   * is locked, since that period's carried credit was read from this one.
   */
  @Transactional
  public VatPeriodResult unlock(UUID id) {
    return doUnlock(lockForUpdate(id));
  }

  @Transactional
  public VatPeriodResult unlock(PeriodKey key) {
    return doUnlock(lockForUpdate(key));
  }

  @Transactional(readOnly = true)
  public VatPeriodResult get(UUID id) {
    return repository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("VAT period", id));
  }

  /** Periods of a client, newest first, optionally narrowed by type and year. */
  @Transactional(readOnly = true)
  public List<VatPeriodResult> list(UUID clientId, PeriodType periodType, Integer year) {
    requireClient(clientId);
    return repository
        .findByClientIdOrderByPeriodYearDescPeriodNumberDescPeriodTypeAsc(clientId)
        .stream()
        .filter(r -> periodType == null || r.getPeriodType() == periodType)
        .filter(r -> year == null || r.getPeriodYear() == year)
        .toList();
  }

  private void recompute(VatPeriodResult result, boolean fetchTotals) {
    requireUnlocked(result);

    if (fetchTotals) {
      VatTotals totals =
          aggregator.getTotals(
              result.getClientId(), result.getPeriodStart(), result.getPeriodEnd());
      if (totals == null || !totals.isValid()) {
        log.warn(
            "Aggregator '{}' returned invalid totals {} for {} of client {}",
            aggregator.aggregatorId(),
            totals,
            result.getPeriodDisplay(),
            result.getClientId());
        throw new AggregatorUnavailableException(
            "VAT aggregator returned missing or negative totals");
      }
      VatTotals stored = totals.truncated(VatReconciliationCalculator.SCALE);
      result.applyTotals(stored.outputVat(), stored.inputVat());
    }

    if (result.getCreditSource() == CreditSource.AUTO) {
      result.carryCredit(carryForward(result.getPeriodKey()));
    }

    VatReconciliation reconciliation =
        calculator.reconcile(
            result.getVatOutput(), result.getVatInput(), result.getPreviousCredit());
    result.applyReconciliation(reconciliation, Instant.now());
    repository.save(result);

    log.info(
        "Calculated VAT period {} for client {}: final result {} ({})",
        result.getPeriodDisplay(),
        result.getClientId(),
        reconciliation.finalResult(),
        reconciliation.isPayable() ? "payable" : "credit");
    var details = new LinkedHashMap<String, String>();
    details.put("period", result.getPeriodDisplay());
    details.put("vat_output", result.getVatOutput().toPlainString());
    details.put("vat_input", result.getVatInput().toPlainString());
    details.put("previous_credit", result.getPreviousCredit().toPlainString());
    details.put("final_result", reconciliation.finalResult().toPlainString());
    details.put("fetched_totals", String.valueOf(fetchTotals));
    audit("vat_period.calculated", result, details);
  }

  private VatPeriodResult doLock(VatPeriodResult result) {
    if (result.isLocked()) {
      log.warn("VAT period {} ({}) is already locked", result.getPeriodDisplay(), result.getId());
      throw new PeriodAlreadyLockedException(result.getId(), result.getPeriodDisplay());
    }
    String actor = CurrentActor.subject();
    result.lock(actor);
    repository.save(result);

    log.info(
        "Locked VAT period {} for client {} with credit to next {}",
        result.getPeriodDisplay(),
        result.getClientId(),
        result.getCreditToNext());
    audit(
        "vat_period.locked",
        result,
        Map.of(
            "period",
            result.getPeriodDisplay(),
            "final_result",
            result.getFinalResult().toPlainString(),
            "credit_to_next",
            result.getCreditToNext().toPlainString()));
    return result;
  }

  private VatPeriodResult doUnlock(VatPeriodResult result) {
    if (!result.isLocked()) {
      log.debug("VAT period {} is not locked; unlock is a no-op", result.getPeriodDisplay());
      return result;
    }
    if (repository.existsByClientIdAndLockedTrueAndPeriodStartAfter(
        result.getClientId(), result.getPeriodEnd())) {
      log.warn(
          "Refused to unlock VAT period {} for client {}: a later period is locked",
          result.getPeriodDisplay(),
          result.getClientId());
      throw new LaterPeriodLockedException(result.getPeriodDisplay());
    }
    result.unlock();
    repository.save(result);

    log.info("Unlocked VAT period {} for client {}", result.getPeriodDisplay(), result.getClientId());
    audit("vat_period.unlocked", result, Map.of("period", result.getPeriodDisplay()));
    return result;
  }

  private void requireUnlocked(VatPeriodResult result) {
    if (result.isLocked()) {
      log.warn(
          "Refused change to locked VAT period {} ({})", result.getPeriodDisplay(), result.getId());
      throw new PeriodLockedException(result.getId(), result.getPeriodDisplay());
    }
  }

  private VatPeriodResult lockForUpdate(UUID id) {
    return repository
        .findByIdForUpdate(id)
        .orElseThrow(() -> new ResourceNotFoundException("VAT period", id));
  }

  private VatPeriodResult lockForUpdate(PeriodKey key) {
    return repository
        .findByKeyForUpdate(key.clientId(), key.periodType(), key.year(), key.period())
        .orElseThrow(() -> ResourceNotFoundException.forPeriod(key.display(), key.clientId()));
  }

  private void requireClient(UUID clientId) {
    if (!clientRepository.existsById(clientId)) {
      throw new ResourceNotFoundException("Client", clientId);
    }
  }

  private void audit(String eventType, VatPeriodResult result, Map<String, String> details) {
    auditService.log(
        AuditEventBuilder.builder()
            .eventType(eventType)
            .entityType(ENTITY_TYPE)
            .entityId(result.getId())
            .details(details)
            .build());
  }
}
