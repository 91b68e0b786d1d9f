package io.b2mash.b2b.vatledger.audit;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}.
 *
 * <p>Transaction semantics: {@code log()} participates in the caller's transaction. If the ledger
 * operation rolls back, the audit event rolls back too.
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;

  public DatabaseAuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record));
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, actor={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.actorId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findForEntity(String entityType, UUID entityId) {
    return auditEventRepository.findByEntityTypeAndEntityIdOrderByOccurredAtAsc(
        entityType, entityId);
  }
}
