package io.b2mash.b2b.vatledger.audit;

import java.util.List;
import java.util.UUID;

/** Service interface for recording and reading audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back (no REQUIRES_NEW).
   */
  void log(AuditEventRecord record);

  /** Returns the events recorded for one entity, oldest first. */
  List<AuditEvent> findForEntity(String entityType, UUID entityId);
}
