package io.b2mash.b2b.vatledger.audit;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

  List<AuditEvent> findByEntityTypeAndEntityIdOrderByOccurredAtAsc(
      String entityType, UUID entityId);
}
