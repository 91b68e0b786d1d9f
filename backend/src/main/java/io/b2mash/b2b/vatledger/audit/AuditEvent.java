package io.b2mash.b2b.vatledger.audit;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.MapKeyColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit event persisted to the {@code audit_events} table. No setters, no
 * {@code updatedAt}.
 *
 * @see AuditEventRecord
 */
@Entity
@Table(name = "audit_events")
public class AuditEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "event_type", nullable = false, length = 100, updatable = false)
  private String eventType;

  @Column(name = "entity_type", nullable = false, length = 50, updatable = false)
  private String entityType;

  @Column(name = "entity_id", nullable = false, updatable = false)
  private UUID entityId;

  @Column(name = "actor_id", length = 255, updatable = false)
  private String actorId;

  @Column(name = "actor_type", nullable = false, length = 20, updatable = false)
  private String actorType;

  @Column(name = "source", nullable = false, length = 30, updatable = false)
  private String source;

  @Column(name = "ip_address", length = 45, updatable = false)
  private String ipAddress;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "audit_event_details", joinColumns = @JoinColumn(name = "event_id"))
  @MapKeyColumn(name = "detail_key", length = 100)
  @Column(name = "detail_value", length = 1000)
  private Map<String, String> details = new HashMap<>();

  @Column(name = "occurred_at", nullable = false, updatable = false)
  private Instant occurredAt;

  protected AuditEvent() {}

  public AuditEvent(AuditEventRecord record) {
    this.eventType = record.eventType();
    this.entityType = record.entityType();
    this.entityId = record.entityId();
    this.actorId = record.actorId();
    this.actorType = record.actorType();
    this.source = record.source();
    this.ipAddress = record.ipAddress();
    if (record.details() != null) {
      this.details.putAll(record.details());
    }
    this.occurredAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getEventType() {
    return eventType;
  }

  public String getEntityType() {
    return entityType;
  }

  public UUID getEntityId() {
    return entityId;
  }

  public String getActorId() {
    return actorId;
  }

  public String getActorType() {
    return actorType;
  }

  public String getSource() {
    return source;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public Map<String, String> getDetails() {
    return details;
  }

  public Instant getOccurredAt() {
    return occurredAt;
  }
}
