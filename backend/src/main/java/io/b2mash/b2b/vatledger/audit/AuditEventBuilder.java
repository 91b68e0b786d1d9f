package io.b2mash.b2b.vatledger.audit;

import io.b2mash.b2b.vatledger.security.CurrentActor;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source and IP
 * address from the current request and security context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("vat_period.locked")
 *     .entityType("vat_period")
 *     .entityId(period.getId())
 *     .details(Map.of("period", period.getPeriodDisplay()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actorId;
  private Map<String, String> details;

  private boolean actorIdExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, String> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. {@code actorId} defaults to the JWT subject, {@code actorType} is "USER"
   * when an actor is known and "SYSTEM" otherwise, {@code source} is "API" inside an HTTP request
   * and "INTERNAL" outside one.
   */
  public AuditEventRecord build() {
    String resolvedActorId = actorIdExplicitlySet ? this.actorId : CurrentActor.subject();
    String actorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String source = request != null ? "API" : "INTERNAL";
    String ipAddress = request != null ? request.getRemoteAddr() : null;

    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedActorId, actorType, source, ipAddress, details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
