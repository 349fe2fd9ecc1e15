package io.b2mash.eventops.audit;

import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. The source defaults to {@code API} when
 * called on a request thread and {@code INTERNAL} otherwise (scheduler runs).
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("task.completed")
 *     .entityType("task")
 *     .entityId(task.getId())
 *     .actor(actorEmail)
 *     .details(Map.of("template_id", task.getTemplateId()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actor;
  private String source;
  private Map<String, Object> details;

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

  public AuditEventBuilder actor(String actor) {
    this.actor = actor;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    String resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource =
          RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes
              ? "API"
              : "INTERNAL";
    }
    return new AuditEventRecord(eventType, entityType, entityId, actor, resolvedSource, details);
  }
}
