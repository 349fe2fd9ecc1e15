package io.b2mash.eventops.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "task", "event")
 * @param entityId ID of the affected entity
 * @param actor email of the acting staff member; null for system-initiated events
 * @param source origin of the action: API or INTERNAL
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String actor,
    String source,
    Map<String, Object> details) {}
