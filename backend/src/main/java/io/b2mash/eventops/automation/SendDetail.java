package io.b2mash.eventops.automation;

import java.util.UUID;

/**
 * Per-recipient line of an {@link AutomationResult}.
 *
 * @param status {@code sent}, {@code failed} or {@code skipped}
 */
public record SendDetail(
    String templateSlug,
    UUID eventId,
    String recipientEmail,
    String recipientType,
    String status,
    String messageId,
    String error) {}
