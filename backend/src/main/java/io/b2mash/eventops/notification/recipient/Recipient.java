package io.b2mash.eventops.notification.recipient;

import java.util.UUID;

/**
 * One resolved addressee of a campaign email. {@code parentId}, {@code childName} and {@code
 * className} are only set for parent-side recipients.
 */
public record Recipient(
    String email,
    String name,
    RecipientType type,
    UUID eventId,
    UUID parentId,
    String childName,
    String className) {

  public static Recipient teacher(String email, String name, UUID eventId) {
    return new Recipient(email, name, RecipientType.TEACHER, eventId, null, null, null);
  }

  public Recipient asNonBuyer() {
    return new Recipient(
        email, name, RecipientType.NON_BUYER, eventId, parentId, childName, className);
  }
}
