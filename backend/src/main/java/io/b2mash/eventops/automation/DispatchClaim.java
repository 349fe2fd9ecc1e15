package io.b2mash.eventops.automation;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;

/**
 * Row inserted before a campaign email is sent. The unique (template, event, recipient) key makes
 * the insert the create-if-absent primitive: whoever inserts first is the only sender.
 */
@Entity
@Table(
    name = "dispatch_claims",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uq_dispatch_claims_template_event_recipient",
            columnNames = {"template_slug", "event_id", "recipient_email"}))
public class DispatchClaim {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_slug", nullable = false, updatable = false, length = 100)
  private String templateSlug;

  @Column(name = "event_id", nullable = false, updatable = false)
  private UUID eventId;

  @Column(name = "recipient_email", nullable = false, updatable = false, length = 320)
  private String recipientEmail;

  @Column(name = "claimed_at", nullable = false, updatable = false)
  private Instant claimedAt;

  protected DispatchClaim() {}

  public DispatchClaim(String templateSlug, UUID eventId, String recipientEmail) {
    this.templateSlug = templateSlug;
    this.eventId = eventId;
    this.recipientEmail = recipientEmail;
    this.claimedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getTemplateSlug() {
    return templateSlug;
  }

  public UUID getEventId() {
    return eventId;
  }

  public String getRecipientEmail() {
    return recipientEmail;
  }

  public Instant getClaimedAt() {
    return claimedAt;
  }
}
