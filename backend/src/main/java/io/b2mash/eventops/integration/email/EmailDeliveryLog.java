package io.b2mash.eventops.integration.email;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One delivery attempt of a campaign template to a recipient for an event. Rows are only ever
 * inserted; a SENT row is what marks a (template, event, recipient) combination as done.
 */
@Entity
@Table(name = "email_delivery_log")
public class EmailDeliveryLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_slug", nullable = false, length = 100, updatable = false)
  private String templateSlug;

  @Column(name = "event_id", nullable = false, updatable = false)
  private UUID eventId;

  @Column(name = "recipient_email", nullable = false, length = 320, updatable = false)
  private String recipientEmail;

  @Column(name = "recipient_type", nullable = false, length = 20, updatable = false)
  private String recipientType;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20, updatable = false)
  private EmailDeliveryStatus status;

  @Column(name = "provider_message_id", length = 200, updatable = false)
  private String providerMessageId;

  @Column(name = "provider_slug", length = 50, updatable = false)
  private String providerSlug;

  @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
  private String errorMessage;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected EmailDeliveryLog() {}

  public EmailDeliveryLog(
      String templateSlug,
      UUID eventId,
      String recipientEmail,
      String recipientType,
      EmailDeliveryStatus status,
      String providerMessageId,
      String providerSlug,
      String errorMessage) {
    this.templateSlug = templateSlug;
    this.eventId = eventId;
    this.recipientEmail = recipientEmail;
    this.recipientType = recipientType;
    this.status = status;
    this.providerMessageId = providerMessageId;
    this.providerSlug = providerSlug;
    this.errorMessage = errorMessage;
  }

  @PrePersist
  void onPrePersist() {
    this.createdAt = Instant.now();
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

  public String getRecipientType() {
    return recipientType;
  }

  public EmailDeliveryStatus getStatus() {
    return status;
  }

  public String getProviderMessageId() {
    return providerMessageId;
  }

  public String getProviderSlug() {
    return providerSlug;
  }

  public String getErrorMessage() {
    return errorMessage;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
