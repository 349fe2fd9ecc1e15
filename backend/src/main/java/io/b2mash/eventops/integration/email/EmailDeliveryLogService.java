package io.b2mash.eventops.integration.email;

import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Append-only delivery log. Recipient emails are stored lower-cased so lookups are exact. */
@Service
public class EmailDeliveryLogService {

  static final String RATE_LIMITED_MESSAGE = "Rate limit exceeded";
  static final String ALREADY_SENT_MESSAGE =
      "Email already sent for this template/event/recipient combination";

  private final EmailDeliveryLogRepository repository;

  public EmailDeliveryLogService(EmailDeliveryLogRepository repository) {
    this.repository = repository;
  }

  @Transactional(readOnly = true)
  public boolean hasBeenSent(String templateSlug, UUID eventId, String recipientEmail) {
    return repository.existsByTemplateSlugAndEventIdAndRecipientEmailAndStatus(
        templateSlug, eventId, normalize(recipientEmail), EmailDeliveryStatus.SENT);
  }

  @Transactional
  public EmailDeliveryLog record(
      String templateSlug,
      UUID eventId,
      String recipientEmail,
      String recipientType,
      String providerSlug,
      SendResult result) {
    var status = result.success() ? EmailDeliveryStatus.SENT : EmailDeliveryStatus.FAILED;
    return repository.save(
        new EmailDeliveryLog(
            templateSlug,
            eventId,
            normalize(recipientEmail),
            recipientType,
            status,
            result.providerMessageId(),
            providerSlug,
            result.errorMessage()));
  }

  @Transactional
  public EmailDeliveryLog recordSkipped(
      String templateSlug, UUID eventId, String recipientEmail, String recipientType) {
    return repository.save(
        new EmailDeliveryLog(
            templateSlug,
            eventId,
            normalize(recipientEmail),
            recipientType,
            EmailDeliveryStatus.SKIPPED,
            null,
            null,
            ALREADY_SENT_MESSAGE));
  }

  @Transactional
  public EmailDeliveryLog recordRateLimited(
      String templateSlug,
      UUID eventId,
      String recipientEmail,
      String recipientType,
      String providerSlug) {
    return record(
        templateSlug,
        eventId,
        recipientEmail,
        recipientType,
        providerSlug,
        SendResult.failure(RATE_LIMITED_MESSAGE));
  }

  @Transactional(readOnly = true)
  public List<EmailDeliveryLog> findForEvent(UUID eventId) {
    return repository.findByEventIdOrderByCreatedAtDesc(eventId);
  }

  static String normalize(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }
}
