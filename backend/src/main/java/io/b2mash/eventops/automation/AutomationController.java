package io.b2mash.eventops.automation;

import io.b2mash.eventops.integration.email.EmailDeliveryLog;
import io.b2mash.eventops.integration.email.EmailDeliveryLogService;
import io.b2mash.eventops.integration.email.EmailDeliveryStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AutomationController {

  private final NotificationTriggerService triggerService;
  private final EmailDeliveryLogService deliveryLogService;
  private final CampaignEmailSender emailSender;

  public AutomationController(
      NotificationTriggerService triggerService,
      EmailDeliveryLogService deliveryLogService,
      CampaignEmailSender emailSender) {
    this.triggerService = triggerService;
    this.deliveryLogService = deliveryLogService;
    this.emailSender = emailSender;
  }

  @PostMapping("/api/internal/automation/run")
  public ResponseEntity<AutomationResult> run(
      @RequestParam(defaultValue = "false") boolean dryRun,
      @RequestParam(required = false) Integer hour) {
    return ResponseEntity.ok(triggerService.processAutomation(dryRun, hour));
  }

  @GetMapping("/api/internal/automation/rate-limit")
  public ResponseEntity<RateLimitResponse> rateLimit() {
    var status = emailSender.rateLimitStatus();
    return ResponseEntity.ok(
        new RateLimitResponse(
            emailSender.providerSlug(), status.currentCount(), status.limit(), status.allowed()));
  }

  @PostMapping("/api/email-templates/{templateId}/test")
  public ResponseEntity<TestEmailResult> sendTest(
      @PathVariable UUID templateId, @Valid @RequestBody TestEmailRequest request) {
    return ResponseEntity.ok(
        triggerService.sendTestEmail(templateId, request.testAddress(), request.eventId()));
  }

  @GetMapping("/api/events/{eventId}/email-log")
  public ResponseEntity<List<DeliveryLogResponse>> deliveryLog(@PathVariable UUID eventId) {
    return ResponseEntity.ok(
        deliveryLogService.findForEvent(eventId).stream().map(DeliveryLogResponse::from).toList());
  }

  public record RateLimitResponse(
      String provider, int sentThisHour, int hourlyLimit, boolean allowed) {}

  public record TestEmailRequest(@NotBlank @Email String testAddress, UUID eventId) {}

  public record DeliveryLogResponse(
      UUID id,
      String templateSlug,
      String recipientEmail,
      String recipientType,
      EmailDeliveryStatus status,
      String providerMessageId,
      String errorMessage,
      Instant createdAt) {

    static DeliveryLogResponse from(EmailDeliveryLog entry) {
      return new DeliveryLogResponse(
          entry.getId(),
          entry.getTemplateSlug(),
          entry.getRecipientEmail(),
          entry.getRecipientType(),
          entry.getStatus(),
          entry.getProviderMessageId(),
          entry.getErrorMessage(),
          entry.getCreatedAt());
    }
  }
}
