package io.b2mash.eventops.notification.template;

import io.b2mash.eventops.event.EventTier;
import io.b2mash.eventops.exception.ResourceNotFoundException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EmailTemplateController {

  private final EmailTemplateRepository emailTemplateRepository;

  public EmailTemplateController(EmailTemplateRepository emailTemplateRepository) {
    this.emailTemplateRepository = emailTemplateRepository;
  }

  @GetMapping("/api/email-templates")
  public ResponseEntity<List<EmailTemplateResponse>> list() {
    return ResponseEntity.ok(
        emailTemplateRepository.findAllByOrderBySlugAsc().stream()
            .map(EmailTemplateResponse::from)
            .toList());
  }

  @PatchMapping("/api/email-templates/{templateId}/active")
  @Transactional
  public ResponseEntity<EmailTemplateResponse> setActive(
      @PathVariable UUID templateId, @Valid @RequestBody SetActiveRequest request) {
    var template =
        emailTemplateRepository
            .findById(templateId)
            .orElseThrow(() -> new ResourceNotFoundException("EmailTemplate", templateId));
    template.setActive(request.active());
    return ResponseEntity.ok(EmailTemplateResponse.from(emailTemplateRepository.save(template)));
  }

  public record SetActiveRequest(@NotNull Boolean active) {}

  public record EmailTemplateResponse(
      UUID id,
      String slug,
      String name,
      List<Audience> audiences,
      int triggerOffsetDays,
      int triggerHour,
      String subject,
      boolean active,
      EventTier tier,
      boolean onlyUnder100) {

    public static EmailTemplateResponse from(EmailTemplate template) {
      return new EmailTemplateResponse(
          template.getId(),
          template.getSlug(),
          template.getName(),
          template.getAudiences(),
          template.getTriggerOffsetDays(),
          template.getTriggerHour(),
          template.getSubject(),
          template.isActive(),
          template.getTier(),
          template.isOnlyUnder100());
    }
  }
}
