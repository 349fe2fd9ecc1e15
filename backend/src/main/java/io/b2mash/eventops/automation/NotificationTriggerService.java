package io.b2mash.eventops.automation;

import io.b2mash.eventops.config.AutomationProperties;
import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.event.SchoolEventRepository;
import io.b2mash.eventops.integration.email.EmailDeliveryLogService;
import io.b2mash.eventops.integration.email.SendResult;
import io.b2mash.eventops.notification.recipient.Recipient;
import io.b2mash.eventops.notification.recipient.RecipientResolver;
import io.b2mash.eventops.notification.template.EmailTemplate;
import io.b2mash.eventops.notification.template.EmailTemplateRepository;
import io.b2mash.eventops.schedule.EventDateCalculator;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Hourly campaign engine. For every active template whose trigger hour is now, finds the events
 * whose date lies {@code triggerOffsetDays} away from today, resolves recipients and sends each
 * one at most once.
 *
 * <p>A recipient is skipped when the delivery log already holds a SENT entry or when the dispatch
 * claim for the slot cannot be inserted. Failures are contained per template, event and
 * recipient; the run always finishes and reports them in {@link AutomationResult#errors()}.
 */
@Service
public class NotificationTriggerService {

  private static final Logger log = LoggerFactory.getLogger(NotificationTriggerService.class);

  static final String DRY_RUN_MESSAGE_ID = "dry-run";
  static final String NO_ACTIVE_TEMPLATES = "No active email templates found";

  private final EmailTemplateRepository templateRepository;
  private final SchoolEventRepository eventRepository;
  private final RecipientResolver recipientResolver;
  private final CampaignVariables campaignVariables;
  private final CampaignEmailSender emailSender;
  private final EmailDeliveryLogService deliveryLogService;
  private final DispatchClaimService dispatchClaimService;
  private final EventDateCalculator dateCalculator;
  private final Clock clock;
  private final Duration sendDelay;

  public NotificationTriggerService(
      EmailTemplateRepository templateRepository,
      SchoolEventRepository eventRepository,
      RecipientResolver recipientResolver,
      CampaignVariables campaignVariables,
      CampaignEmailSender emailSender,
      EmailDeliveryLogService deliveryLogService,
      DispatchClaimService dispatchClaimService,
      EventDateCalculator dateCalculator,
      Clock clock,
      AutomationProperties properties) {
    this.templateRepository = templateRepository;
    this.eventRepository = eventRepository;
    this.recipientResolver = recipientResolver;
    this.campaignVariables = campaignVariables;
    this.emailSender = emailSender;
    this.deliveryLogService = deliveryLogService;
    this.dispatchClaimService = dispatchClaimService;
    this.dateCalculator = dateCalculator;
    this.clock = clock;
    this.sendDelay = properties.sendDelay();
  }

  public AutomationResult processAutomation(boolean dryRun, Integer hourOverride) {
    var run = new RunState(dryRun);
    int currentHour = hourOverride != null ? hourOverride : dateCalculator.currentHour();
    var today = dateCalculator.today();

    var templates = templateRepository.findByActiveTrueOrderBySlugAsc();
    if (templates.isEmpty()) {
      log.warn(NO_ACTIVE_TEMPLATES);
      run.errors.add(NO_ACTIVE_TEMPLATES);
      return run.toResult(Instant.now(clock), 0);
    }

    var dueTemplates = templates.stream().filter(t -> t.getTriggerHour() == currentHour).toList();
    if (dueTemplates.isEmpty()) {
      log.debug("No templates due at hour {}", currentHour);
      return run.toResult(Instant.now(clock), 0);
    }

    var events = eventRepository.findAll();
    for (var template : dueTemplates) {
      try {
        processTemplate(template, events, today, run);
      } catch (RuntimeException e) {
        log.error("Failed to process template {}", template.getSlug(), e);
        run.errors.add("Template " + template.getSlug() + ": " + e.getMessage());
      }
    }

    log.info(
        "Automation run at hour {} (dryRun={}): {} templates, {} sent, {} failed, {} skipped",
        currentHour,
        dryRun,
        dueTemplates.size(),
        run.sent,
        run.failed,
        run.skipped);
    return run.toResult(Instant.now(clock), dueTemplates.size());
  }

  /**
   * Renders a template and sends it to {@code testAddress} without dedup or delivery logging. With
   * an event, the first resolved recipient's data is used (event data only if none resolves);
   * without one, sample data.
   */
  public TestEmailResult sendTestEmail(UUID templateId, String testAddress, UUID eventId) {
    var template = templateRepository.findById(templateId).orElse(null);
    if (template == null) {
      return TestEmailResult.failure("Template not found");
    }

    Map<String, String> variables;
    if (eventId != null) {
      var event = eventRepository.findById(eventId).orElse(null);
      if (event == null) {
        return TestEmailResult.failure("Event not found");
      }
      var recipients = recipientResolver.resolve(event, template.getAudiences());
      variables =
          recipients.isEmpty()
              ? campaignVariables.forEvent(event)
              : campaignVariables.forRecipient(event, recipients.get(0));
    } else {
      variables = campaignVariables.samplePreview(dateCalculator.today());
    }

    var rendered = emailSender.render(template, variables, null);
    try {
      var result = emailSender.sendTest(testAddress, rendered);
      log.info(
          "Test send of template {} to {}: success={}",
          template.getSlug(),
          testAddress,
          result.success());
      return new TestEmailResult(
          result.success(), result.providerMessageId(), result.errorMessage(), rendered);
    } catch (RuntimeException e) {
      log.error("Test send of template {} failed", template.getSlug(), e);
      return new TestEmailResult(false, null, e.getMessage(), rendered);
    }
  }

  private void processTemplate(
      EmailTemplate template, List<SchoolEvent> events, LocalDate today, RunState run) {
    for (var event : events) {
      if (!isEligible(template, event, today)) {
        continue;
      }
      try {
        var recipients = recipientResolver.resolve(event, template.getAudiences());
        log.debug(
            "Template {} matches event {} with {} recipients",
            template.getSlug(),
            event.getId(),
            recipients.size());
        for (var recipient : recipients) {
          processRecipient(template, event, recipient, run);
        }
      } catch (RuntimeException e) {
        log.error(
            "Failed to process event {} for template {}", event.getId(), template.getSlug(), e);
        run.errors.add(
            "Template " + template.getSlug() + ", event " + event.getId() + ": " + e.getMessage());
      }
    }
  }

  private boolean isEligible(EmailTemplate template, SchoolEvent event, LocalDate today) {
    return event.isActive()
        && event.getEventDate() != null
        && dateCalculator.matchesTrigger(
            event.getEventDate(), template.getTriggerOffsetDays(), today)
        && template.appliesTo(event);
  }

  /**
   * Dedup, claim and send for one recipient. Any failure is confined to this recipient. The
   * dispatch claim is released only when the provider did not accept the mail; once it has, a
   * failing log write keeps the claim so that a later run cannot send twice.
   */
  private void processRecipient(
      EmailTemplate template, SchoolEvent event, Recipient recipient, RunState run) {
    String slug = template.getSlug();

    if (run.dryRun) {
      run.sent++;
      run.detail(slug, recipient, "sent", DRY_RUN_MESSAGE_ID, null);
      return;
    }

    Optional<DispatchClaim> claim = Optional.empty();
    CampaignSendOutcome outcome;
    try {
      if (deliveryLogService.hasBeenSent(slug, event.getId(), recipient.email())) {
        skip(slug, event, recipient, run);
        return;
      }
      claim = dispatchClaimService.tryClaim(slug, event.getId(), recipient.email());
      if (claim.isEmpty()) {
        skip(slug, event, recipient, run);
        return;
      }
      var variables = campaignVariables.forRecipient(event, recipient);
      outcome = emailSender.send(template, recipient, variables);
    } catch (RuntimeException e) {
      log.error("Failed to send {} to {} for event {}", slug, recipient.email(), event.getId(), e);
      claim.ifPresent(dispatchClaimService::release);
      recordQuietly(
          () ->
              deliveryLogService.record(
                  slug,
                  event.getId(),
                  recipient.email(),
                  recipient.type().logValue(),
                  emailSender.providerSlug(),
                  SendResult.failure(e.getMessage())),
          slug,
          recipient,
          run);
      run.failed++;
      run.detail(slug, recipient, "failed", null, e.getMessage());
      run.errors.add(slug + " -> " + recipient.email() + ": " + e.getMessage());
      if (claim.isPresent()) {
        pauseBetweenSends();
      }
      return;
    }

    var result = outcome.result();
    if (result.success()) {
      run.sent++;
      run.detail(slug, recipient, "sent", result.providerMessageId(), null);
    } else {
      dispatchClaimService.release(claim.get());
      run.failed++;
      run.detail(slug, recipient, "failed", null, result.errorMessage());
    }
    recordQuietly(() -> recordOutcome(slug, event, recipient, outcome), slug, recipient, run);

    pauseBetweenSends();
  }

  private void recordOutcome(
      String slug, SchoolEvent event, Recipient recipient, CampaignSendOutcome outcome) {
    String type = recipient.type().logValue();
    if (outcome.rateLimited()) {
      deliveryLogService.recordRateLimited(
          slug, event.getId(), recipient.email(), type, outcome.providerSlug());
    } else {
      deliveryLogService.record(
          slug, event.getId(), recipient.email(), type, outcome.providerSlug(), outcome.result());
    }
  }

  /** Delivery-log writes after a send never undo the send's counters or its claim. */
  private void recordQuietly(Runnable write, String slug, Recipient recipient, RunState run) {
    try {
      write.run();
    } catch (RuntimeException e) {
      log.error("Failed to write delivery log for {} to {}", slug, recipient.email(), e);
      run.errors.add(
          slug + " -> " + recipient.email() + ": delivery log not written: " + e.getMessage());
    }
  }

  private void skip(String slug, SchoolEvent event, Recipient recipient, RunState run) {
    log.debug(
        "Skipping {} for {} on event {}: already sent", slug, recipient.email(), event.getId());
    deliveryLogService.recordSkipped(
        slug, event.getId(), recipient.email(), recipient.type().logValue());
    run.skipped++;
    run.detail(slug, recipient, "skipped", null, null);
  }

  private void pauseBetweenSends() {
    if (sendDelay == null || sendDelay.isZero() || sendDelay.isNegative()) {
      return;
    }
    try {
      Thread.sleep(sendDelay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while pausing between campaign sends");
    }
  }

  /** Mutable counters for a single run. */
  private static final class RunState {
    private final boolean dryRun;
    private final List<SendDetail> details = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private int sent;
    private int failed;
    private int skipped;

    private RunState(boolean dryRun) {
      this.dryRun = dryRun;
    }

    private void detail(
        String slug, Recipient recipient, String status, String messageId, String error) {
      details.add(
          new SendDetail(
              slug,
              recipient.eventId(),
              recipient.email(),
              recipient.type().logValue(),
              status,
              messageId,
              error));
    }

    private AutomationResult toResult(Instant processedAt, int templatesProcessed) {
      return new AutomationResult(
          processedAt,
          templatesProcessed,
          sent,
          failed,
          skipped,
          List.copyOf(details),
          List.copyOf(errors));
    }
  }
}
