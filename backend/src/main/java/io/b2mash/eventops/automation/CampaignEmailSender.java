package io.b2mash.eventops.automation;

import io.b2mash.eventops.exception.InvalidStateException;
import io.b2mash.eventops.integration.email.EmailMessage;
import io.b2mash.eventops.integration.email.EmailProvider;
import io.b2mash.eventops.integration.email.EmailRateLimiter;
import io.b2mash.eventops.integration.email.SendResult;
import io.b2mash.eventops.integration.email.UnsubscribeService;
import io.b2mash.eventops.notification.recipient.Recipient;
import io.b2mash.eventops.notification.template.CampaignLayoutRenderer;
import io.b2mash.eventops.notification.template.EmailTemplate;
import io.b2mash.eventops.notification.template.RenderedEmail;
import io.b2mash.eventops.notification.template.TemplateVariableRenderer;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders a campaign template for one recipient and hands it to the configured {@link
 * EmailProvider}. Parent-side mail gets an unsubscribe link in the footer and the one-click
 * {@code List-Unsubscribe} headers.
 */
@Component
public class CampaignEmailSender {

  private static final Logger log = LoggerFactory.getLogger(CampaignEmailSender.class);

  private final EmailProvider emailProvider;
  private final EmailRateLimiter emailRateLimiter;
  private final TemplateVariableRenderer variableRenderer;
  private final CampaignLayoutRenderer layoutRenderer;
  private final UnsubscribeService unsubscribeService;

  public CampaignEmailSender(
      EmailProvider emailProvider,
      EmailRateLimiter emailRateLimiter,
      TemplateVariableRenderer variableRenderer,
      CampaignLayoutRenderer layoutRenderer,
      UnsubscribeService unsubscribeService) {
    this.emailProvider = emailProvider;
    this.emailRateLimiter = emailRateLimiter;
    this.variableRenderer = variableRenderer;
    this.layoutRenderer = layoutRenderer;
    this.unsubscribeService = unsubscribeService;
  }

  public String providerSlug() {
    return emailProvider.providerId();
  }

  /** Sends used against the hourly cap of the configured provider. */
  public EmailRateLimiter.RateLimitStatus rateLimitStatus() {
    return emailRateLimiter.getStatus(providerSlug());
  }

  public CampaignSendOutcome send(
      EmailTemplate template, Recipient recipient, Map<String, String> variables) {
    String unsubscribeUrl =
        recipient.type().isParentFacing() && recipient.parentId() != null
            ? unsubscribeUrlFor(recipient)
            : null;
    var rendered = render(template, variables, unsubscribeUrl);

    if (!emailRateLimiter.tryAcquire(emailProvider.providerId())) {
      log.warn(
          "Rate limit exceeded for provider={}, not sending '{}' to {}",
          emailProvider.providerId(),
          template.getSlug(),
          recipient.email());
      return new CampaignSendOutcome(
          SendResult.failure("Rate limit exceeded"), emailProvider.providerId(), true);
    }

    var headers = new HashMap<String, String>();
    if (unsubscribeUrl != null) {
      headers.put("List-Unsubscribe", "<" + unsubscribeUrl + ">");
      headers.put("List-Unsubscribe-Post", "List-Unsubscribe=One-Click");
    }
    var message =
        new EmailMessage(
            recipient.email(),
            rendered.subject(),
            rendered.htmlBody(),
            rendered.plainTextBody(),
            null,
            headers);

    var result = emailProvider.sendEmail(message);
    if (result.success()) {
      log.debug(
          "Campaign '{}' sent to {} via {}",
          template.getSlug(),
          recipient.email(),
          emailProvider.providerId());
    } else {
      log.warn(
          "Campaign '{}' to {} failed: {}",
          template.getSlug(),
          recipient.email(),
          result.errorMessage());
    }
    return new CampaignSendOutcome(result, emailProvider.providerId(), false);
  }

  /** Sends a rendered test copy. No unsubscribe link, no rate limiting. */
  public SendResult sendTest(String testAddress, RenderedEmail rendered) {
    var message =
        new EmailMessage(
            testAddress,
            "[TEST] " + rendered.subject(),
            rendered.htmlBody(),
            rendered.plainTextBody(),
            null,
            Map.of());
    return emailProvider.sendEmail(message);
  }

  public RenderedEmail render(
      EmailTemplate template, Map<String, String> variables, String unsubscribeUrl) {
    String subject = variableRenderer.render(template.getSubject(), variables);
    String body = variableRenderer.render(template.getBodyHtml(), variables);
    return layoutRenderer.render(subject, body, unsubscribeUrl);
  }

  private String unsubscribeUrlFor(Recipient recipient) {
    try {
      return unsubscribeService.unsubscribeUrl(recipient.parentId());
    } catch (InvalidStateException e) {
      log.warn("Failed to generate unsubscribe URL for parent {}", recipient.parentId(), e);
      return null;
    }
  }
}
