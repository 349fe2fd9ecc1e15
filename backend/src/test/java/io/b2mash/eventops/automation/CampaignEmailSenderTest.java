package io.b2mash.eventops.automation;

import static io.b2mash.eventops.testutil.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.eventops.integration.email.EmailMessage;
import io.b2mash.eventops.integration.email.EmailProvider;
import io.b2mash.eventops.integration.email.EmailRateLimiter;
import io.b2mash.eventops.integration.email.SendResult;
import io.b2mash.eventops.integration.email.UnsubscribeService;
import io.b2mash.eventops.notification.recipient.Recipient;
import io.b2mash.eventops.notification.recipient.RecipientType;
import io.b2mash.eventops.notification.template.Audience;
import io.b2mash.eventops.notification.template.CampaignLayoutRenderer;
import io.b2mash.eventops.notification.template.EmailTemplate;
import io.b2mash.eventops.notification.template.TemplateVariableRenderer;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CampaignEmailSenderTest {

  private static final UUID EVENT_ID = UUID.randomUUID();

  @Mock private EmailProvider emailProvider;
  @Mock private EmailRateLimiter rateLimiter;

  private final UnsubscribeService unsubscribeService =
      new UnsubscribeService("test-secret-for-unit-tests", "https://minimusiker.app", null);
  private CampaignEmailSender sender;
  private EmailTemplate template;

  @BeforeEach
  void setUp() {
    sender =
        new CampaignEmailSender(
            emailProvider,
            rateLimiter,
            new TemplateVariableRenderer(),
            new CampaignLayoutRenderer(),
            unsubscribeService);
    template =
        withId(
            new EmailTemplate(
                "reminder",
                "Erinnerung",
                List.of(Audience.PARENT, Audience.TEACHER),
                -7,
                9,
                "Hallo {{parent_first_name}}{{teacher_first_name}}",
                "<p>{{school_name}}</p>"),
            UUID.randomUUID());
  }

  @Test
  void parentMailCarriesUnsubscribeHeadersAndFooterLink() {
    var parent =
        new Recipient(
            "anna@example.de",
            "Anna",
            RecipientType.PARENT,
            EVENT_ID,
            UUID.randomUUID(),
            "Lisa",
            "3a");
    when(emailProvider.providerId()).thenReturn("noop");
    when(rateLimiter.tryAcquire("noop")).thenReturn(true);
    when(emailProvider.sendEmail(any())).thenReturn(new SendResult(true, "m-1", null));

    var outcome =
        sender.send(
            template,
            parent,
            Map.of("parent_first_name", "Anna", "school_name", "Grundschule Am Park"));

    assertThat(outcome.result().success()).isTrue();
    assertThat(outcome.rateLimited()).isFalse();
    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).sendEmail(captor.capture());
    var message = captor.getValue();
    assertThat(message.to()).isEqualTo("anna@example.de");
    assertThat(message.subject()).isEqualTo("Hallo Anna");
    assertThat(message.htmlBody()).contains("Grundschule Am Park").contains("E-Mail-Einstellungen");
    assertThat(message.headers())
        .containsEntry("List-Unsubscribe-Post", "List-Unsubscribe=One-Click")
        .hasEntrySatisfying(
            "List-Unsubscribe",
            v -> assertThat(v).startsWith("<https://minimusiker.app/api/email/unsubscribe"));
  }

  @Test
  void teacherMailHasNoUnsubscribeLink() {
    var teacher = Recipient.teacher("lehrer@schule.de", "Maria Schmidt", EVENT_ID);
    when(emailProvider.providerId()).thenReturn("noop");
    when(rateLimiter.tryAcquire("noop")).thenReturn(true);
    when(emailProvider.sendEmail(any())).thenReturn(new SendResult(true, "m-2", null));

    sender.send(template, teacher, Map.of("teacher_first_name", "Maria"));

    var captor = ArgumentCaptor.forClass(EmailMessage.class);
    verify(emailProvider).sendEmail(captor.capture());
    assertThat(captor.getValue().headers()).isEmpty();
    assertThat(captor.getValue().htmlBody()).doesNotContain("E-Mail-Einstellungen");
  }

  @Test
  void rateLimitedSendNeverReachesProvider() {
    var teacher = Recipient.teacher("lehrer@schule.de", "Maria Schmidt", EVENT_ID);
    when(emailProvider.providerId()).thenReturn("smtp");
    when(rateLimiter.tryAcquire("smtp")).thenReturn(false);

    var outcome = sender.send(template, teacher, Map.of());

    assertThat(outcome.rateLimited()).isTrue();
    assertThat(outcome.result().success()).isFalse();
    assertThat(outcome.providerSlug()).isEqualTo("smtp");
    verify(emailProvider, never()).sendEmail(any());
  }

  @Test
  void rateLimitStatusIsReportedForConfiguredProvider() {
    when(emailProvider.providerId()).thenReturn("smtp");
    when(rateLimiter.getStatus("smtp"))
        .thenReturn(new EmailRateLimiter.RateLimitStatus(42, 500, true));

    var status = sender.rateLimitStatus();

    assertThat(status.currentCount()).isEqualTo(42);
    assertThat(status.limit()).isEqualTo(500);
  }
}
