package io.b2mash.eventops.integration.email;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmailDeliveryLogServiceTest {

  private static final UUID EVENT_ID = UUID.randomUUID();

  @Mock private EmailDeliveryLogRepository repository;
  @InjectMocks private EmailDeliveryLogService service;

  @Test
  void hasBeenSent_looksUpLowerCasedSentEntry() {
    when(repository.existsByTemplateSlugAndEventIdAndRecipientEmailAndStatus(
            "reminder", EVENT_ID, "anna@example.de", EmailDeliveryStatus.SENT))
        .thenReturn(true);

    assertThat(service.hasBeenSent("reminder", EVENT_ID, " Anna@Example.DE ")).isTrue();
  }

  @Test
  void record_mapsSendResultToStatus() {
    when(repository.save(any(EmailDeliveryLog.class))).thenAnswer(inv -> inv.getArgument(0));

    var sent =
        service.record(
            "reminder",
            EVENT_ID,
            "anna@example.de",
            "parent",
            "smtp",
            new SendResult(true, "m-1", null));
    var failed =
        service.record(
            "reminder", EVENT_ID, "ben@example.de", "parent", "smtp", SendResult.failure("boom"));

    assertThat(sent.getStatus()).isEqualTo(EmailDeliveryStatus.SENT);
    assertThat(sent.getProviderMessageId()).isEqualTo("m-1");
    assertThat(failed.getStatus()).isEqualTo(EmailDeliveryStatus.FAILED);
    assertThat(failed.getErrorMessage()).isEqualTo("boom");
  }

  @Test
  void recordSkipped_explainsDuplicate() {
    when(repository.save(any(EmailDeliveryLog.class))).thenAnswer(inv -> inv.getArgument(0));

    service.recordSkipped("reminder", EVENT_ID, "Anna@example.de", "non-buyer");

    var captor = ArgumentCaptor.forClass(EmailDeliveryLog.class);
    verify(repository).save(captor.capture());
    assertThat(captor.getValue().getStatus()).isEqualTo(EmailDeliveryStatus.SKIPPED);
    assertThat(captor.getValue().getRecipientEmail()).isEqualTo("anna@example.de");
    assertThat(captor.getValue().getErrorMessage())
        .isEqualTo(EmailDeliveryLogService.ALREADY_SENT_MESSAGE);
  }

  @Test
  void recordRateLimited_isLoggedAsFailure() {
    when(repository.save(any(EmailDeliveryLog.class))).thenAnswer(inv -> inv.getArgument(0));

    var entry =
        service.recordRateLimited("reminder", EVENT_ID, "anna@example.de", "parent", "smtp");

    assertThat(entry.getStatus()).isEqualTo(EmailDeliveryStatus.FAILED);
    assertThat(entry.getErrorMessage()).isEqualTo(EmailDeliveryLogService.RATE_LIMITED_MESSAGE);
  }
}
