package io.b2mash.eventops.automation;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.eventops.TestcontainersConfiguration;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class DispatchClaimServiceIntegrationTest {

  private static final String SLUG = "parent_reminder_8_weeks";

  @Autowired private DispatchClaimService dispatchClaimService;
  @Autowired private DispatchClaimRepository dispatchClaimRepository;

  @Test
  void secondClaimForSameSlotIsRejectedByUniqueConstraint() {
    var eventId = UUID.randomUUID();

    var first = dispatchClaimService.tryClaim(SLUG, eventId, "anna@example.de");
    var second = dispatchClaimService.tryClaim(SLUG, eventId, "anna@example.de");

    assertThat(first).isPresent();
    assertThat(first.get().getId()).isNotNull();
    assertThat(second).isEmpty();
    assertThat(dispatchClaimRepository.findById(first.get().getId())).isPresent();
  }

  @Test
  void claimIsCaseInsensitiveOnRecipientEmail() {
    var eventId = UUID.randomUUID();

    assertThat(dispatchClaimService.tryClaim(SLUG, eventId, "anna@example.de")).isPresent();
    assertThat(dispatchClaimService.tryClaim(SLUG, eventId, " Anna@Example.DE ")).isEmpty();
  }

  @Test
  void otherEventOrTemplateIsASeparateSlot() {
    var eventId = UUID.randomUUID();

    assertThat(dispatchClaimService.tryClaim(SLUG, eventId, "anna@example.de")).isPresent();
    assertThat(dispatchClaimService.tryClaim(SLUG, UUID.randomUUID(), "anna@example.de"))
        .isPresent();
    assertThat(dispatchClaimService.tryClaim("teacher_welcome", eventId, "anna@example.de"))
        .isPresent();
  }

  @Test
  void releasedSlotCanBeClaimedAgain() {
    var eventId = UUID.randomUUID();
    var claim = dispatchClaimService.tryClaim(SLUG, eventId, "ben@example.de").orElseThrow();

    dispatchClaimService.release(claim);

    assertThat(dispatchClaimRepository.findById(claim.getId())).isEmpty();
    assertThat(dispatchClaimService.tryClaim(SLUG, eventId, "ben@example.de")).isPresent();
  }
}
