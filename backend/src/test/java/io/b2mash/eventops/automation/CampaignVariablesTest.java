package io.b2mash.eventops.automation;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.notification.recipient.Recipient;
import io.b2mash.eventops.notification.recipient.RecipientType;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class CampaignVariablesTest {

  private final CampaignVariables variables = new CampaignVariables("https://app.minimusiker.de");

  @Test
  void forEvent_usesAccessCodeLinkWhenPresent() {
    var event = new SchoolEvent("EVT-1", "Grundschule Am Park", LocalDate.of(2026, 3, 15));
    event.setAccessCode("4711");

    var vars = variables.forEvent(event);

    assertThat(vars)
        .containsEntry("school_name", "Grundschule Am Park")
        .containsEntry("event_date", "15.03.2026")
        .containsEntry("event_type", "Schule")
        .containsEntry("event_link", "https://app.minimusiker.de/e/4711")
        .containsEntry("access_code", "4711")
        .containsEntry("_event_date_iso", "2026-03-15")
        .containsEntry("teacher_portal_link", "https://app.minimusiker.de/paedagogen-login")
        .containsEntry("parent_portal_link", "https://app.minimusiker.de/familie");
  }

  @Test
  void forEvent_fallsBackToParentPortalAndMarksKita() {
    var event = new SchoolEvent("EVT-2", "KiTa Sonnenschein", LocalDate.of(2026, 5, 2));
    event.setSizeAndKind(true, true);

    var vars = variables.forEvent(event);

    assertThat(vars)
        .containsEntry("event_type", "KiTa")
        .containsEntry("event_link", "https://app.minimusiker.de/parent")
        .doesNotContainKey("access_code");
  }

  @Test
  void forRecipient_teacherGetsTeacherNames() {
    var event = new SchoolEvent("EVT-1", "Grundschule Am Park", LocalDate.of(2026, 3, 15));
    var teacher = Recipient.teacher("anna@schule.de", "Anna Berger", UUID.randomUUID());

    var vars = variables.forRecipient(event, teacher);

    assertThat(vars)
        .containsEntry("teacher_name", "Anna Berger")
        .containsEntry("teacher_first_name", "Anna")
        .doesNotContainKey("parent_name");
  }

  @Test
  void forRecipient_parentGetsChildAndClass() {
    var event = new SchoolEvent("EVT-1", "Grundschule Am Park", LocalDate.of(2026, 3, 15));
    var parent =
        new Recipient(
            "eltern@example.de",
            "Jana Koch",
            RecipientType.PARENT,
            event.getId(),
            UUID.randomUUID(),
            "Mia",
            null);

    var vars = variables.forRecipient(event, parent);

    assertThat(vars)
        .containsEntry("parent_name", "Jana Koch")
        .containsEntry("parent_first_name", "Jana")
        .containsEntry("child_name", "Mia")
        .containsEntry("class_name", "")
        .doesNotContainKey("teacher_name");
  }

  @Test
  void samplePreview_datesEventThirtyDaysAhead() {
    var vars = variables.samplePreview(LocalDate.of(2026, 10, 19));

    assertThat(vars)
        .containsEntry("school_name", "Muster-Grundschule")
        .containsEntry("event_date", "18.11.2026")
        .containsEntry("_event_date_iso", "2026-11-18");
  }

  @Test
  void firstName_handlesBlankAndExtraWhitespace() {
    assertThat(CampaignVariables.firstName(null)).isEmpty();
    assertThat(CampaignVariables.firstName("   ")).isEmpty();
    assertThat(CampaignVariables.firstName("  Jana   Koch ")).isEqualTo("Jana");
  }
}
