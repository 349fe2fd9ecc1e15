package io.b2mash.eventops.automation;

import io.b2mash.eventops.event.SchoolEvent;
import io.b2mash.eventops.notification.recipient.Recipient;
import io.b2mash.eventops.notification.recipient.RecipientType;
import io.b2mash.eventops.notification.template.TemplateVariableRenderer;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Builds the {@code {{variable}}} map a campaign template is rendered with. */
@Component
public class CampaignVariables {

  private final String appBaseUrl;

  public CampaignVariables(@Value("${eventops.app.base-url:http://localhost:3000}") String url) {
    this.appBaseUrl = url;
  }

  public Map<String, String> forEvent(SchoolEvent event) {
    var vars = portalLinks();
    vars.put("school_name", nullToEmpty(event.getSchoolName()));
    vars.put("event_date", TemplateVariableRenderer.formatGermanDate(event.getEventDate()));
    vars.put("event_type", event.isKita() ? "KiTa" : "Schule");
    vars.put(
        "event_link",
        event.getAccessCode() != null
            ? appBaseUrl + "/e/" + event.getAccessCode()
            : appBaseUrl + "/parent");
    if (event.getAccessCode() != null) {
      vars.put("access_code", event.getAccessCode());
    }
    if (event.getEventDate() != null) {
      vars.put(TemplateVariableRenderer.EVENT_DATE_ANCHOR, event.getEventDate().toString());
    }
    return vars;
  }

  public Map<String, String> forRecipient(SchoolEvent event, Recipient recipient) {
    var vars = forEvent(event);
    String name = nullToEmpty(recipient.name());
    if (recipient.type() == RecipientType.TEACHER) {
      vars.put("teacher_name", name);
      vars.put("teacher_first_name", firstName(name));
    } else {
      vars.put("parent_name", name);
      vars.put("parent_first_name", firstName(name));
      vars.put("child_name", nullToEmpty(recipient.childName()));
      vars.put("class_name", nullToEmpty(recipient.className()));
    }
    return vars;
  }

  /** Placeholder data for previews sent without a real event. */
  public Map<String, String> samplePreview(LocalDate today) {
    var eventDate = today.plusDays(30);
    var vars = portalLinks();
    vars.put("school_name", "Muster-Grundschule");
    vars.put("event_date", TemplateVariableRenderer.formatGermanDate(eventDate));
    vars.put("event_link", appBaseUrl + "/e/1234");
    vars.put("event_type", "Schule");
    vars.put("teacher_name", "Frau Schmidt");
    vars.put("teacher_first_name", "Maria");
    vars.put("parent_name", "Max Mustermann");
    vars.put("parent_first_name", "Max");
    vars.put("child_name", "Lisa Mustermann");
    vars.put("access_code", "12345");
    vars.put("class_name", "Klasse 3a");
    vars.put(TemplateVariableRenderer.EVENT_DATE_ANCHOR, eventDate.toString());
    return vars;
  }

  private Map<String, String> portalLinks() {
    var vars = new LinkedHashMap<String, String>();
    vars.put("teacher_portal_link", appBaseUrl + "/paedagogen-login");
    vars.put("parent_portal_link", appBaseUrl + "/familie");
    return vars;
  }

  static String firstName(String fullName) {
    if (fullName == null || fullName.isBlank()) {
      return "";
    }
    return fullName.strip().split("\\s+")[0];
  }

  private static String nullToEmpty(String value) {
    return value != null ? value : "";
  }
}
