package io.b2mash.eventops.automation;

import io.b2mash.eventops.config.AutomationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Fires the campaign engine at the top of every hour in the configured timezone. */
@Component
public class EmailAutomationScheduler {

  private static final Logger log = LoggerFactory.getLogger(EmailAutomationScheduler.class);

  private final NotificationTriggerService triggerService;
  private final AutomationProperties properties;

  public EmailAutomationScheduler(
      NotificationTriggerService triggerService, AutomationProperties properties) {
    this.triggerService = triggerService;
    this.properties = properties;
  }

  @Scheduled(cron = "0 0 * * * *", zone = "${eventops.automation.timezone:Europe/Berlin}")
  public void runHourly() {
    if (!properties.enabled()) {
      log.debug("Email automation disabled, skipping hourly run");
      return;
    }
    try {
      var result = triggerService.processAutomation(false, null);
      if (!result.errors().isEmpty()) {
        log.warn("Email automation finished with {} errors", result.errors().size());
      }
    } catch (Exception e) {
      log.error("Email automation run failed", e);
    }
  }
}
