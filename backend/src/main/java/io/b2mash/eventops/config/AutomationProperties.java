package io.b2mash.eventops.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the notification trigger engine.
 *
 * @param timezone platform-home timezone used for "today" and the current trigger hour
 * @param sendDelay pause between two outbound sends within one run
 * @param enabled whether the hourly scheduler fires; manual runs are always allowed
 */
@ConfigurationProperties(prefix = "eventops.automation")
public record AutomationProperties(String timezone, Duration sendDelay, boolean enabled) {

  public AutomationProperties {
    if (timezone == null || timezone.isBlank()) {
      timezone = "Europe/Berlin";
    }
    if (sendDelay == null) {
      sendDelay = Duration.ofMillis(500);
    }
  }
}
