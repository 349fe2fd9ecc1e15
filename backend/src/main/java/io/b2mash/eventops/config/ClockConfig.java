package io.b2mash.eventops.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

  /** Clock pinned to the platform-home zone, so {@code LocalDate.now(clock)} is the local day. */
  @Bean
  public Clock clock(AutomationProperties properties) {
    return Clock.system(ZoneId.of(properties.timezone()));
  }
}
