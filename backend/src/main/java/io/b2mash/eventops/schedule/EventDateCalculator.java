package io.b2mash.eventops.schedule;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Calendar-day arithmetic around an event's anchor date. All "today" and "current hour" values are
 * taken from the injected clock, which is pinned to the platform-home timezone.
 */
@Component
public class EventDateCalculator {

  private final Clock clock;

  public EventDateCalculator(Clock clock) {
    this.clock = clock;
  }

  public LocalDate today() {
    return LocalDate.now(clock);
  }

  /** Hour of day (0-23) in the platform-home timezone. */
  public int currentHour() {
    return ZonedDateTime.now(clock).getHour();
  }

  public LocalDate deadlineFor(LocalDate anchor, int offsetDays) {
    return anchor.plusDays(offsetDays);
  }

  /** Whole calendar days from {@code from} to {@code to}; negative when {@code to} is earlier. */
  public long daysBetween(LocalDate from, LocalDate to) {
    return ChronoUnit.DAYS.between(from, to);
  }

  /** Days left until the deadline, negative once it has passed. */
  public long daysUntil(LocalDate deadline) {
    return daysBetween(today(), deadline);
  }

  /**
   * True when the trigger threshold falls on {@code today}. A negative offset fires before the
   * event, a positive one after it.
   */
  public boolean matchesTrigger(LocalDate eventDate, int triggerOffsetDays, LocalDate today) {
    return eventDate != null && eventDate.equals(today.minusDays(triggerOffsetDays));
  }
}
