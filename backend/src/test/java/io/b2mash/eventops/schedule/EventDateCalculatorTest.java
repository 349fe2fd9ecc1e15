package io.b2mash.eventops.schedule;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

class EventDateCalculatorTest {

  private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

  private final EventDateCalculator calculator =
      new EventDateCalculator(Clock.fixed(Instant.parse("2026-01-18T08:30:00Z"), BERLIN));

  @Test
  void matchesTrigger_firesOnlyOnThresholdDay() {
    var eventDate = LocalDate.of(2026, 3, 15);

    assertThat(calculator.matchesTrigger(eventDate, -56, LocalDate.of(2026, 1, 18))).isTrue();
    assertThat(calculator.matchesTrigger(eventDate, -56, LocalDate.of(2026, 1, 17))).isFalse();
    assertThat(calculator.matchesTrigger(eventDate, -56, LocalDate.of(2026, 1, 19))).isFalse();
  }

  @Test
  void matchesTrigger_positiveOffsetFiresAfterEvent() {
    var eventDate = LocalDate.of(2026, 3, 15);

    assertThat(calculator.matchesTrigger(eventDate, 7, LocalDate.of(2026, 3, 22))).isTrue();
    assertThat(calculator.matchesTrigger(null, 7, LocalDate.of(2026, 3, 22))).isFalse();
  }

  @Test
  void today_andCurrentHour_useConfiguredZone() {
    assertThat(calculator.today()).isEqualTo(LocalDate.of(2026, 1, 18));
    // 08:30 UTC is 09:30 in Berlin during winter time
    assertThat(calculator.currentHour()).isEqualTo(9);
  }

  @Test
  void today_rollsOverAtLocalMidnight() {
    var lateEvening =
        new EventDateCalculator(Clock.fixed(Instant.parse("2026-01-18T23:30:00Z"), BERLIN));

    assertThat(lateEvening.today()).isEqualTo(LocalDate.of(2026, 1, 19));
    assertThat(lateEvening.currentHour()).isZero();
  }

  @Test
  void daysUntil_isNegativeOnceDeadlinePassed() {
    assertThat(calculator.daysUntil(LocalDate.of(2026, 1, 21))).isEqualTo(3);
    assertThat(calculator.daysUntil(LocalDate.of(2026, 1, 18))).isZero();
    assertThat(calculator.daysUntil(LocalDate.of(2026, 1, 15))).isEqualTo(-3);
  }

  @Test
  void deadlineFor_addsSignedOffset() {
    var anchor = LocalDate.of(2026, 3, 15);

    assertThat(calculator.deadlineFor(anchor, -18)).isEqualTo(LocalDate.of(2026, 2, 25));
    assertThat(calculator.deadlineFor(anchor, 1)).isEqualTo(LocalDate.of(2026, 3, 16));
  }
}
