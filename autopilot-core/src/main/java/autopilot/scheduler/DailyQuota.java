package autopilot.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Count of operations executed on the current UTC calendar day.
 *
 * <p>Every access rolls the counter over when the UTC date has changed since the last
 * one, so a missed or late midnight reset never leaves a stale count. Thread-safe.
 */
final class DailyQuota {
  private final Clock clock;
  private LocalDate day;
  private int count;

  DailyQuota(Clock clock) {
    this.clock = clock;
    this.day = today();
  }

  synchronized boolean hasCapacity(int maxPerDay) {
    rollover();
    return count < maxPerDay;
  }

  synchronized void record() {
    rollover();
    count++;
  }

  synchronized int count() {
    rollover();
    return count;
  }

  synchronized void reset() {
    day = today();
    count = 0;
  }

  /**
   * Time left until the next UTC midnight.
   */
  Duration untilNextReset() {
    Instant now = clock.instant();
    Instant midnight = LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();
    return Duration.between(now, midnight);
  }

  private void rollover() {
    LocalDate current = today();
    if (!current.equals(day)) {
      day = current;
      count = 0;
    }
  }

  private LocalDate today() {
    return LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC);
  }
}
