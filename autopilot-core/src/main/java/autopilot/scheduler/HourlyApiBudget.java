package autopilot.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Generation requests spent over the last rolling hour. Thread-safe.
 */
final class HourlyApiBudget {
  private static final Duration WINDOW = Duration.ofHours(1);

  private final Clock clock;
  private final Deque<Spend> spends = new ArrayDeque<>();
  private long total;

  HourlyApiBudget(Clock clock) {
    this.clock = clock;
  }

  synchronized boolean hasCapacity(int maxPerHour) {
    expire();
    return total < maxPerHour;
  }

  synchronized void record(int apiCalls) {
    if (apiCalls <= 0) {
      return;
    }
    expire();
    spends.addLast(new Spend(clock.instant(), apiCalls));
    total += apiCalls;
  }

  synchronized long used() {
    expire();
    return total;
  }

  private void expire() {
    Instant cutoff = clock.instant().minus(WINDOW);
    while (!spends.isEmpty() && !spends.peekFirst().at.isAfter(cutoff)) {
      total -= spends.removeFirst().calls;
    }
  }

  private record Spend(Instant at, int calls) {}
}
