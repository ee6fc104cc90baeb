package autopilot.scheduler;

import autopilot.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class HourlyApiBudgetTest {

  @Test
  void spendsWithinTheHourCount() {
    MutableClock clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
    HourlyApiBudget budget = new HourlyApiBudget(clock);

    budget.record(2);
    clock.advance(Duration.ofMinutes(30));
    budget.record(1);

    assertEquals(3, budget.used());
    assertFalse(budget.hasCapacity(3));
    assertTrue(budget.hasCapacity(4));
  }

  @Test
  void spendsExpireAfterOneHour() {
    MutableClock clock = new MutableClock(Instant.parse("2026-05-01T10:00:00Z"));
    HourlyApiBudget budget = new HourlyApiBudget(clock);
    budget.record(5);
    clock.advance(Duration.ofMinutes(30));
    budget.record(1);

    clock.advance(Duration.ofMinutes(30));

    assertEquals(1, budget.used());
    clock.advance(Duration.ofMinutes(30));
    assertEquals(0, budget.used());
  }

  @Test
  void nonPositiveSpendIsIgnored() {
    HourlyApiBudget budget = new HourlyApiBudget(new MutableClock(Instant.parse("2026-05-01T10:00:00Z")));

    budget.record(0);
    budget.record(-2);

    assertEquals(0, budget.used());
  }
}
