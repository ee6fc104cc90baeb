package autopilot.retry;

import autopilot.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CircuitBreakerTest {
  private MutableClock clock;
  private List<String> transitions;
  private CircuitBreaker breaker;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    transitions = new ArrayList<>();
    breaker = CircuitBreaker.builder("generation")
        .failureThreshold(3)
        .resetTimeout(Duration.ofSeconds(60))
        .clock(clock)
        .listener((name, from, to) -> transitions.add(from + "->" + to))
        .build();
  }

  private void fail() {
    assertThrows(IllegalStateException.class, () -> breaker.execute(() -> {
      throw new IllegalStateException("down");
    }));
  }

  // ── Closed ────────────────────────────────────────────────────

  @Test
  void opensAfterThresholdConsecutiveFailures() {
    fail();
    fail();
    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(2, breaker.failureCount());

    fail();
    assertEquals(CircuitState.OPEN, breaker.state());
    assertEquals(List.of("CLOSED->OPEN"), transitions);
  }

  @Test
  void successClearsFailureCount() throws Exception {
    fail();
    fail();
    assertEquals("ok", breaker.execute(() -> "ok"));
    fail();
    fail();

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(2, breaker.failureCount());
  }

  // ── Open ──────────────────────────────────────────────────────

  @Test
  void openBreakerRejectsWithoutCalling() {
    fail();
    fail();
    fail();
    AtomicInteger calls = new AtomicInteger();

    CircuitOpenException error = assertThrows(CircuitOpenException.class,
        () -> breaker.execute(calls::incrementAndGet));

    assertEquals("generation", error.breakerName());
    assertEquals(0, calls.get());
  }

  @Test
  void staysOpenUntilResetTimeoutElapses() {
    fail();
    fail();
    fail();

    clock.advance(Duration.ofSeconds(59));
    assertThrows(CircuitOpenException.class, () -> breaker.execute(() -> "x"));
  }

  // ── Half-open ─────────────────────────────────────────────────

  @Test
  void successfulTrialCloses() throws Exception {
    fail();
    fail();
    fail();
    clock.advance(Duration.ofSeconds(60));

    assertEquals("back", breaker.execute(() -> "back"));
    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(0, breaker.failureCount());
    assertEquals(List.of("CLOSED->OPEN", "OPEN->HALF_OPEN", "HALF_OPEN->CLOSED"), transitions);
  }

  @Test
  void failedTrialReopensAndRestartsWindow() {
    fail();
    fail();
    fail();
    clock.advance(Duration.ofSeconds(61));

    fail();
    assertEquals(CircuitState.OPEN, breaker.state());

    clock.advance(Duration.ofSeconds(30));
    assertThrows(CircuitOpenException.class, () -> breaker.execute(() -> "x"));
  }

  @Test
  void errorDuringTrialReopensInsteadOfWedging() throws Exception {
    fail();
    fail();
    fail();
    clock.advance(Duration.ofSeconds(60));

    assertThrows(AssertionError.class, () -> breaker.execute(() -> {
      throw new AssertionError("trial blew up");
    }));
    assertEquals(CircuitState.OPEN, breaker.state());

    clock.advance(Duration.ofSeconds(60));
    assertEquals("recovered", breaker.execute(() -> "recovered"));
    assertEquals(CircuitState.CLOSED, breaker.state());
  }

  @Test
  void onlyOneTrialRunsWhileHalfOpen() throws Exception {
    fail();
    fail();
    fail();
    clock.advance(Duration.ofSeconds(60));

    CountDownLatch trialStarted = new CountDownLatch(1);
    CountDownLatch releaseTrial = new CountDownLatch(1);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<String> trial = executor.submit(() -> breaker.execute(() -> {
        trialStarted.countDown();
        releaseTrial.await(5, TimeUnit.SECONDS);
        return "trial";
      }));
      assertTrue(trialStarted.await(5, TimeUnit.SECONDS));

      assertThrows(CircuitOpenException.class, () -> breaker.execute(() -> "concurrent"));

      releaseTrial.countDown();
      assertEquals("trial", trial.get(5, TimeUnit.SECONDS));
      assertEquals(CircuitState.CLOSED, breaker.state());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void resetForcesClosed() {
    fail();
    fail();
    fail();

    breaker.reset();

    assertEquals(CircuitState.CLOSED, breaker.state());
    assertEquals(0, breaker.failureCount());
  }

  @Test
  void failingListenerDoesNotBreakCalls() {
    CircuitBreaker noisy = CircuitBreaker.builder("noisy").failureThreshold(1)
        .listener((name, from, to) -> {
          throw new IllegalStateException("listener");
        }).build();

    assertThrows(ArithmeticException.class, () -> noisy.execute(() -> 1 / 0));
    assertEquals(CircuitState.OPEN, noisy.state());
  }

  @Test
  void invalidSettingsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CircuitBreaker.builder("x").failureThreshold(0).build());
    assertThrows(IllegalArgumentException.class,
        () -> CircuitBreaker.builder("x").resetTimeout(Duration.ofSeconds(-1)).build());
    assertThrows(NullPointerException.class, () -> CircuitBreaker.builder(null).build());
  }
}
