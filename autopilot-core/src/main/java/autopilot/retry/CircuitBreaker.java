package autopilot.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fail-fast guard for one call site against one unreliable dependency.
 *
 * <ul>
 *   <li><b>CLOSED</b>: calls run; each failure increments a counter, a success clears
 *       it, and reaching {@code failureThreshold} opens the breaker.</li>
 *   <li><b>OPEN</b>: calls fail with {@link CircuitOpenException} without running,
 *       until {@code resetTimeout} has elapsed since the last failure.</li>
 *   <li><b>HALF_OPEN</b>: exactly one trial call runs. Success closes the breaker;
 *       failure reopens it and restarts the timeout window. Concurrent callers fail
 *       fast while the trial is in flight.</li>
 * </ul>
 *
 * <p>Transitions are reported to the {@link CircuitBreakerListener} outside the
 * breaker's lock. This class is thread-safe.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final String name;
  private final int failureThreshold;
  private final Duration resetTimeout;
  private final Clock clock;
  private final CircuitBreakerListener listener;

  private CircuitState state = CircuitState.CLOSED;
  private int failureCount;
  private Instant lastFailureTime;
  private boolean trialInFlight;

  private CircuitBreaker(Builder builder) {
    this.name = Objects.requireNonNull(builder.name, "name");
    if (builder.failureThreshold < 1) {
      throw new IllegalArgumentException("failureThreshold must be >= 1");
    }
    Objects.requireNonNull(builder.resetTimeout, "resetTimeout");
    if (builder.resetTimeout.isNegative()) {
      throw new IllegalArgumentException("resetTimeout must be >= 0");
    }
    this.failureThreshold = builder.failureThreshold;
    this.resetTimeout = builder.resetTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.listener = builder.listener != null ? builder.listener : CircuitBreakerListener.NOOP;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  /**
   * Runs {@code call} if the breaker admits it.
   *
   * @throws CircuitOpenException if the breaker is open or a half-open trial is in flight
   * @throws Exception            whatever {@code call} throws, after it is recorded as a failure;
   *                               an {@link Error} is recorded the same way and rethrown
   */
  public <T> T execute(Callable<T> call) throws Exception {
    Objects.requireNonNull(call, "call");
    acquirePermission();
    T result;
    try {
      result = call.call();
    } catch (Exception | Error e) {
      onFailure();
      throw e;
    }
    onSuccess();
    return result;
  }

  public String name() {
    return name;
  }

  public synchronized CircuitState state() {
    return state;
  }

  public synchronized int failureCount() {
    return failureCount;
  }

  /**
   * Forces the breaker back to CLOSED with a cleared failure count.
   */
  public void reset() {
    CircuitState from;
    synchronized (this) {
      from = state;
      state = CircuitState.CLOSED;
      failureCount = 0;
      trialInFlight = false;
    }
    notifyTransition(from, CircuitState.CLOSED);
  }

  private void acquirePermission() {
    CircuitState from = null;
    synchronized (this) {
      if (state == CircuitState.OPEN) {
        Instant retryAt = lastFailureTime.plus(resetTimeout);
        if (clock.instant().isBefore(retryAt)) {
          throw new CircuitOpenException(name);
        }
        from = state;
        state = CircuitState.HALF_OPEN;
        trialInFlight = true;
      } else if (state == CircuitState.HALF_OPEN) {
        if (trialInFlight) {
          throw new CircuitOpenException(name);
        }
        trialInFlight = true;
      }
    }
    if (from != null) {
      notifyTransition(from, CircuitState.HALF_OPEN);
    }
  }

  private void onSuccess() {
    CircuitState from = null;
    synchronized (this) {
      failureCount = 0;
      if (state == CircuitState.HALF_OPEN) {
        from = state;
        state = CircuitState.CLOSED;
        trialInFlight = false;
      }
    }
    if (from != null) {
      notifyTransition(from, CircuitState.CLOSED);
    }
  }

  private void onFailure() {
    CircuitState from = null;
    synchronized (this) {
      failureCount++;
      lastFailureTime = clock.instant();
      if (state == CircuitState.HALF_OPEN
          || (state == CircuitState.CLOSED && failureCount >= failureThreshold)) {
        from = state;
        state = CircuitState.OPEN;
        trialInFlight = false;
      }
    }
    if (from != null) {
      notifyTransition(from, CircuitState.OPEN);
    }
  }

  private void notifyTransition(CircuitState from, CircuitState to) {
    if (from == to) {
      return;
    }
    logger.log(to == CircuitState.OPEN ? Level.WARNING : Level.INFO,
        "Circuit breaker ''{0}'' {1} -> {2}", new Object[]{name, from, to});
    try {
      listener.onStateChange(name, from, to);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Circuit breaker listener failed", e);
    }
  }

  /**
   * Builder for {@link CircuitBreaker}.
   */
  public static final class Builder {
    private final String name;
    private int failureThreshold = 5;
    private Duration resetTimeout = Duration.ofMinutes(1);
    private Clock clock;
    private CircuitBreakerListener listener;

    private Builder(String name) {
      this.name = name;
    }

    /**
     * Consecutive failures that open the breaker.
     *
     * <p>Optional. Defaults to 5.
     */
    public Builder failureThreshold(int failureThreshold) {
      this.failureThreshold = failureThreshold;
      return this;
    }

    /**
     * Time after the last failure before a trial call is admitted.
     *
     * <p>Optional. Defaults to 1 minute.
     */
    public Builder resetTimeout(Duration resetTimeout) {
      this.resetTimeout = resetTimeout;
      return this;
    }

    /**
     * Optional. Defaults to the system UTC clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@link CircuitBreakerListener#NOOP}.
     */
    public Builder listener(CircuitBreakerListener listener) {
      this.listener = listener;
      return this;
    }

    public CircuitBreaker build() {
      return new CircuitBreaker(this);
    }
  }
}
