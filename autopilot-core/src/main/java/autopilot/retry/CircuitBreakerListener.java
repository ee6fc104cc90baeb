package autopilot.retry;

/**
 * Observes {@link CircuitBreaker} state transitions, e.g. for metrics or alerting.
 */
@FunctionalInterface
public interface CircuitBreakerListener {
  CircuitBreakerListener NOOP = (name, from, to) -> {};

  void onStateChange(String breakerName, CircuitState from, CircuitState to);
}
