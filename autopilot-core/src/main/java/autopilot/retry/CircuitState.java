package autopilot.retry;

/**
 * States of a {@link CircuitBreaker}.
 */
public enum CircuitState {
  /** Calls pass through; failures are counted. */
  CLOSED,
  /** Calls fail fast with {@link CircuitOpenException}. */
  OPEN,
  /** One trial call is admitted to probe the dependency. */
  HALF_OPEN
}
