package autopilot.retry;

/**
 * Thrown by {@link CircuitBreaker#execute} without invoking the guarded call while the
 * breaker is open. Never retried.
 */
public final class CircuitOpenException extends RuntimeException {
  private final String breakerName;

  public CircuitOpenException(String breakerName) {
    super("Circuit breaker '" + breakerName + "' is open");
    this.breakerName = breakerName;
  }

  public String breakerName() {
    return breakerName;
  }
}
