package autopilot.pool;

/**
 * Thrown when {@link ConnectionPool#acquire} times out waiting for a connection, or
 * when the pool is closed. Callers may retry.
 */
public final class PoolExhaustedException extends RuntimeException {
  public PoolExhaustedException(String message) {
    super(message);
  }
}
