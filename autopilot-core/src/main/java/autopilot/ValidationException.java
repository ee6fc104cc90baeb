package autopilot;

/**
 * Rejected input. Never retried; surfaced to the caller immediately.
 */
public final class ValidationException extends RuntimeException {
  public ValidationException(String message) {
    super(message);
  }
}
