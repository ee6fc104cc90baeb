package autopilot.spi;

import java.util.Objects;

/**
 * Failure reported by a {@link GenerationClient}.
 *
 * <p>{@link #isRetryable()} tells the retry policy whether the call may succeed if
 * repeated, as with rate limits and timeouts.
 */
public class GenerationException extends RuntimeException {

  /**
   * Category of a generation failure.
   */
  public enum Kind {
    RATE_LIMITED(true),
    TIMEOUT(true),
    UNAVAILABLE(true),
    INVALID_REQUEST(false),
    INVALID_RESPONSE(false);

    private final boolean retryable;

    Kind(boolean retryable) {
      this.retryable = retryable;
    }

    public boolean retryable() {
      return retryable;
    }
  }

  private final Kind kind;

  public GenerationException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public GenerationException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }

  public boolean isRetryable() {
    return kind.retryable();
  }
}
