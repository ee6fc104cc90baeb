package autopilot.retry;

/**
 * Deterministic exponential backoff.
 *
 * <p>Delay formula: {@code initialDelay * multiplier^(attempt-1)}, capped at
 * {@code maxDelay}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double multiplier;

  /**
   * @param initialDelayMs delay before the first retry (milliseconds)
   * @param maxDelayMs     maximum delay cap (milliseconds)
   * @param multiplier     growth factor per attempt, at least 1
   */
  public ExponentialBackoffRetryPolicy(long initialDelayMs, long maxDelayMs, double multiplier) {
    if (initialDelayMs < 0) {
      throw new IllegalArgumentException("initialDelayMs must be >= 0, got: " + initialDelayMs);
    }
    if (maxDelayMs < initialDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= initialDelayMs, got: " + maxDelayMs);
    }
    if (!(multiplier >= 1.0) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be a finite value >= 1, got: " + multiplier);
    }
    this.initialDelayMs = initialDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.multiplier = multiplier;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    double delay = initialDelayMs * Math.pow(multiplier, attempts - 1);
    // pow overflows to infinity for large attempts; the cap absorbs it
    if (Double.isNaN(delay) || delay >= maxDelayMs) {
      return maxDelayMs;
    }
    return (long) delay;
  }
}
