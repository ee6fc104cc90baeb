package autopilot.retry;

import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Immutable settings for a {@link Retrier}.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class RetryOptions {

  /**
   * Callback invoked before sleeping ahead of the next attempt.
   */
  @FunctionalInterface
  public interface RetryListener {
    void onRetry(Exception error, int attempt, long delayMs);
  }

  private final int maxAttempts;
  private final long initialDelayMs;
  private final long maxDelayMs;
  private final double backoffMultiplier;
  private final BiPredicate<Exception, Integer> shouldRetry;
  private final RetryListener onRetry;
  private final Sleeper sleeper;

  private RetryOptions(Builder builder) {
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.initialDelayMs = builder.initialDelayMs;
    this.maxDelayMs = builder.maxDelayMs;
    this.backoffMultiplier = builder.backoffMultiplier;
    this.shouldRetry = Objects.requireNonNull(builder.shouldRetry, "shouldRetry");
    this.onRetry = builder.onRetry;
    this.sleeper = Objects.requireNonNull(builder.sleeper, "sleeper");
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  public long initialDelayMs() {
    return initialDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  public double backoffMultiplier() {
    return backoffMultiplier;
  }

  public BiPredicate<Exception, Integer> shouldRetry() {
    return shouldRetry;
  }

  public RetryListener onRetry() {
    return onRetry;
  }

  public Sleeper sleeper() {
    return sleeper;
  }

  public static final class Builder {
    private int maxAttempts = 3;
    private long initialDelayMs = 1000;
    private long maxDelayMs = 10_000;
    private double backoffMultiplier = 2.0;
    private BiPredicate<Exception, Integer> shouldRetry = (error, attempt) -> true;
    private RetryListener onRetry;
    private Sleeper sleeper = Sleeper.SYSTEM;

    private Builder() {
    }

    /**
     * Total attempts including the first call.
     *
     * <p>Optional. Defaults to 3.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Delay before the second attempt.
     *
     * <p>Optional. Defaults to 1000 ms.
     */
    public Builder initialDelayMs(long initialDelayMs) {
      this.initialDelayMs = initialDelayMs;
      return this;
    }

    /**
     * Cap on any single delay.
     *
     * <p>Optional. Defaults to 10000 ms.
     */
    public Builder maxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
      return this;
    }

    /**
     * Optional. Defaults to 2.0.
     */
    public Builder backoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    /**
     * Decides whether a failure of the given (1-based) attempt is retried.
     *
     * <p>Optional. Defaults to retrying every exception.
     */
    public Builder shouldRetry(BiPredicate<Exception, Integer> shouldRetry) {
      this.shouldRetry = shouldRetry;
      return this;
    }

    /**
     * Optional. No callback by default.
     */
    public Builder onRetry(RetryListener onRetry) {
      this.onRetry = onRetry;
      return this;
    }

    /**
     * Optional. Defaults to {@link Sleeper#SYSTEM}.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public RetryOptions build() {
      return new RetryOptions(this);
    }
  }
}
