package autopilot.retry;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a call with bounded retries and exponential backoff.
 *
 * <p>After a failed attempt {@code n}, the call is retried only if
 * {@code n < maxAttempts} and {@code shouldRetry(error, n)} holds. Otherwise the
 * error of the last attempt is rethrown unchanged. An interrupt during the backoff
 * sleep stops retrying: the interrupt flag is restored and the last error rethrown.
 *
 * <p>Instances are stateless and thread-safe.
 */
public final class Retrier {
  private static final Logger logger = Logger.getLogger(Retrier.class.getName());

  private final RetryOptions options;
  private final RetryPolicy policy;

  public Retrier(RetryOptions options) {
    this.options = Objects.requireNonNull(options, "options");
    this.policy = new ExponentialBackoffRetryPolicy(
        options.initialDelayMs(), options.maxDelayMs(), options.backoffMultiplier());
  }

  public RetryOptions options() {
    return options;
  }

  public <T> T execute(Callable<T> call) throws Exception {
    Objects.requireNonNull(call, "call");
    int attempt = 0;
    while (true) {
      attempt++;
      try {
        return call.call();
      } catch (Exception e) {
        if (attempt >= options.maxAttempts() || !options.shouldRetry().test(e, attempt)) {
          throw e;
        }
        long delayMs = policy.computeDelayMs(attempt);
        notifyRetry(e, attempt, delayMs);
        try {
          if (delayMs > 0) {
            options.sleeper().sleep(delayMs);
          }
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }

  private void notifyRetry(Exception error, int attempt, long delayMs) {
    logger.log(Level.FINE, "Attempt {0} failed, retrying in {1} ms: {2}",
        new Object[]{attempt, delayMs, error.toString()});
    if (options.onRetry() == null) {
      return;
    }
    try {
      options.onRetry().onRetry(error, attempt, delayMs);
    } catch (RuntimeException listenerError) {
      logger.log(Level.WARNING, "Retry listener failed", listenerError);
    }
  }
}
