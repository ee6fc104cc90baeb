package autopilot.retry;

import autopilot.TransientStoreException;
import autopilot.pool.PoolExhaustedException;
import autopilot.spi.GenerationException;

import java.util.function.BiPredicate;

/**
 * Shared retry predicates.
 */
public final class Retries {

  /**
   * Retries {@link TransientStoreException} and {@link PoolExhaustedException}.
   */
  public static BiPredicate<Exception, Integer> transientStoreErrors() {
    return (error, attempt) -> error instanceof TransientStoreException
        || error instanceof PoolExhaustedException;
  }

  /**
   * Retries generation failures flagged as retryable (rate limits, timeouts). An open
   * circuit is never retried.
   */
  public static BiPredicate<Exception, Integer> retryableGeneration() {
    return (error, attempt) -> !(error instanceof CircuitOpenException)
        && error instanceof GenerationException generation
        && generation.isRetryable();
  }

  private Retries() {}
}
