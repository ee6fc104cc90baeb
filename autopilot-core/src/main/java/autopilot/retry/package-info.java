/**
 * Retry with exponential backoff and a circuit breaker for flaky collaborators.
 *
 * @see autopilot.retry.Retrier
 * @see autopilot.retry.CircuitBreaker
 */
package autopilot.retry;
