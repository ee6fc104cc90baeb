package autopilot.scheduler;

import java.util.Locale;

/**
 * What one scheduler cycle did.
 */
public enum TickOutcome {
  /** An operation ran to COMPLETED or FAILED. */
  EXECUTED,
  /** The scheduler is not running, or the operation was cancelled mid-cycle. */
  STOPPED,
  OUTSIDE_TIME_SLOT,
  UNHEALTHY,
  DAILY_LIMIT,
  /** Generation requests over the last hour reached the configured ceiling. */
  API_LIMIT,
  /** Another operation is in flight. */
  BUSY,
  /** Queue empty and no content types configured. */
  NOTHING_TO_DO,
  /** The cycle itself failed before an operation was claimed. */
  ERROR;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
