package autopilot.batch;

/**
 * Whether a write created or replaced a row.
 */
public enum WriteOutcome {
  INSERTED,
  UPDATED
}
