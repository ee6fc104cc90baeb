package autopilot.batch;

import java.util.Objects;

/**
 * Result of one successfully persisted write.
 *
 * @param id      id of the written entity
 * @param outcome insert or update
 */
public record WriteResult(String id, WriteOutcome outcome) {
  public WriteResult {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(outcome, "outcome");
  }
}
