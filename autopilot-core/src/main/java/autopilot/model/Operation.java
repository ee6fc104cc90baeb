package autopilot.model;

import autopilot.util.Ids;

import java.time.Instant;
import java.util.Objects;

/**
 * One unit of autonomous content generation and its outcome.
 *
 * <p>Immutable: each transition returns a new instance. Allowed transitions are
 * PENDING to RUNNING, RUNNING to COMPLETED or FAILED, and any non-terminal status to
 * CANCELLED. A terminal operation rejects every transition.
 */
public record Operation(
    String id,
    ContentType type,
    OperationStatus status,
    String projectId,
    Instant startTime,
    Instant endTime,
    OperationMetrics metrics,
    OperationResult result,
    String error) {

  public Operation {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(status, "status");
  }

  /**
   * Creates a new PENDING operation with a fresh id.
   */
  public static Operation pending(ContentType type, String projectId) {
    return new Operation(Ids.next(), type, OperationStatus.PENDING, projectId, null, null, null, null, null);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }

  public Operation start(Instant now) {
    require(OperationStatus.PENDING, "start");
    return new Operation(id, type, OperationStatus.RUNNING, projectId, now, null, null, null, null);
  }

  public Operation complete(Instant now, OperationMetrics metrics, OperationResult result) {
    require(OperationStatus.RUNNING, "complete");
    Objects.requireNonNull(result, "result");
    return new Operation(id, type, OperationStatus.COMPLETED, projectId, startTime, now, metrics, result, null);
  }

  public Operation fail(Instant now, OperationMetrics metrics, String error) {
    require(OperationStatus.RUNNING, "fail");
    return new Operation(id, type, OperationStatus.FAILED, projectId, startTime, now, metrics, null,
        error == null ? "unknown error" : error);
  }

  public Operation cancel(Instant now) {
    if (isTerminal()) {
      throw new IllegalStateException("Cannot cancel operation " + id + " in terminal status " + status);
    }
    return new Operation(id, type, OperationStatus.CANCELLED, projectId, startTime, now, metrics, null,
        "cancelled");
  }

  private void require(OperationStatus expected, String action) {
    if (status != expected) {
      throw new IllegalStateException("Cannot " + action + " operation " + id + " in status " + status);
    }
  }
}
