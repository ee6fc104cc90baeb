package autopilot.scheduler;

import autopilot.batch.EventFactory;
import autopilot.event.DomainEvent;
import autopilot.model.Operation;
import autopilot.model.OperationResult;

import java.time.Instant;
import java.util.Optional;

/**
 * Domain events of the scheduler.
 */
public final class OperationEvents {
  public static final String OPERATION_AGGREGATE = "AutonomousOperation";
  public static final String CONFIG_AGGREGATE = "AutonomousConfig";
  public static final String SCHEDULER_AGGREGATE = "AutonomousScheduler";

  public static final String STARTED = "AutonomousStarted";
  public static final String STOPPED = "AutonomousStopped";
  public static final String OPERATION_QUEUED = "OperationQueued";
  public static final String OPERATION_COMPLETED = "OperationCompleted";
  public static final String OPERATION_FAILED = "OperationFailed";
  public static final String OPERATION_CANCELLED = "OperationCancelled";
  public static final String CONFIGURATION_UPDATED = "ConfigurationUpdated";
  public static final String CONTENT_SAVED = "ContentSaved";

  /**
   * Event factory for the operation writer: one event per terminal status, published in
   * the same transaction as the row. Non-terminal writes publish nothing.
   */
  public static EventFactory<Operation> terminalStatus() {
    return (operation, result) -> {
      String type = switch (operation.status()) {
        case COMPLETED -> OPERATION_COMPLETED;
        case FAILED -> OPERATION_FAILED;
        case CANCELLED -> OPERATION_CANCELLED;
        default -> null;
      };
      if (type == null) {
        return Optional.empty();
      }
      DomainEvent.Builder event = DomainEvent.builder(type)
          .aggregate(OPERATION_AGGREGATE, operation.id())
          .payload("type", operation.type().wireName());
      if (operation.projectId() != null) {
        event.payload("projectId", operation.projectId());
      }
      OperationResult outcome = operation.result();
      if (outcome != null) {
        event.payload("qualityScore", Integer.toString(outcome.qualityScore()))
            .payload("saved", Boolean.toString(outcome.saved()));
      }
      if (operation.error() != null) {
        event.payload("error", operation.error());
      }
      return Optional.of(event.build());
    };
  }

  static DomainEvent lifecycle(String type, String schedulerId, Instant now) {
    return DomainEvent.builder(type).aggregate(SCHEDULER_AGGREGATE, schedulerId).timestamp(now).build();
  }

  private OperationEvents() {}
}
