package autopilot.scheduler;

import autopilot.model.Operation;
import autopilot.spi.SystemHealth;

import java.time.Instant;

/**
 * Point-in-time view of the scheduler.
 *
 * @param currentOperation  the operation in flight, or {@code null}
 * @param lastOperationTime end of the last executed operation, or {@code null}
 * @param successRate       saved operations as a percentage of executed ones, 0 when none ran
 */
public record SchedulerStatus(
    boolean running,
    boolean enabled,
    Operation currentOperation,
    int queueLength,
    int todayCount,
    long totalOperations,
    double successRate,
    Instant lastOperationTime,
    SystemHealth systemHealth) {
}
