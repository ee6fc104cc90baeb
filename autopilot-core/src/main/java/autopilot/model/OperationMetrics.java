package autopilot.model;

/**
 * Resource usage of one executed operation. Built once after execution; CPU and memory
 * are deltas between the start and end snapshots, clamped at zero.
 *
 * @param durationMs  wall-clock execution time
 * @param tokensUsed  estimated tokens consumed by generation
 * @param apiCalls    generation requests issued, retries included
 * @param cpuDelta    CPU usage increase in percentage points
 * @param memoryDelta memory usage increase in megabytes
 */
public record OperationMetrics(long durationMs, int tokensUsed, int apiCalls, double cpuDelta, double memoryDelta) {
  public static final OperationMetrics EMPTY = new OperationMetrics(0, 0, 0, 0, 0);

  public OperationMetrics {
    if (durationMs < 0 || tokensUsed < 0 || apiCalls < 0 || cpuDelta < 0 || memoryDelta < 0) {
      throw new IllegalArgumentException("metrics must be non-negative");
    }
  }
}
