package autopilot.spi;

/**
 * Observability hook for exporting scheduler and persistence counters to a metrics
 * backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of operations that reached COMPLETED.
   */
  void incrementOperationCompleted();

  /**
   * Increments the count of operations that reached FAILED.
   */
  void incrementOperationFailed();

  /**
   * Increments the count of operations cancelled by {@code stop()}.
   */
  void incrementOperationCancelled();

  /**
   * Increments the count of scheduler ticks that did not run an operation.
   *
   * @param reason lower-case skip reason, e.g. {@code outside_time_slot}
   */
  void incrementTickSkipped(String reason);

  /**
   * Increments the count of generated items persisted after passing the quality gate.
   */
  void incrementContentSaved();

  /**
   * Records the overall score of a quality assessment.
   */
  default void recordQualityScore(int score) {
  }

  /**
   * Records a committed batch chunk.
   *
   * @param size number of items written in the chunk
   */
  void recordChunkCommitted(int size);

  /**
   * Increments the count of batch chunks rolled back.
   */
  void incrementChunkRolledBack();

  /**
   * Increments the count of batch items rejected after exhausting their retries.
   */
  void incrementItemsRejected(int count);

  /**
   * Records the current depth of the named writer's batch queue.
   */
  default void recordBatchQueueDepth(String writer, int depth) {
  }

  /**
   * Records a circuit breaker transition to OPEN.
   */
  default void incrementCircuitOpened(String breakerName) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementOperationCompleted() {
    }

    @Override
    public void incrementOperationFailed() {
    }

    @Override
    public void incrementOperationCancelled() {
    }

    @Override
    public void incrementTickSkipped(String reason) {
    }

    @Override
    public void incrementContentSaved() {
    }

    @Override
    public void recordChunkCommitted(int size) {
    }

    @Override
    public void incrementChunkRolledBack() {
    }

    @Override
    public void incrementItemsRejected(int count) {
    }
  }
}
