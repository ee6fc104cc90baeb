package autopilot.micrometer;

import autopilot.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code autopilot.operations.completed}</li>
 *   <li>{@code autopilot.operations.failed}</li>
 *   <li>{@code autopilot.operations.cancelled}</li>
 *   <li>{@code autopilot.ticks.skipped}, tagged {@code reason}</li>
 *   <li>{@code autopilot.content.saved}</li>
 *   <li>{@code autopilot.batch.chunks.committed}</li>
 *   <li>{@code autopilot.batch.chunks.rolledback}</li>
 *   <li>{@code autopilot.batch.items.rejected}</li>
 *   <li>{@code autopilot.circuit.opened}, tagged {@code breaker}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code autopilot.batch.queue.depth}, tagged {@code writer}: last reported queue depth
 *       of each batch writer</li>
 * </ul>
 *
 * <h3>Distribution Summaries</h3>
 * <ul>
 *   <li>{@code autopilot.quality.score}: overall assessment scores</li>
 *   <li>{@code autopilot.batch.chunk.size}: items per committed chunk</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter operationsCompleted;
  private final Counter operationsFailed;
  private final Counter operationsCancelled;
  private final Counter contentSaved;
  private final Counter chunksCommitted;
  private final Counter chunksRolledBack;
  private final Counter itemsRejected;
  private final DistributionSummary qualityScore;
  private final DistributionSummary chunkSize;
  private final Map<String, Counter> skippedByReason = new ConcurrentHashMap<>();
  private final Map<String, Counter> openedByBreaker = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> depthByWriter = new ConcurrentHashMap<>();
  private final Map<String, Gauge> depthGauges = new ConcurrentHashMap<>();

  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "autopilot"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "autopilot");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param namePrefix prefix for all meter names (e.g. {@code "novels.autopilot"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.operationsCompleted = Counter.builder(namePrefix + ".operations.completed")
        .description("Operations that completed")
        .register(registry);
    this.operationsFailed = Counter.builder(namePrefix + ".operations.failed")
        .description("Operations that failed")
        .register(registry);
    this.operationsCancelled = Counter.builder(namePrefix + ".operations.cancelled")
        .description("Operations cancelled by a scheduler stop")
        .register(registry);
    this.contentSaved = Counter.builder(namePrefix + ".content.saved")
        .description("Generated items saved after passing the quality gate")
        .register(registry);
    this.chunksCommitted = Counter.builder(namePrefix + ".batch.chunks.committed")
        .description("Batch chunks committed")
        .register(registry);
    this.chunksRolledBack = Counter.builder(namePrefix + ".batch.chunks.rolledback")
        .description("Batch chunks rolled back")
        .register(registry);
    this.itemsRejected = Counter.builder(namePrefix + ".batch.items.rejected")
        .description("Batch items rejected after exhausting retries")
        .register(registry);

    this.qualityScore = DistributionSummary.builder(namePrefix + ".quality.score")
        .description("Overall quality assessment scores")
        .register(registry);
    this.chunkSize = DistributionSummary.builder(namePrefix + ".batch.chunk.size")
        .description("Items written per committed chunk")
        .register(registry);
  }

  @Override
  public void incrementOperationCompleted() {
    if (closed) return;
    operationsCompleted.increment();
  }

  @Override
  public void incrementOperationFailed() {
    if (closed) return;
    operationsFailed.increment();
  }

  @Override
  public void incrementOperationCancelled() {
    if (closed) return;
    operationsCancelled.increment();
  }

  @Override
  public void incrementTickSkipped(String reason) {
    if (closed) return;
    skippedByReason.computeIfAbsent(reason, r -> Counter.builder(namePrefix + ".ticks.skipped")
        .description("Scheduler ticks that did not run an operation")
        .tag("reason", r)
        .register(registry)).increment();
  }

  @Override
  public void incrementContentSaved() {
    if (closed) return;
    contentSaved.increment();
  }

  @Override
  public void recordQualityScore(int score) {
    if (closed) return;
    qualityScore.record(score);
  }

  @Override
  public void recordChunkCommitted(int size) {
    if (closed) return;
    chunksCommitted.increment();
    chunkSize.record(size);
  }

  @Override
  public void incrementChunkRolledBack() {
    if (closed) return;
    chunksRolledBack.increment();
  }

  @Override
  public void incrementItemsRejected(int count) {
    if (closed) return;
    itemsRejected.increment(count);
  }

  @Override
  public void recordBatchQueueDepth(String writer, int depth) {
    if (closed) return;
    depthByWriter.computeIfAbsent(writer, w -> {
      AtomicInteger holder = new AtomicInteger();
      depthGauges.put(w, Gauge.builder(namePrefix + ".batch.queue.depth", holder, AtomicInteger::get)
          .description("Items waiting in a batch writer's queue")
          .tag("writer", w)
          .register(registry));
      return holder;
    }).set(depth);
  }

  @Override
  public void incrementCircuitOpened(String breakerName) {
    if (closed) return;
    openedByBreaker.computeIfAbsent(breakerName, b -> Counter.builder(namePrefix + ".circuit.opened")
        .description("Circuit breaker transitions to OPEN")
        .tag("breaker", b)
        .register(registry)).increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(operationsCompleted, operationsFailed, operationsCancelled,
        contentSaved, chunksCommitted, chunksRolledBack, itemsRejected,
        qualityScore, chunkSize));
    meters.addAll(skippedByReason.values());
    meters.addAll(openedByBreaker.values());
    meters.addAll(depthGauges.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
