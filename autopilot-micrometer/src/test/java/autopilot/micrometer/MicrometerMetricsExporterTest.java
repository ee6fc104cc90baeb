package autopilot.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void operationCounters() {
    exporter.incrementOperationCompleted();
    exporter.incrementOperationCompleted();
    exporter.incrementOperationFailed();
    exporter.incrementOperationCancelled();
    assertEquals(2.0, counter("autopilot.operations.completed").count());
    assertEquals(1.0, counter("autopilot.operations.failed").count());
    assertEquals(1.0, counter("autopilot.operations.cancelled").count());
  }

  @Test
  void tickSkippedIsTaggedByReason() {
    exporter.incrementTickSkipped("daily_limit");
    exporter.incrementTickSkipped("daily_limit");
    exporter.incrementTickSkipped("unhealthy");

    assertEquals(2.0, registry.find("autopilot.ticks.skipped").tag("reason", "daily_limit").counter().count());
    assertEquals(1.0, registry.find("autopilot.ticks.skipped").tag("reason", "unhealthy").counter().count());
  }

  @Test
  void batchMetrics() {
    exporter.recordChunkCommitted(100);
    exporter.recordChunkCommitted(50);
    exporter.incrementChunkRolledBack();
    exporter.incrementItemsRejected(3);
    exporter.recordBatchQueueDepth("operations", 42);

    assertEquals(2.0, counter("autopilot.batch.chunks.committed").count());
    DistributionSummary sizes = registry.find("autopilot.batch.chunk.size").summary();
    assertNotNull(sizes);
    assertEquals(150.0, sizes.totalAmount());
    assertEquals(1.0, counter("autopilot.batch.chunks.rolledback").count());
    assertEquals(3.0, counter("autopilot.batch.items.rejected").count());
    assertEquals(42.0, gauge("autopilot.batch.queue.depth").value());
  }

  @Test
  void queueDepthIsTrackedPerWriter() {
    exporter.recordBatchQueueDepth("operations", 12);
    exporter.recordBatchQueueDepth("activity-log", 3);
    exporter.recordBatchQueueDepth("operations", 5);

    assertEquals(5.0, registry.find("autopilot.batch.queue.depth").tag("writer", "operations").gauge().value());
    assertEquals(3.0, registry.find("autopilot.batch.queue.depth").tag("writer", "activity-log").gauge().value());

    exporter.close();
    assertNull(registry.find("autopilot.batch.queue.depth").gauge());
  }

  @Test
  void qualityScoresAndContentSaved() {
    exporter.recordQualityScore(80);
    exporter.recordQualityScore(60);
    exporter.incrementContentSaved();

    DistributionSummary scores = registry.find("autopilot.quality.score").summary();
    assertNotNull(scores);
    assertEquals(2, scores.count());
    assertEquals(70.0, scores.mean());
    assertEquals(1.0, counter("autopilot.content.saved").count());
  }

  @Test
  void circuitOpenedIsTaggedByBreaker() {
    exporter.incrementCircuitOpened("content-generation");
    assertEquals(1.0, registry.find("autopilot.circuit.opened").tag("breaker", "content-generation").counter().count());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "novels.autopilot");
    custom.incrementOperationCompleted();
    custom.recordBatchQueueDepth("operations", 7);

    assertEquals(1.0, counter("novels.autopilot.operations.completed").count());
    assertEquals(7.0, gauge("novels.autopilot.batch.queue.depth").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterCalls() {
    exporter.incrementTickSkipped("busy");
    exporter.close();

    assertNull(registry.find("autopilot.operations.completed").counter());
    assertNull(registry.find("autopilot.ticks.skipped").counter());
    exporter.incrementOperationCompleted();
    assertNull(registry.find("autopilot.operations.completed").counter());
  }

  @Test
  void invalidPrefixes() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "autopilot."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
