package autopilot.spi;

import java.time.Instant;

/**
 * Instantaneous resource usage, taken before and after an operation.
 */
public record ResourceSnapshot(double cpuUsage, double memoryUsageMb, Instant timestamp) {
}
