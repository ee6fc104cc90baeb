package autopilot.spi;

import java.time.Instant;

/**
 * Health verdict of the host, polled once per scheduler tick.
 *
 * @param cpuUsage      CPU usage percentage (0-100)
 * @param memoryUsageMb heap usage in megabytes
 * @param healthy       whether every measurement is within its limit
 * @param checkedAt     time of the sample
 */
public record SystemHealth(double cpuUsage, double memoryUsageMb, boolean healthy, Instant checkedAt) {

  /**
   * Healthy placeholder used before the first sample.
   */
  public static SystemHealth unknown() {
    return new SystemHealth(0, 0, true, Instant.EPOCH);
  }
}
