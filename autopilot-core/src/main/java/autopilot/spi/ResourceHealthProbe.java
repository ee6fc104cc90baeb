package autopilot.spi;

/**
 * Source of host health and resource usage.
 *
 * @see autopilot.resource.JvmResourceMonitor
 */
public interface ResourceHealthProbe {

  /**
   * Returns the most recent health verdict without sampling.
   */
  SystemHealth lastHealth();

  /**
   * Samples current usage.
   */
  ResourceSnapshot currentSnapshot();
}
