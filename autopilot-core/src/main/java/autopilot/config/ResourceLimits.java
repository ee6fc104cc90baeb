package autopilot.config;

/**
 * Resource ceilings for autonomous operation.
 *
 * @param maxCpuUsage           CPU usage percentage above which the system is unhealthy
 * @param maxMemoryUsageMb      heap usage in megabytes above which the system is unhealthy
 * @param maxApiCallsPerHour    generation requests allowed per rolling hour
 * @param maxTokensPerOperation token budget passed to each generation request
 */
public record ResourceLimits(double maxCpuUsage, long maxMemoryUsageMb, int maxApiCallsPerHour,
    int maxTokensPerOperation) {

  public static final ResourceLimits DEFAULT = new ResourceLimits(70, 2048, 100, 4000);
}
