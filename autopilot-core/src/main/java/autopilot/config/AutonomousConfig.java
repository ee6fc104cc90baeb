package autopilot.config;

import autopilot.ValidationException;
import autopilot.model.ContentType;

import java.time.LocalTime;
import java.util.List;
import java.util.Objects;

/**
 * Scheduler configuration. A single logical row versioned by replace-on-update:
 * {@link #apply} produces version N+1 from version N and a patch.
 *
 * @param version                 monotonically increasing version, 1 for the first row
 * @param maxConcurrentOperations accepted for compatibility; at most one operation
 *                                ever runs at a time
 */
public record AutonomousConfig(
    int version,
    boolean enabled,
    int intervalMinutes,
    int qualityThreshold,
    int maxConcurrentOperations,
    int maxDailyOperations,
    List<TimeSlot> timeSlots,
    ResourceLimits resourceLimits,
    List<ContentType> contentTypes) {

  public AutonomousConfig {
    Objects.requireNonNull(timeSlots, "timeSlots");
    Objects.requireNonNull(resourceLimits, "resourceLimits");
    Objects.requireNonNull(contentTypes, "contentTypes");
    timeSlots = List.copyOf(timeSlots);
    contentTypes = List.copyOf(contentTypes);
  }

  /**
   * Disabled, every 30 minutes, quality threshold 65, 48 operations per day, daytime
   * slot 09:00-18:00 on, night slot 22:00-06:00 off, every content type.
   */
  public static AutonomousConfig defaults() {
    return new AutonomousConfig(
        1,
        false,
        30,
        65,
        1,
        48,
        List.of(TimeSlot.of("09:00", "18:00", true), TimeSlot.of("22:00", "06:00", false)),
        ResourceLimits.DEFAULT,
        List.of(ContentType.values()));
  }

  /**
   * Whether {@code time} falls inside at least one enabled slot.
   */
  public boolean isWithinTimeSlot(LocalTime time) {
    for (TimeSlot slot : timeSlots) {
      if (slot.enabled() && slot.contains(time)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns the next version with the patch applied and validated.
   *
   * @throws ValidationException if the result is invalid
   */
  public AutonomousConfig apply(AutonomousConfigPatch patch) {
    Objects.requireNonNull(patch, "patch");
    AutonomousConfig next = new AutonomousConfig(
        version + 1,
        patch.enabled() != null ? patch.enabled() : enabled,
        patch.intervalMinutes() != null ? patch.intervalMinutes() : intervalMinutes,
        patch.qualityThreshold() != null ? patch.qualityThreshold() : qualityThreshold,
        patch.maxConcurrentOperations() != null ? patch.maxConcurrentOperations() : maxConcurrentOperations,
        patch.maxDailyOperations() != null ? patch.maxDailyOperations() : maxDailyOperations,
        patch.timeSlots() != null ? patch.timeSlots() : timeSlots,
        patch.resourceLimits() != null ? patch.resourceLimits() : resourceLimits,
        patch.contentTypes() != null ? patch.contentTypes() : contentTypes);
    next.validate();
    return next;
  }

  /**
   * @throws ValidationException describing the first invalid field
   */
  public void validate() {
    if (version < 1) {
      throw new ValidationException("version must be >= 1");
    }
    if (intervalMinutes < 1 || intervalMinutes > 1440) {
      throw new ValidationException("intervalMinutes must be between 1 and 1440, got: " + intervalMinutes);
    }
    if (qualityThreshold < 0 || qualityThreshold > 100) {
      throw new ValidationException("qualityThreshold must be between 0 and 100, got: " + qualityThreshold);
    }
    if (maxConcurrentOperations < 1) {
      throw new ValidationException("maxConcurrentOperations must be >= 1, got: " + maxConcurrentOperations);
    }
    if (maxDailyOperations < 0) {
      throw new ValidationException("maxDailyOperations must be >= 0, got: " + maxDailyOperations);
    }
    if (resourceLimits.maxCpuUsage() <= 0 || resourceLimits.maxCpuUsage() > 100) {
      throw new ValidationException("resourceLimits.maxCpuUsage must be in (0, 100]");
    }
    if (resourceLimits.maxMemoryUsageMb() <= 0) {
      throw new ValidationException("resourceLimits.maxMemoryUsageMb must be > 0");
    }
    if (resourceLimits.maxApiCallsPerHour() <= 0) {
      throw new ValidationException("resourceLimits.maxApiCallsPerHour must be > 0");
    }
    if (resourceLimits.maxTokensPerOperation() <= 0) {
      throw new ValidationException("resourceLimits.maxTokensPerOperation must be > 0");
    }
    if (contentTypes.stream().distinct().count() != contentTypes.size()) {
      throw new ValidationException("contentTypes must not contain duplicates");
    }
  }
}
