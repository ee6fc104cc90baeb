package autopilot.config;

import autopilot.model.ContentType;

import java.util.List;

/**
 * Partial update of an {@link AutonomousConfig}. Unset fields keep their current value.
 */
public final class AutonomousConfigPatch {
  private final Boolean enabled;
  private final Integer intervalMinutes;
  private final Integer qualityThreshold;
  private final Integer maxConcurrentOperations;
  private final Integer maxDailyOperations;
  private final List<TimeSlot> timeSlots;
  private final ResourceLimits resourceLimits;
  private final List<ContentType> contentTypes;

  private AutonomousConfigPatch(Builder builder) {
    this.enabled = builder.enabled;
    this.intervalMinutes = builder.intervalMinutes;
    this.qualityThreshold = builder.qualityThreshold;
    this.maxConcurrentOperations = builder.maxConcurrentOperations;
    this.maxDailyOperations = builder.maxDailyOperations;
    this.timeSlots = builder.timeSlots == null ? null : List.copyOf(builder.timeSlots);
    this.resourceLimits = builder.resourceLimits;
    this.contentTypes = builder.contentTypes == null ? null : List.copyOf(builder.contentTypes);
  }

  public static Builder builder() {
    return new Builder();
  }

  Boolean enabled() {
    return enabled;
  }

  Integer intervalMinutes() {
    return intervalMinutes;
  }

  Integer qualityThreshold() {
    return qualityThreshold;
  }

  Integer maxConcurrentOperations() {
    return maxConcurrentOperations;
  }

  Integer maxDailyOperations() {
    return maxDailyOperations;
  }

  List<TimeSlot> timeSlots() {
    return timeSlots;
  }

  ResourceLimits resourceLimits() {
    return resourceLimits;
  }

  List<ContentType> contentTypes() {
    return contentTypes;
  }

  public static final class Builder {
    private Boolean enabled;
    private Integer intervalMinutes;
    private Integer qualityThreshold;
    private Integer maxConcurrentOperations;
    private Integer maxDailyOperations;
    private List<TimeSlot> timeSlots;
    private ResourceLimits resourceLimits;
    private List<ContentType> contentTypes;

    private Builder() {
    }

    public Builder enabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder intervalMinutes(int intervalMinutes) {
      this.intervalMinutes = intervalMinutes;
      return this;
    }

    public Builder qualityThreshold(int qualityThreshold) {
      this.qualityThreshold = qualityThreshold;
      return this;
    }

    public Builder maxConcurrentOperations(int maxConcurrentOperations) {
      this.maxConcurrentOperations = maxConcurrentOperations;
      return this;
    }

    public Builder maxDailyOperations(int maxDailyOperations) {
      this.maxDailyOperations = maxDailyOperations;
      return this;
    }

    public Builder timeSlots(List<TimeSlot> timeSlots) {
      this.timeSlots = timeSlots;
      return this;
    }

    public Builder resourceLimits(ResourceLimits resourceLimits) {
      this.resourceLimits = resourceLimits;
      return this;
    }

    public Builder contentTypes(List<ContentType> contentTypes) {
      this.contentTypes = contentTypes;
      return this;
    }

    public AutonomousConfigPatch build() {
      return new AutonomousConfigPatch(this);
    }
  }
}
