package autopilot.model;

import java.util.Objects;

/**
 * Categories of content the scheduler can generate.
 */
public enum ContentType {
  PLOT("plot"),
  CHARACTER("character"),
  WORLD_SETTING("worldSetting"),
  INSPIRATION("inspiration");

  private final String wireName;

  ContentType(String wireName) {
    this.wireName = wireName;
  }

  /**
   * Name used in persisted rows and event payloads.
   */
  public String wireName() {
    return wireName;
  }

  /**
   * @throws IllegalArgumentException if {@code wireName} matches no type
   */
  public static ContentType fromWireName(String wireName) {
    Objects.requireNonNull(wireName, "wireName");
    for (ContentType type : values()) {
      if (type.wireName.equals(wireName)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown content type: " + wireName);
  }
}
