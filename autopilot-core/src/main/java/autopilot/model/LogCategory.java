package autopilot.model;

import java.util.Locale;

/**
 * Subsystem an activity log entry belongs to.
 */
public enum LogCategory {
  OPERATION,
  QUALITY,
  RESOURCE,
  SYSTEM;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static LogCategory fromCode(String code) {
    return valueOf(code.toUpperCase(Locale.ROOT));
  }
}
