package autopilot.model;

import java.util.Locale;
import java.util.logging.Level;

/**
 * Severity of an activity log entry.
 */
public enum LogLevel {
  DEBUG(Level.FINE),
  INFO(Level.INFO),
  WARN(Level.WARNING),
  ERROR(Level.SEVERE);

  private final Level julLevel;

  LogLevel(Level julLevel) {
    this.julLevel = julLevel;
  }

  public Level julLevel() {
    return julLevel;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static LogLevel fromCode(String code) {
    return valueOf(code.toUpperCase(Locale.ROOT));
  }
}
