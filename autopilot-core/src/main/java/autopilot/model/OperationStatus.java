package autopilot.model;

import java.util.Locale;

/**
 * Lifecycle of an {@link Operation}. COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum OperationStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static OperationStatus fromCode(String code) {
    return valueOf(code.toUpperCase(Locale.ROOT));
  }
}
