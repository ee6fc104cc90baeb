package autopilot.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One persisted activity log entry.
 *
 * @param operationId related operation, or {@code null}
 */
public record LogEntry(
    String id,
    Instant timestamp,
    LogLevel level,
    LogCategory category,
    String message,
    String operationId,
    Map<String, String> metadata) {

  public LogEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(message, "message");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
