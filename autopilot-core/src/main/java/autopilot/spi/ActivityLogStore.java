package autopilot.spi;

import autopilot.model.LogEntry;
import autopilot.model.LogFilter;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;

/**
 * Append-only activity log.
 */
public interface ActivityLogStore extends EntityStore<LogEntry> {

  /**
   * Returns matching entries, newest first.
   */
  List<LogEntry> query(Connection conn, LogFilter filter);

  /**
   * Deletes entries older than {@code cutoff}.
   *
   * @return number of deleted entries
   */
  int deleteOlderThan(Connection conn, Instant cutoff);
}
