package autopilot.log;

import autopilot.batch.BatchWriteCoordinator;
import autopilot.model.LogCategory;
import autopilot.model.LogEntry;
import autopilot.model.LogFilter;
import autopilot.model.LogLevel;
import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.spi.ActivityLogStore;
import autopilot.util.Ids;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structured activity log of the scheduler.
 *
 * <p>Each entry goes to {@code java.util.logging} right away and is appended to the
 * persistent log through a {@link BatchWriteCoordinator}, so entries are written in
 * buffered chunks. A failed append is reported on the JUL logger and never reaches the
 * caller.
 */
public final class ActivityLogger {
  private static final Logger logger = Logger.getLogger(ActivityLogger.class.getName());

  private final ActivityLogStore store;
  private final BatchWriteCoordinator<LogEntry> writer;
  private final ConnectionPool pool;
  private final Clock clock;

  public ActivityLogger(ActivityLogStore store, BatchWriteCoordinator<LogEntry> writer,
      ConnectionPool pool, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.pool = Objects.requireNonNull(pool, "pool");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public void log(LogLevel level, LogCategory category, String message) {
    log(level, category, message, null, Map.of());
  }

  public void log(LogLevel level, LogCategory category, String message, String operationId) {
    log(level, category, message, operationId, Map.of());
  }

  /**
   * Records one entry.
   *
   * @param operationId related operation, or {@code null}
   * @param metadata    extra key/value context, may be empty
   */
  public void log(LogLevel level, LogCategory category, String message, String operationId,
      Map<String, String> metadata) {
    LogEntry entry = new LogEntry(Ids.next(), clock.instant(), level, category, message, operationId, metadata);
    if (logger.isLoggable(level.julLevel())) {
      logger.log(level.julLevel(), "[{0}] {1}{2}", new Object[]{
          category.code(), operationId == null ? "" : operationId + " ", message});
    }
    try {
      writer.add(entry).whenComplete((result, error) -> {
        if (error != null) {
          logger.log(Level.SEVERE, "Failed to persist activity log entry " + entry.id(), error);
        }
      });
    } catch (IllegalStateException e) {
      logger.log(Level.WARNING, "Activity log writer closed; entry " + entry.id() + " not persisted", e);
    }
  }

  /**
   * Flushes buffered entries, then returns matching entries newest first.
   */
  public List<LogEntry> query(LogFilter filter) {
    Objects.requireNonNull(filter, "filter");
    writer.flush();
    try (ConnectionLease lease = pool.acquire()) {
      return store.query(lease.connection(), filter);
    }
  }

  /**
   * Deletes persisted entries older than {@code retention}.
   *
   * @return number of deleted entries
   */
  public int purgeOlderThan(Duration retention) {
    Objects.requireNonNull(retention, "retention");
    writer.flush();
    Instant cutoff = clock.instant().minus(retention);
    int deleted;
    try (ConnectionLease lease = pool.acquire()) {
      deleted = store.deleteOlderThan(lease.connection(), cutoff);
    }
    if (deleted > 0) {
      logger.log(Level.INFO, "Purged {0} activity log entries older than {1}", new Object[]{deleted, cutoff});
    }
    return deleted;
  }
}
