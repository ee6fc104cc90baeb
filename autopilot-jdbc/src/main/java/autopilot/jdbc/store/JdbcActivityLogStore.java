package autopilot.jdbc.store;

import autopilot.jdbc.JdbcTemplate;
import autopilot.jdbc.TableNames;
import autopilot.model.LogCategory;
import autopilot.model.LogEntry;
import autopilot.model.LogFilter;
import autopilot.model.LogLevel;
import autopilot.spi.ActivityLogStore;
import autopilot.util.JsonCodec;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link ActivityLogStore}. Metadata is stored as a flat JSON object.
 */
public final class JdbcActivityLogStore implements ActivityLogStore {
  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<LogEntry> rowMapper;

  public JdbcActivityLogStore() {
    this(TableNames.LOGS, JsonCodec.getDefault());
  }

  public JdbcActivityLogStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new LogEntry(
        rs.getString("id"),
        JdbcTemplate.instant(rs, "logged_at"),
        LogLevel.fromCode(rs.getString("level")),
        LogCategory.fromCode(rs.getString("category")),
        rs.getString("message"),
        rs.getString("operation_id"),
        jsonCodec.parseStringMap(rs.getString("metadata")));
  }

  @Override
  public String entityName() {
    return "AutonomousLog";
  }

  @Override
  public String idOf(LogEntry entity) {
    return entity.id();
  }

  @Override
  public boolean exists(Connection conn, String id) {
    return !JdbcTemplate.query(conn, "SELECT 1 FROM " + tableName + " WHERE id=?", rs -> 1, id).isEmpty();
  }

  @Override
  public void insert(Connection conn, LogEntry entry) {
    String sql = "INSERT INTO " + tableName
        + " (id, logged_at, level, category, message, operation_id, metadata) VALUES (?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        entry.id(), JdbcTemplate.timestamp(entry.timestamp()), entry.level().code(),
        entry.category().code(), entry.message(), entry.operationId(),
        entry.metadata().isEmpty() ? null : jsonCodec.toJson(entry.metadata()));
  }

  /**
   * Log entries are immutable; an update rewrites the message and metadata only.
   */
  @Override
  public void update(Connection conn, LogEntry entry) {
    JdbcTemplate.update(conn, "UPDATE " + tableName + " SET message=?, metadata=? WHERE id=?",
        entry.message(), entry.metadata().isEmpty() ? null : jsonCodec.toJson(entry.metadata()), entry.id());
  }

  @Override
  public Optional<LogEntry> findById(Connection conn, String id) {
    return JdbcTemplate.queryFirst(conn, "SELECT * FROM " + tableName + " WHERE id=?", rowMapper, id);
  }

  @Override
  public List<LogEntry> query(Connection conn, LogFilter filter) {
    StringBuilder sql = new StringBuilder("SELECT * FROM ").append(tableName).append(" WHERE 1=1");
    List<Object> params = new ArrayList<>();
    if (filter.level() != null) {
      sql.append(" AND level=?");
      params.add(filter.level().code());
    }
    if (filter.category() != null) {
      sql.append(" AND category=?");
      params.add(filter.category().code());
    }
    if (filter.operationId() != null) {
      sql.append(" AND operation_id=?");
      params.add(filter.operationId());
    }
    if (filter.since() != null) {
      sql.append(" AND logged_at>=?");
      params.add(JdbcTemplate.timestamp(filter.since()));
    }
    if (filter.messageContains() != null) {
      sql.append(" AND LOWER(message) LIKE ?");
      params.add("%" + filter.messageContains().toLowerCase(Locale.ROOT) + "%");
    }
    sql.append(" ORDER BY logged_at DESC, id DESC LIMIT ?");
    params.add(filter.limit());
    return JdbcTemplate.query(conn, sql.toString(), rowMapper, params.toArray());
  }

  @Override
  public int deleteOlderThan(Connection conn, Instant cutoff) {
    Objects.requireNonNull(cutoff, "cutoff");
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE logged_at<?", JdbcTemplate.timestamp(cutoff));
  }
}
