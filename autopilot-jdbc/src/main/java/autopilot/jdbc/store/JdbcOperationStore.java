package autopilot.jdbc.store;

import autopilot.jdbc.JdbcTemplate;
import autopilot.jdbc.TableNames;
import autopilot.model.ContentType;
import autopilot.model.Operation;
import autopilot.model.OperationMetrics;
import autopilot.model.OperationResult;
import autopilot.model.OperationStatus;
import autopilot.quality.Recommendation;
import autopilot.spi.OperationStore;
import autopilot.util.JsonCodec;

import java.sql.Connection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link OperationStore}. Metrics and results are stored as JSON columns.
 *
 * <p>Updates only touch rows whose status is not terminal.
 */
public final class JdbcOperationStore implements OperationStore {
  private static final int MAX_ERROR_LENGTH = 4000;

  private static final String TERMINAL_STATUS_IN = "('" + OperationStatus.COMPLETED.code() + "','"
      + OperationStatus.FAILED.code() + "','" + OperationStatus.CANCELLED.code() + "')";

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Operation> rowMapper;

  public JdbcOperationStore() {
    this(TableNames.OPERATIONS, JsonCodec.getDefault());
  }

  public JdbcOperationStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new Operation(
        rs.getString("id"),
        ContentType.fromWireName(rs.getString("type")),
        OperationStatus.fromCode(rs.getString("status")),
        rs.getString("project_id"),
        JdbcTemplate.instant(rs, "start_time"),
        JdbcTemplate.instant(rs, "end_time"),
        decodeMetrics(rs.getString("metrics")),
        decodeResult(rs.getString("result")),
        rs.getString("error"));
  }

  @Override
  public String entityName() {
    return "AutonomousOperation";
  }

  @Override
  public String idOf(Operation entity) {
    return entity.id();
  }

  @Override
  public boolean exists(Connection conn, String id) {
    return !JdbcTemplate.query(conn, "SELECT 1 FROM " + tableName + " WHERE id=?", rs -> 1, id).isEmpty();
  }

  @Override
  public void insert(Connection conn, Operation op) {
    String sql = "INSERT INTO " + tableName
        + " (id, type, status, project_id, start_time, end_time, metrics, result, error)"
        + " VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        op.id(), op.type().wireName(), op.status().code(), op.projectId(),
        JdbcTemplate.timestamp(op.startTime()), JdbcTemplate.timestamp(op.endTime()),
        encodeMetrics(op.metrics()), encodeResult(op.result()), truncateError(op.error()));
  }

  @Override
  public void update(Connection conn, Operation op) {
    String sql = "UPDATE " + tableName
        + " SET status=?, project_id=?, start_time=?, end_time=?, metrics=?, result=?, error=?"
        + " WHERE id=? AND status NOT IN " + TERMINAL_STATUS_IN;
    JdbcTemplate.update(conn, sql,
        op.status().code(), op.projectId(),
        JdbcTemplate.timestamp(op.startTime()), JdbcTemplate.timestamp(op.endTime()),
        encodeMetrics(op.metrics()), encodeResult(op.result()), truncateError(op.error()),
        op.id());
  }

  @Override
  public Optional<Operation> findById(Connection conn, String id) {
    return JdbcTemplate.queryFirst(conn, "SELECT * FROM " + tableName + " WHERE id=?", rowMapper, id);
  }

  @Override
  public List<Operation> findRecent(Connection conn, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT * FROM " + tableName + " ORDER BY start_time DESC, id DESC LIMIT ?", rowMapper, limit);
  }

  private String encodeMetrics(OperationMetrics metrics) {
    if (metrics == null) {
      return null;
    }
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("durationMs", metrics.durationMs());
    json.put("tokensUsed", metrics.tokensUsed());
    json.put("apiCalls", metrics.apiCalls());
    json.put("cpuDelta", metrics.cpuDelta());
    json.put("memoryDelta", metrics.memoryDelta());
    return jsonCodec.toJson(json);
  }

  private OperationMetrics decodeMetrics(String text) {
    if (text == null) {
      return null;
    }
    Map<String, Object> json = jsonCodec.parseObject(text);
    return new OperationMetrics(
        number(json, "durationMs").longValue(),
        number(json, "tokensUsed").intValue(),
        number(json, "apiCalls").intValue(),
        number(json, "cpuDelta").doubleValue(),
        number(json, "memoryDelta").doubleValue());
  }

  private String encodeResult(OperationResult result) {
    if (result == null) {
      return null;
    }
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("contentId", result.contentId());
    json.put("title", result.title());
    json.put("qualityScore", result.qualityScore());
    json.put("recommendation", result.recommendation().code());
    json.put("saved", result.saved());
    return jsonCodec.toJson(json);
  }

  private OperationResult decodeResult(String text) {
    if (text == null) {
      return null;
    }
    Map<String, Object> json = jsonCodec.parseObject(text);
    return new OperationResult(
        (String) json.get("contentId"),
        (String) json.get("title"),
        number(json, "qualityScore").intValue(),
        Recommendation.fromCode((String) json.get("recommendation")),
        Boolean.TRUE.equals(json.get("saved")));
  }

  private static Number number(Map<String, Object> json, String key) {
    Object value = json.get(key);
    return value instanceof Number n ? n : 0;
  }

  private static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
  }
}
