package autopilot.jdbc.store;

import autopilot.jdbc.JdbcTemplate;
import autopilot.jdbc.TableNames;
import autopilot.model.ContentType;
import autopilot.model.SavedContent;
import autopilot.quality.Recommendation;
import autopilot.spi.ContentStore;
import autopilot.util.JsonCodec;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link ContentStore}. Type-specific attributes are stored as a JSON column.
 */
public final class JdbcContentStore implements ContentStore {
  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<SavedContent> rowMapper;

  public JdbcContentStore() {
    this(TableNames.CONTENT, JsonCodec.getDefault());
  }

  public JdbcContentStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> new SavedContent(
        rs.getString("id"),
        rs.getString("operation_id"),
        rs.getString("project_id"),
        ContentType.fromWireName(rs.getString("type")),
        rs.getString("title"),
        rs.getString("body"),
        jsonCodec.parseStringMap(rs.getString("attributes")),
        rs.getInt("quality_score"),
        Recommendation.fromCode(rs.getString("recommendation")),
        JdbcTemplate.instant(rs, "created_at"));
  }

  @Override
  public String entityName() {
    return "AutonomousContent";
  }

  @Override
  public String idOf(SavedContent entity) {
    return entity.id();
  }

  @Override
  public boolean exists(Connection conn, String id) {
    return !JdbcTemplate.query(conn, "SELECT 1 FROM " + tableName + " WHERE id=?", rs -> 1, id).isEmpty();
  }

  @Override
  public void insert(Connection conn, SavedContent content) {
    String sql = "INSERT INTO " + tableName
        + " (id, operation_id, project_id, type, title, body, attributes, quality_score, recommendation, created_at)"
        + " VALUES (?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        content.id(), content.operationId(), content.projectId(), content.type().wireName(),
        content.title(), content.body(), jsonCodec.toJson(content.attributes()),
        content.qualityScore(), content.recommendation().code(),
        JdbcTemplate.timestamp(content.createdAt()));
  }

  @Override
  public void update(Connection conn, SavedContent content) {
    String sql = "UPDATE " + tableName
        + " SET title=?, body=?, attributes=?, quality_score=?, recommendation=? WHERE id=?";
    JdbcTemplate.update(conn, sql,
        content.title(), content.body(), jsonCodec.toJson(content.attributes()),
        content.qualityScore(), content.recommendation().code(), content.id());
  }

  @Override
  public Optional<SavedContent> findById(Connection conn, String id) {
    return JdbcTemplate.queryFirst(conn, "SELECT * FROM " + tableName + " WHERE id=?", rowMapper, id);
  }

  @Override
  public List<SavedContent> findByType(Connection conn, ContentType type, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT * FROM " + tableName + " WHERE type=? ORDER BY created_at DESC, id DESC LIMIT ?",
        rowMapper, type.wireName(), limit);
  }
}
