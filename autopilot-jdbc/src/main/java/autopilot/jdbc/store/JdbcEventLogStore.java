package autopilot.jdbc.store;

import autopilot.event.DomainEvent;
import autopilot.jdbc.JdbcTemplate;
import autopilot.jdbc.TableNames;
import autopilot.spi.EventLogStore;
import autopilot.util.JsonCodec;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;

/**
 * JDBC {@link EventLogStore}. The payload is stored as a flat JSON object.
 */
public final class JdbcEventLogStore implements EventLogStore {
  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<DomainEvent> rowMapper;

  public JdbcEventLogStore() {
    this(TableNames.EVENTS, JsonCodec.getDefault());
  }

  public JdbcEventLogStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> DomainEvent.builder(rs.getString("event_type"))
        .eventId(rs.getString("event_id"))
        .aggregate(rs.getString("aggregate_type"), rs.getString("aggregate_id"))
        .payload(jsonCodec.parseStringMap(rs.getString("payload")))
        .timestamp(JdbcTemplate.instant(rs, "occurred_at"))
        .correlationId(rs.getString("correlation_id"))
        .causationId(rs.getString("causation_id"))
        .build();
  }

  @Override
  public void append(Connection conn, DomainEvent event) {
    String sql = "INSERT INTO " + tableName
        + " (event_id, event_type, aggregate_type, aggregate_id, payload, correlation_id, causation_id, occurred_at)"
        + " VALUES (?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        event.eventId(), event.eventType(), event.aggregateType(), event.aggregateId(),
        jsonCodec.toJson(event.payload()), event.correlationId(), event.causationId(),
        JdbcTemplate.timestamp(event.timestamp()));
  }

  @Override
  public List<DomainEvent> findByAggregateId(Connection conn, String aggregateId) {
    return JdbcTemplate.query(conn,
        "SELECT * FROM " + tableName + " WHERE aggregate_id=? ORDER BY occurred_at, event_id",
        rowMapper, aggregateId);
  }

  @Override
  public List<DomainEvent> findByEventType(Connection conn, String eventType, int limit) {
    return JdbcTemplate.query(conn,
        "SELECT * FROM " + tableName + " WHERE event_type=? ORDER BY occurred_at DESC, event_id DESC LIMIT ?",
        rowMapper, eventType, limit);
  }
}
