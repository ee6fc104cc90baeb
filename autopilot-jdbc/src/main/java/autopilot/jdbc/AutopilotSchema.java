package autopilot.jdbc;

import java.sql.Connection;
import java.util.List;

/**
 * DDL for the tables used by the JDBC stores, under their default names.
 *
 * <p>Statements use {@code CREATE ... IF NOT EXISTS} and portable column types (H2,
 * PostgreSQL). MySQL lacks {@code CREATE INDEX IF NOT EXISTS}; create the indexes there
 * by hand.
 */
public final class AutopilotSchema {

  public static final String OPERATIONS_DDL = "CREATE TABLE IF NOT EXISTS " + TableNames.OPERATIONS + " ("
      + "id VARCHAR(36) PRIMARY KEY, "
      + "type VARCHAR(32) NOT NULL, "
      + "status VARCHAR(16) NOT NULL, "
      + "project_id VARCHAR(128), "
      + "start_time TIMESTAMP(6), "
      + "end_time TIMESTAMP(6), "
      + "metrics TEXT, "
      + "result TEXT, "
      + "error VARCHAR(4000))";

  public static final String CONTENT_DDL = "CREATE TABLE IF NOT EXISTS " + TableNames.CONTENT + " ("
      + "id VARCHAR(36) PRIMARY KEY, "
      + "operation_id VARCHAR(36), "
      + "project_id VARCHAR(128), "
      + "type VARCHAR(32) NOT NULL, "
      + "title VARCHAR(512) NOT NULL, "
      + "body TEXT NOT NULL, "
      + "attributes TEXT, "
      + "quality_score INT NOT NULL, "
      + "recommendation VARCHAR(16) NOT NULL, "
      + "created_at TIMESTAMP(6) NOT NULL)";

  public static final String CONFIG_DDL = "CREATE TABLE IF NOT EXISTS " + TableNames.CONFIG + " ("
      + "version INT PRIMARY KEY, "
      + "config TEXT NOT NULL, "
      + "created_at TIMESTAMP(6) NOT NULL)";

  public static final String LOGS_DDL = "CREATE TABLE IF NOT EXISTS " + TableNames.LOGS + " ("
      + "id VARCHAR(36) PRIMARY KEY, "
      + "logged_at TIMESTAMP(6) NOT NULL, "
      + "level VARCHAR(8) NOT NULL, "
      + "category VARCHAR(16) NOT NULL, "
      + "message VARCHAR(4000) NOT NULL, "
      + "operation_id VARCHAR(36), "
      + "metadata TEXT)";

  public static final String EVENTS_DDL = "CREATE TABLE IF NOT EXISTS " + TableNames.EVENTS + " ("
      + "event_id VARCHAR(36) PRIMARY KEY, "
      + "event_type VARCHAR(128) NOT NULL, "
      + "aggregate_type VARCHAR(128) NOT NULL, "
      + "aggregate_id VARCHAR(128) NOT NULL, "
      + "payload TEXT, "
      + "correlation_id VARCHAR(128), "
      + "causation_id VARCHAR(128), "
      + "occurred_at TIMESTAMP(6) NOT NULL)";

  public static final List<String> STATEMENTS = List.of(
      OPERATIONS_DDL, CONTENT_DDL, CONFIG_DDL, LOGS_DDL, EVENTS_DDL,
      "CREATE INDEX IF NOT EXISTS idx_autonomous_logs_logged_at ON " + TableNames.LOGS + " (logged_at)",
      "CREATE INDEX IF NOT EXISTS idx_domain_events_aggregate ON " + TableNames.EVENTS + " (aggregate_id)");

  /**
   * Creates every table and index that does not exist yet.
   */
  public static void create(Connection conn) {
    for (String statement : STATEMENTS) {
      JdbcTemplate.execute(conn, statement);
    }
  }

  private AutopilotSchema() {}
}
