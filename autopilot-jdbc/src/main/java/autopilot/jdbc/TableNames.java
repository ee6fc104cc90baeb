package autopilot.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation for the JDBC stores.
 */
public final class TableNames {
  public static final String OPERATIONS = "autonomous_operations";
  public static final String CONTENT = "autonomous_content";
  public static final String CONFIG = "autonomous_config";
  public static final String LOGS = "autonomous_logs";
  public static final String EVENTS = "domain_events";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
