package autopilot.jdbc;

import autopilot.pool.ConnectionFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionFactory} backed by a {@link DataSource}.
 * Delegates directly to {@link DataSource#getConnection()}.
 */
public final class DataSourceConnectionFactory implements ConnectionFactory {
  private final DataSource dataSource;

  public DataSourceConnectionFactory(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public Connection open() throws SQLException {
    return dataSource.getConnection();
  }
}
