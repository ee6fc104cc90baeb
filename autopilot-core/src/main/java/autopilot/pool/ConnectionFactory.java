package autopilot.pool;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens new physical connections for a {@link ConnectionPool}.
 *
 * <p>Typically a method reference such as {@code dataSource::getConnection}.
 */
@FunctionalInterface
public interface ConnectionFactory {

  /**
   * Opens a new connection. The pool owns the returned connection and closes it on
   * eviction or shutdown.
   */
  Connection open() throws SQLException;
}
