package autopilot;

import java.sql.SQLException;
import java.sql.SQLTransientException;

/**
 * Translates {@link SQLException}s into the unchecked store exception hierarchy.
 *
 * <p>Connection failures (SQL state class {@code 08}), transaction rollbacks and
 * deadlocks (class {@code 40}), lock timeouts ({@code HYT00}) and any
 * {@link SQLTransientException} map to {@link TransientStoreException}. Everything
 * else maps to a plain {@link StoreException}.
 */
public final class StoreErrors {

  public static StoreException translate(String message, SQLException e) {
    if (isTransient(e)) {
      return new TransientStoreException(message, e);
    }
    return new StoreException(message, e);
  }

  public static boolean isTransient(SQLException e) {
    for (SQLException current = e; current != null; current = current.getNextException()) {
      if (current instanceof SQLTransientException) {
        return true;
      }
      String state = current.getSQLState();
      if (state != null && (state.startsWith("08") || state.startsWith("40") || state.equals("HYT00"))) {
        return true;
      }
      if (current.getCause() instanceof SQLException cause && cause != current && isTransient(cause)) {
        return true;
      }
    }
    return false;
  }

  private StoreErrors() {}
}
