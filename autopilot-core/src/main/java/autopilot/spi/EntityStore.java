package autopilot.spi;

import autopilot.batch.WriteOutcome;

import java.sql.Connection;
import java.util.Optional;

/**
 * Persistence operations for one entity type, always on a caller-supplied connection.
 *
 * <p>The caller owns the connection and the transaction boundary: the batch
 * coordinator runs a whole chunk on one connection, a unit of work runs every
 * repository on its own. Implementations throw {@link autopilot.StoreException} (or
 * {@link autopilot.TransientStoreException}) on failure.
 *
 * @param <T> the entity type
 */
public interface EntityStore<T> {

  /**
   * Logical entity name, used as the aggregate type of write events.
   */
  String entityName();

  String idOf(T entity);

  boolean exists(Connection conn, String id);

  void insert(Connection conn, T entity);

  void update(Connection conn, T entity);

  Optional<T> findById(Connection conn, String id);

  /**
   * Inserts the entity, or updates it if a row with its id already exists.
   */
  default WriteOutcome upsert(Connection conn, T entity) {
    if (exists(conn, idOf(entity))) {
      update(conn, entity);
      return WriteOutcome.UPDATED;
    }
    insert(conn, entity);
    return WriteOutcome.INSERTED;
  }
}
