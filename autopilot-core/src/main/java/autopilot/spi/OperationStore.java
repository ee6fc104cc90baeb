package autopilot.spi;

import autopilot.model.Operation;

import java.sql.Connection;
import java.util.List;

/**
 * Persistence for {@link Operation} records, keyed by operation id.
 *
 * <p>{@link #update} must leave rows that are already terminal untouched, so a
 * late write can never resurrect a finished operation.
 */
public interface OperationStore extends EntityStore<Operation> {

  /**
   * Returns up to {@code limit} operations, most recently started first.
   */
  List<Operation> findRecent(Connection conn, int limit);
}
