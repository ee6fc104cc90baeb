package autopilot.spi;

import java.sql.Connection;

/**
 * Exposes the transaction bound to the current thread so that collaborators (the
 * event-log middleware, repositories) can join it instead of leasing their own
 * connection.
 *
 * @see autopilot.tx.ThreadLocalTxContext
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();

  /**
   * Registers a callback to run after the current transaction commits.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterCommit(Runnable callback);

  /**
   * Registers a callback to run after the current transaction rolls back.
   *
   * @throws IllegalStateException if no transaction is active
   */
  void afterRollback(Runnable callback);
}
