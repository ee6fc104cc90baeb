package autopilot.tx;

import autopilot.StoreErrors;
import autopilot.batch.EventFactory;
import autopilot.event.EventBus;
import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.repo.Repository;
import autopilot.spi.EntityStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An explicit transaction over one pooled connection, shared by every repository
 * obtained from the unit.
 *
 * <p>Use via try-with-resources:
 * <pre>{@code
 * try (UnitOfWork uow = unitOfWorkFactory.create()) {
 *   uow.begin();
 *   uow.repository(contentStore, events).save(content);
 *   uow.commit();
 * }
 * }</pre>
 *
 * <p>A unit is single-use and confined to the thread that called {@link #begin()}.
 * Nesting is rejected: {@code begin()} throws if this unit has already begun or if
 * the thread already has a bound transaction. A second {@code commit()} or
 * {@code rollback()} is rejected. Ending the transaction releases the connection;
 * {@link #close()} rolls back a transaction that was neither committed nor rolled back.
 */
public final class UnitOfWork implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(UnitOfWork.class.getName());

  private enum State { NEW, ACTIVE, COMMITTED, ROLLED_BACK }

  private final ConnectionPool pool;
  private final ThreadLocalTxContext txContext;
  private final EventBus eventBus;

  private State state = State.NEW;
  private ConnectionLease lease;

  UnitOfWork(ConnectionPool pool, ThreadLocalTxContext txContext, EventBus eventBus) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.eventBus = eventBus;
  }

  /**
   * Leases a connection, disables auto-commit and binds it to the current thread.
   *
   * @throws IllegalStateException if this unit was already begun, or the thread already
   *     has an active transaction
   */
  public void begin() {
    if (state != State.NEW) {
      throw new IllegalStateException("Unit of work already " + (state == State.ACTIVE ? "begun" : "completed"));
    }
    if (txContext.isTransactionActive()) {
      throw new IllegalStateException("Nested transactions are not supported");
    }
    ConnectionLease acquired = pool.acquire();
    try {
      acquired.connection().setAutoCommit(false);
      txContext.bind(acquired.connection());
    } catch (SQLException e) {
      acquired.close();
      throw StoreErrors.translate("Failed to begin transaction", e);
    } catch (RuntimeException e) {
      acquired.close();
      throw e;
    }
    this.lease = acquired;
    this.state = State.ACTIVE;
  }

  /**
   * Commits and releases the connection. On a commit failure the transaction is
   * rolled back and the translated error thrown.
   *
   * @throws IllegalStateException if the unit is not active
   * @throws autopilot.StoreException if the commit fails
   */
  public void commit() {
    requireActive("commit");
    boolean committed = false;
    try {
      lease.connection().commit();
      committed = true;
    } catch (SQLException e) {
      rollbackQuietly();
      throw StoreErrors.translate("Failed to commit transaction", e);
    } finally {
      end(committed);
    }
  }

  /**
   * Rolls back and releases the connection.
   *
   * @throws IllegalStateException if the unit is not active
   * @throws autopilot.StoreException if the rollback fails
   */
  public void rollback() {
    requireActive("rollback");
    try {
      lease.connection().rollback();
    } catch (SQLException e) {
      throw StoreErrors.translate("Failed to roll back transaction", e);
    } finally {
      end(false);
    }
  }

  public boolean isActive() {
    return state == State.ACTIVE;
  }

  /**
   * Returns the unit's connection for stores that are not entity repositories.
   *
   * @throws IllegalStateException if the unit is not active
   */
  public Connection connection() {
    requireActive("use connection");
    return lease.connection();
  }

  /**
   * Returns a repository that reads and writes through this unit's connection and
   * publishes write events inside the transaction.
   */
  public <T> Repository<T> repository(EntityStore<T> store, EventFactory<T> eventFactory) {
    return Repository.bound(store, eventFactory, this, eventBus);
  }

  public <T> Repository<T> repository(EntityStore<T> store) {
    return repository(store, EventFactory.none());
  }

  /**
   * Rolls back if the transaction is still active.
   */
  @Override
  public void close() {
    if (state == State.ACTIVE) {
      rollback();
    }
  }

  private void requireActive(String action) {
    if (state != State.ACTIVE) {
      throw new IllegalStateException("Cannot " + action + ": no active transaction (state " + state + ")");
    }
  }

  private void end(boolean committed) {
    state = committed ? State.COMMITTED : State.ROLLED_BACK;
    try {
      txContext.unbind(committed);
    } finally {
      lease.close();
      lease = null;
    }
  }

  private void rollbackQuietly() {
    try {
      lease.connection().rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
    }
  }
}
