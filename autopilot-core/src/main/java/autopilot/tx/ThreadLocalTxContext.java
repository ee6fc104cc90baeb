package autopilot.tx;

import autopilot.spi.TxContext;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TxContext} that keeps the active transaction in a {@link ThreadLocal}.
 *
 * <p>Bound by {@link UnitOfWork#begin()} and by the batch coordinator around each
 * chunk. Only one transaction can be bound per thread.
 */
public final class ThreadLocalTxContext implements TxContext {
  private static final Logger logger = Logger.getLogger(ThreadLocalTxContext.class.getName());

  private final ThreadLocal<TxState> state = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return state.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return current().connection;
  }

  @Override
  public void afterCommit(Runnable callback) {
    current().afterCommit.add(callback);
  }

  @Override
  public void afterRollback(Runnable callback) {
    current().afterRollback.add(callback);
  }

  /**
   * Binds {@code connection} as the current thread's transaction.
   *
   * @throws IllegalStateException if a transaction is already bound
   */
  public void bind(Connection connection) {
    if (state.get() != null) {
      throw new IllegalStateException("Transaction already active on this thread");
    }
    state.set(new TxState(connection));
  }

  /**
   * Unbinds the current transaction and runs the commit or rollback callbacks.
   * Callback failures are logged; they cannot undo the outcome.
   */
  public void unbind(boolean committed) {
    TxState current = state.get();
    if (current == null) {
      return;
    }
    state.remove();
    for (Runnable callback : committed ? current.afterCommit : current.afterRollback) {
      try {
        callback.run();
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Transaction " + (committed ? "afterCommit" : "afterRollback")
            + " callback failed", e);
      }
    }
  }

  private TxState current() {
    TxState current = state.get();
    if (current == null) {
      throw new IllegalStateException("No active transaction");
    }
    return current;
  }

  private static final class TxState {
    private final Connection connection;
    private final List<Runnable> afterCommit = new ArrayList<>();
    private final List<Runnable> afterRollback = new ArrayList<>();

    private TxState(Connection connection) {
      this.connection = connection;
    }
  }
}
