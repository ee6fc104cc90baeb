package autopilot.event;

import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.spi.EventLogStore;
import autopilot.spi.TxContext;

import java.util.Objects;

/**
 * Appends every published event to the durable event log before handlers run.
 *
 * <p>When the publishing thread has a bound transaction (a batch chunk or a unit of
 * work), the append joins it, so a rolled-back write leaves no event behind.
 * Otherwise the event is appended on its own pooled auto-commit connection.
 */
public final class EventLogMiddleware implements EventMiddleware {
  private final EventLogStore store;
  private final TxContext txContext;
  private final ConnectionPool pool;

  public EventLogMiddleware(EventLogStore store, TxContext txContext, ConnectionPool pool) {
    this.store = Objects.requireNonNull(store, "store");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  @Override
  public void beforePublish(DomainEvent event) {
    if (txContext.isTransactionActive()) {
      store.append(txContext.currentConnection(), event);
      return;
    }
    try (ConnectionLease lease = pool.acquire()) {
      store.append(lease.connection(), event);
    }
  }
}
