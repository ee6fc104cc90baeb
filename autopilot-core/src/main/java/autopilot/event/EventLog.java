package autopilot.event;

import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.spi.EventLogStore;

import java.util.List;
import java.util.Objects;

/**
 * Read access to the durable event log.
 */
public final class EventLog {
  private final EventLogStore store;
  private final ConnectionPool pool;

  public EventLog(EventLogStore store, ConnectionPool pool) {
    this.store = Objects.requireNonNull(store, "store");
    this.pool = Objects.requireNonNull(pool, "pool");
  }

  /**
   * Returns every event recorded for the aggregate, oldest first.
   */
  public List<DomainEvent> byAggregate(String aggregateId) {
    Objects.requireNonNull(aggregateId, "aggregateId");
    try (ConnectionLease lease = pool.acquire()) {
      return store.findByAggregateId(lease.connection(), aggregateId);
    }
  }

  /**
   * Returns up to {@code limit} events of the type, newest first.
   */
  public List<DomainEvent> byType(String eventType, int limit) {
    Objects.requireNonNull(eventType, "eventType");
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (ConnectionLease lease = pool.acquire()) {
      return store.findByEventType(lease.connection(), eventType, limit);
    }
  }
}
