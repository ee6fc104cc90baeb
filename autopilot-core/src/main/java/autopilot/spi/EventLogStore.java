package autopilot.spi;

import autopilot.event.DomainEvent;

import java.sql.Connection;
import java.util.List;

/**
 * Append-only durable log of published domain events.
 */
public interface EventLogStore {

  void append(Connection conn, DomainEvent event);

  /**
   * Returns the aggregate's events, oldest first.
   */
  List<DomainEvent> findByAggregateId(Connection conn, String aggregateId);

  /**
   * Returns up to {@code limit} events of one type, newest first.
   */
  List<DomainEvent> findByEventType(Connection conn, String eventType, int limit);
}
