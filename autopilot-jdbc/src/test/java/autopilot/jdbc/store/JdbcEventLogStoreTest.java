package autopilot.jdbc.store;

import autopilot.event.DomainEvent;
import autopilot.jdbc.TestDatabase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventLogStoreTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final JdbcEventLogStore store = new JdbcEventLogStore();
  private Connection conn;

  @BeforeEach
  void setUp() throws Exception {
    conn = TestDatabase.create().getConnection();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  private static DomainEvent event(String type, String aggregateId, Instant at) {
    return DomainEvent.builder(type)
        .aggregate("AutonomousOperation", aggregateId)
        .payload("type", "plot")
        .correlationId("corr-1")
        .causationId("cause-1")
        .timestamp(at)
        .build();
  }

  @Test
  void appendedEventIsReadBackWithAllFields() {
    DomainEvent original = event("OperationCompleted", "op-1", T0);
    store.append(conn, original);

    DomainEvent loaded = store.findByAggregateId(conn, "op-1").get(0);

    assertEquals(original.eventId(), loaded.eventId());
    assertEquals("OperationCompleted", loaded.eventType());
    assertEquals("AutonomousOperation", loaded.aggregateType());
    assertEquals(Map.of("type", "plot"), loaded.payload());
    assertEquals("corr-1", loaded.correlationId());
    assertEquals("cause-1", loaded.causationId());
    assertEquals(T0, loaded.timestamp());
  }

  @Test
  void aggregateHistoryIsOldestFirst() {
    store.append(conn, event("OperationCompleted", "op-1", T0.plusSeconds(5)));
    store.append(conn, event("OperationQueued", "op-1", T0));
    store.append(conn, event("OperationQueued", "op-2", T0));

    List<DomainEvent> history = store.findByAggregateId(conn, "op-1");

    assertEquals(List.of("OperationQueued", "OperationCompleted"),
        history.stream().map(DomainEvent::eventType).toList());
  }

  @Test
  void byTypeIsNewestFirstAndLimited() {
    store.append(conn, event("OperationQueued", "op-1", T0));
    store.append(conn, event("OperationQueued", "op-2", T0.plusSeconds(1)));
    store.append(conn, event("OperationFailed", "op-3", T0.plusSeconds(2)));

    List<DomainEvent> queued = store.findByEventType(conn, "OperationQueued", 10);

    assertEquals(List.of("op-2", "op-1"), queued.stream().map(DomainEvent::aggregateId).toList());
    assertEquals(1, store.findByEventType(conn, "OperationQueued", 1).size());
  }
}
