package autopilot.event;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {
  private EventBus bus;

  @BeforeEach
  void setUp() {
    bus = EventBus.builder().handlerThreads(4).maxHandlersPerType(3).build();
  }

  @AfterEach
  void tearDown() {
    bus.close();
  }

  private static DomainEvent event(String type) {
    return DomainEvent.builder(type).aggregate("AutonomousOperation", "op-1").payload("k", "v").build();
  }

  // ── Delivery ──────────────────────────────────────────────────

  @Test
  void deliversToHandlersOfMatchingType() {
    List<String> seen = new CopyOnWriteArrayList<>();
    bus.subscribe("OperationCompleted", e -> seen.add("completed:" + e.aggregateId()));
    bus.subscribe("OperationFailed", e -> seen.add("failed"));

    bus.publish(event("OperationCompleted"));

    assertEquals(List.of("completed:op-1"), seen);
  }

  @Test
  void wildcardHandlersSeeEveryEvent() {
    List<String> seen = new CopyOnWriteArrayList<>();
    bus.subscribeAll(e -> seen.add(e.eventType()));

    bus.publish(event("A"));
    bus.publish(event("B"));

    assertEquals(List.of("A", "B"), seen);
  }

  @Test
  void publishReturnsAfterAllHandlersSettle() {
    AtomicInteger done = new AtomicInteger();
    for (int i = 0; i < 3; i++) {
      bus.subscribe("Slow", e -> {
        Thread.sleep(50);
        done.incrementAndGet();
      });
    }

    bus.publish(event("Slow"));

    assertEquals(3, done.get());
  }

  @Test
  void handlersRunConcurrently() throws Exception {
    CountDownLatch bothRunning = new CountDownLatch(2);
    EventHandler handler = e -> {
      bothRunning.countDown();
      if (!bothRunning.await(5, TimeUnit.SECONDS)) {
        throw new IllegalStateException("handlers ran sequentially");
      }
    };
    bus.subscribe("Parallel", handler);
    bus.subscribe("Parallel", handler);
    List<Exception> errors = new CopyOnWriteArrayList<>();
    bus.onError((e, error) -> errors.add(error));

    bus.publish(event("Parallel"));

    assertTrue(errors.isEmpty());
  }

  @Test
  void publishAllKeepsOrder() {
    List<String> seen = Collections.synchronizedList(new ArrayList<>());
    bus.subscribeAll(e -> seen.add(e.eventType()));

    bus.publishAll(List.of(event("1"), event("2"), event("3")));

    assertEquals(List.of("1", "2", "3"), seen);
  }

  @Test
  void nestedPublishRunsInline() {
    List<String> seen = new CopyOnWriteArrayList<>();
    bus.subscribe("Outer", e -> bus.publish(event("Inner")));
    bus.subscribe("Inner", e -> seen.add("inner"));

    bus.publish(event("Outer"));

    assertEquals(List.of("inner"), seen);
  }

  // ── Failure isolation ─────────────────────────────────────────

  @Test
  void failingHandlerDoesNotAffectSiblingsOrPublisher() {
    AtomicInteger delivered = new AtomicInteger();
    List<String> errors = new CopyOnWriteArrayList<>();
    bus.subscribe("E", e -> {
      throw new IllegalStateException("handler broke");
    });
    bus.subscribe("E", e -> delivered.incrementAndGet());
    bus.onError((e, error) -> errors.add(e.eventType() + ":" + error.getMessage()));

    assertDoesNotThrow(() -> bus.publish(event("E")));

    assertEquals(1, delivered.get());
    assertEquals(List.of("E:handler broke"), errors);
  }

  @Test
  void middlewareFailureStopsPublication() {
    AtomicInteger delivered = new AtomicInteger();
    bus.subscribe("E", e -> delivered.incrementAndGet());
    bus.use(e -> {
      throw new IllegalArgumentException("rejected");
    });

    assertThrows(IllegalArgumentException.class, () -> bus.publish(event("E")));
    assertEquals(0, delivered.get());
  }

  @Test
  void middlewaresRunInOrderAroundHandlers() {
    List<String> trace = new CopyOnWriteArrayList<>();
    bus.use(new EventMiddleware() {
      @Override
      public void beforePublish(DomainEvent event) {
        trace.add("before-1");
      }

      @Override
      public void afterPublish(DomainEvent event) {
        trace.add("after-1");
      }
    });
    bus.use(e -> trace.add("before-2"));
    bus.subscribe("E", e -> trace.add("handler"));

    bus.publish(event("E"));

    assertEquals(List.of("before-1", "before-2", "handler", "after-1"), trace);
  }

  // ── Registry ──────────────────────────────────────────────────

  @Test
  void unsubscribeStopsDelivery() {
    AtomicInteger delivered = new AtomicInteger();
    Subscription subscription = bus.subscribe("E", e -> delivered.incrementAndGet());

    bus.publish(event("E"));
    subscription.unsubscribe();
    subscription.unsubscribe();
    bus.publish(event("E"));

    assertEquals(1, delivered.get());
    assertEquals(0, bus.handlerCount("E"));
  }

  @Test
  void handlerLimitPerTypeIsEnforced() {
    for (int i = 0; i < 3; i++) {
      bus.subscribe("E", e -> { });
    }

    assertThrows(IllegalStateException.class, () -> bus.subscribe("E", e -> { }));
    bus.subscribe("Other", e -> { });
  }

  @Test
  void subscribeManyRollsBackOnLimit() {
    for (int i = 0; i < 3; i++) {
      bus.subscribe("B", e -> { });
    }

    assertThrows(IllegalStateException.class, () -> bus.subscribeMany(List.of("A", "B"), e -> { }));
    assertEquals(0, bus.handlerCount("A"));
  }

  @Test
  void subscribeManyHandleRemovesAll() {
    AtomicInteger delivered = new AtomicInteger();
    Subscription subscription = bus.subscribeMany(List.of("A", "B"), e -> delivered.incrementAndGet());

    bus.publish(event("A"));
    bus.publish(event("B"));
    subscription.unsubscribe();
    bus.publish(event("A"));

    assertEquals(2, delivered.get());
  }

  @Test
  void closedBusRejectsPublish() {
    bus.close();

    assertThrows(IllegalStateException.class, () -> bus.publish(event("E")));
  }

  // ── Events ────────────────────────────────────────────────────

  @Test
  void eventsGetIdsAndRejectNullPayloadValues() {
    DomainEvent a = event("E");
    DomainEvent b = event("E");

    assertNotEquals(a.eventId(), b.eventId());
    assertNotNull(a.timestamp());
    assertThrows(IllegalArgumentException.class,
        () -> DomainEvent.builder("E").aggregate("T", "1").payload("k", null).build());
    assertThrows(IllegalArgumentException.class,
        () -> DomainEvent.builder("").aggregate("T", "1").build());
  }

  @Test
  void metadataOmitsAbsentIds() {
    DomainEvent plain = event("E");
    DomainEvent caused = DomainEvent.builder("E").aggregate("T", "1")
        .correlationId("corr").causationId(plain.eventId()).build();

    assertEquals(1, plain.metadata().size());
    assertEquals("corr", caused.metadata().get("correlationId"));
    assertEquals(plain.eventId(), caused.metadata().get("causationId"));
  }
}
