package autopilot.model;

import autopilot.quality.Recommendation;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OperationTest {
  private static final Instant T0 = Instant.parse("2026-05-01T10:00:00Z");
  private static final Instant T1 = T0.plusSeconds(12);

  @Test
  void pendingOperationsGetDistinctIds() {
    Operation a = Operation.pending(ContentType.PLOT, "project-1");
    Operation b = Operation.pending(ContentType.PLOT, "project-1");

    assertEquals(OperationStatus.PENDING, a.status());
    assertNotEquals(a.id(), b.id());
    assertNull(a.startTime());
  }

  @Test
  void happyPathTransitions() {
    Operation running = Operation.pending(ContentType.CHARACTER, null).start(T0);
    OperationResult result = new OperationResult("content-1", "Character: brave", 81, Recommendation.SAVE, true);
    Operation done = running.complete(T1, new OperationMetrics(12_000, 300, 1, 0, 4), result);

    assertEquals(OperationStatus.RUNNING, running.status());
    assertEquals(T0, running.startTime());
    assertEquals(OperationStatus.COMPLETED, done.status());
    assertEquals(T0, done.startTime());
    assertEquals(T1, done.endTime());
    assertEquals(result, done.result());
    assertTrue(done.isTerminal());
  }

  @Test
  void failureRecordsError() {
    Operation failed = Operation.pending(ContentType.PLOT, null).start(T0).fail(T1, OperationMetrics.EMPTY, null);

    assertEquals(OperationStatus.FAILED, failed.status());
    assertEquals("unknown error", failed.error());
    assertNull(failed.result());
  }

  @Test
  void anyNonTerminalStatusCanBeCancelled() {
    Operation pending = Operation.pending(ContentType.PLOT, null);

    assertEquals(OperationStatus.CANCELLED, pending.cancel(T0).status());
    assertEquals(OperationStatus.CANCELLED, pending.start(T0).cancel(T1).status());
  }

  @Test
  void terminalOperationsRejectTransitions() {
    Operation failed = Operation.pending(ContentType.PLOT, null).start(T0).fail(T1, OperationMetrics.EMPTY, "x");

    assertThrows(IllegalStateException.class, () -> failed.cancel(T1));
    assertThrows(IllegalStateException.class, () -> failed.start(T1));
    assertThrows(IllegalStateException.class, () -> failed.fail(T1, OperationMetrics.EMPTY, "again"));
  }

  @Test
  void pendingCannotCompleteDirectly() {
    Operation pending = Operation.pending(ContentType.PLOT, null);
    OperationResult result = new OperationResult(null, "t", 40, Recommendation.DISCARD, false);

    assertThrows(IllegalStateException.class, () -> pending.complete(T1, OperationMetrics.EMPTY, result));
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new OperationMetrics(-1, 0, 0, 0, 0));
    assertThrows(IllegalArgumentException.class,
        () -> new OperationResult(null, "t", 80, Recommendation.SAVE, true));
  }

  @Test
  void statusCodes() {
    assertEquals("cancelled", OperationStatus.CANCELLED.code());
    assertEquals(OperationStatus.RUNNING, OperationStatus.fromCode("running"));
    assertFalse(OperationStatus.RUNNING.isTerminal());
  }
}
