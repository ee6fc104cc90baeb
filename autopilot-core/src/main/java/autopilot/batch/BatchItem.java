package autopilot.batch;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A queued write: the payload, the caller's single-fulfillment future and the number
 * of failed chunk attempts so far.
 */
final class BatchItem<T> {
  private final T payload;
  private final CompletableFuture<WriteResult> result = new CompletableFuture<>();
  private final Instant enqueuedAt;
  private int retryCount;

  BatchItem(T payload, Instant enqueuedAt) {
    this.payload = payload;
    this.enqueuedAt = enqueuedAt;
  }

  T payload() {
    return payload;
  }

  CompletableFuture<WriteResult> result() {
    return result;
  }

  Instant enqueuedAt() {
    return enqueuedAt;
  }

  int retryCount() {
    return retryCount;
  }

  int incrementRetryCount() {
    return ++retryCount;
  }
}
