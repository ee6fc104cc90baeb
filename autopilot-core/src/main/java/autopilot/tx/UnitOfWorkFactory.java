package autopilot.tx;

import autopilot.event.EventBus;
import autopilot.pool.ConnectionPool;
import autopilot.retry.Retrier;
import autopilot.retry.Retries;
import autopilot.retry.RetryOptions;

import java.util.Objects;
import java.util.function.Function;

/**
 * Creates {@link UnitOfWork}s sharing one pool, transaction context and event bus.
 */
public final class UnitOfWorkFactory {

  private final ConnectionPool pool;
  private final ThreadLocalTxContext txContext;
  private final EventBus eventBus;
  private final Retrier retrier;

  public UnitOfWorkFactory(ConnectionPool pool, ThreadLocalTxContext txContext, EventBus eventBus) {
    this(pool, txContext, eventBus, new Retrier(RetryOptions.builder()
        .maxAttempts(3)
        .initialDelayMs(100)
        .maxDelayMs(2000)
        .shouldRetry(Retries.transientStoreErrors())
        .build()));
  }

  public UnitOfWorkFactory(ConnectionPool pool, ThreadLocalTxContext txContext, EventBus eventBus, Retrier retrier) {
    this.pool = Objects.requireNonNull(pool, "pool");
    this.txContext = Objects.requireNonNull(txContext, "txContext");
    this.eventBus = eventBus;
    this.retrier = Objects.requireNonNull(retrier, "retrier");
  }

  public UnitOfWork create() {
    return new UnitOfWork(pool, txContext, eventBus);
  }

  /**
   * Runs {@code work} in a fresh unit: begin, run, commit, rolling back on failure.
   * The whole unit is retried for transient store errors.
   *
   * @throws RuntimeException the failure of the last attempt
   */
  public <R> R inTransaction(Function<UnitOfWork, R> work) {
    Objects.requireNonNull(work, "work");
    try {
      return retrier.execute(() -> {
        try (UnitOfWork uow = create()) {
          uow.begin();
          R result = work.apply(uow);
          uow.commit();
          return result;
        }
      });
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new IllegalStateException("Transaction failed", e);
    }
  }
}
