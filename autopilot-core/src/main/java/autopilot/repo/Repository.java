package autopilot.repo;

import autopilot.batch.BatchWriteCoordinator;
import autopilot.batch.EventFactory;
import autopilot.batch.WriteOutcome;
import autopilot.batch.WriteResult;
import autopilot.event.EventBus;
import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.spi.EntityStore;
import autopilot.tx.UnitOfWork;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entity repository with two routing modes.
 *
 * <ul>
 *   <li><b>Pooled</b> ({@link #pooled}): writes are queued on the entity's
 *       {@link BatchWriteCoordinator}; reads lease a connection for the query.</li>
 *   <li><b>Bound</b> (from {@link UnitOfWork#repository}): reads and writes run
 *       synchronously on the unit's connection, and write events are published inside
 *       the unit's transaction.</li>
 * </ul>
 *
 * @param <T> the entity type
 */
public final class Repository<T> {
  private final EntityStore<T> store;
  private final BatchWriteCoordinator<T> writer;
  private final ConnectionPool pool;
  private final UnitOfWork unit;
  private final EventFactory<T> eventFactory;
  private final EventBus eventBus;

  private Repository(EntityStore<T> store, BatchWriteCoordinator<T> writer, ConnectionPool pool,
      UnitOfWork unit, EventFactory<T> eventFactory, EventBus eventBus) {
    this.store = Objects.requireNonNull(store, "store");
    this.writer = writer;
    this.pool = pool;
    this.unit = unit;
    this.eventFactory = eventFactory;
    this.eventBus = eventBus;
  }

  /**
   * Repository writing through {@code writer} and reading through {@code pool}.
   */
  public static <T> Repository<T> pooled(EntityStore<T> store, BatchWriteCoordinator<T> writer, ConnectionPool pool) {
    return new Repository<>(store, Objects.requireNonNull(writer, "writer"),
        Objects.requireNonNull(pool, "pool"), null, null, null);
  }

  /**
   * Repository bound to {@code unit}. Prefer {@link UnitOfWork#repository}.
   */
  public static <T> Repository<T> bound(EntityStore<T> store, EventFactory<T> eventFactory,
      UnitOfWork unit, EventBus eventBus) {
    return new Repository<>(store, null, null, Objects.requireNonNull(unit, "unit"),
        Objects.requireNonNull(eventFactory, "eventFactory"), eventBus);
  }

  public boolean isTransactional() {
    return unit != null;
  }

  /**
   * Saves the entity.
   *
   * <p>In a unit of work the write happens immediately and the returned future is
   * already complete; failures are thrown directly. Otherwise the write is queued and
   * the future completes when its batch chunk commits or the item is rejected.
   */
  public CompletableFuture<WriteResult> save(T entity) {
    Objects.requireNonNull(entity, "entity");
    if (unit == null) {
      return writer.add(entity);
    }
    WriteOutcome outcome = store.upsert(unit.connection(), entity);
    WriteResult result = new WriteResult(store.idOf(entity), outcome);
    if (eventBus != null) {
      eventFactory.eventFor(entity, result).ifPresent(eventBus::publish);
    }
    return CompletableFuture.completedFuture(result);
  }

  public Optional<T> findById(String id) {
    Objects.requireNonNull(id, "id");
    if (unit != null) {
      return store.findById(unit.connection(), id);
    }
    try (ConnectionLease lease = pool.acquire()) {
      return store.findById(lease.connection(), id);
    }
  }

  public boolean exists(String id) {
    Objects.requireNonNull(id, "id");
    if (unit != null) {
      return store.exists(unit.connection(), id);
    }
    try (ConnectionLease lease = pool.acquire()) {
      return store.exists(lease.connection(), id);
    }
  }
}
