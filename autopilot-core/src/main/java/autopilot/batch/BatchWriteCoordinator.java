package autopilot.batch;

import autopilot.StoreErrors;
import autopilot.event.EventBus;
import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.retry.Retrier;
import autopilot.retry.Retries;
import autopilot.retry.RetryOptions;
import autopilot.spi.EntityStore;
import autopilot.spi.MetricsExporter;
import autopilot.tx.ThreadLocalTxContext;
import autopilot.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups individual writes into chunked, transactional, retried batch writes.
 *
 * <p>Writes accumulate in an in-memory queue. A flush is triggered when the queue
 * reaches {@code batchSize} or when the {@code flushInterval} timer fires. Every flush
 * runs on a single flush thread, so flushes never overlap; a trigger that arrives while
 * a flush is running is coalesced and re-evaluated once it completes.
 *
 * <p>A flush takes the whole queue as one snapshot, splits it into chunks of
 * {@code batchSize} and writes at most {@code concurrency} chunks in parallel. Each
 * chunk runs in one transaction on one pooled connection bound to the thread's
 * {@link ThreadLocalTxContext}: every item is inserted or updated, one domain event
 * per item is published (the event-log middleware joins the same transaction), and the
 * transaction commits. Any failure rolls back the whole chunk. Transient failures are
 * first retried in place by the chunk {@link Retrier}.
 *
 * <p>Items of a failed chunk are re-queued ahead of newer items, in their original
 * order. An item whose chunk has failed more than {@code maxRetries} times is
 * removed instead, and its future completes exceptionally with the terminal error.
 *
 * <p>{@link #close()} stops the timer, rejects new writes and flushes until the queue
 * is empty. Every future returned by {@link #add} is completed by the time
 * {@code close()} returns.
 *
 * @param <T> the entity type
 */
public final class BatchWriteCoordinator<T> implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(BatchWriteCoordinator.class.getName());

  private final String name;
  private final ConnectionPool pool;
  private final EntityStore<T> store;
  private final ThreadLocalTxContext txContext;
  private final EventBus eventBus;
  private final EventFactory<T> eventFactory;
  private final int batchSize;
  private final int maxRetries;
  private final Retrier chunkRetrier;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final Object lock = new Object();
  private final Deque<BatchItem<T>> queue = new ArrayDeque<>();
  private boolean flushPending;
  private boolean closed;

  private final ScheduledExecutorService flusher;
  private final ExecutorService workers;
  private final ScheduledFuture<?> timerTask;

  private BatchWriteCoordinator(Builder<T> builder) {
    this.pool = Objects.requireNonNull(builder.pool, "pool");
    this.store = Objects.requireNonNull(builder.store, "store");
    this.txContext = Objects.requireNonNull(builder.txContext, "txContext");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.concurrency <= 0) {
      throw new IllegalArgumentException("concurrency must be > 0");
    }
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    Objects.requireNonNull(builder.flushInterval, "flushInterval");
    if (builder.flushInterval.isZero() || builder.flushInterval.isNegative()) {
      throw new IllegalArgumentException("flushInterval must be > 0");
    }
    this.name = builder.name != null ? builder.name : store.entityName();
    this.eventBus = builder.eventBus;
    this.eventFactory = builder.eventFactory != null ? builder.eventFactory : EventFactory.none();
    this.batchSize = builder.batchSize;
    this.maxRetries = builder.maxRetries;
    this.chunkRetrier = builder.chunkRetrier != null ? builder.chunkRetrier : defaultChunkRetrier();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    this.flusher = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("autopilot-batch-" + name + "-flush-"));
    this.workers = Executors.newFixedThreadPool(builder.concurrency,
        new DaemonThreadFactory("autopilot-batch-" + name + "-worker-"));
    long intervalMs = builder.flushInterval.toMillis();
    this.timerTask = flusher.scheduleWithFixedDelay(this::onTimer, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  public static <T> Builder<T> builder() {
    return new Builder<>();
  }

  /**
   * Queues one write.
   *
   * @return a future completed with the write result, or exceptionally with the
   *     terminal error once the item has exhausted its retries
   * @throws IllegalStateException if the coordinator is closed
   */
  public CompletableFuture<WriteResult> add(T entity) {
    Objects.requireNonNull(entity, "entity");
    BatchItem<T> item = new BatchItem<>(entity, clock.instant());
    synchronized (lock) {
      ensureOpen();
      queue.addLast(item);
      afterEnqueueLocked();
    }
    return item.result();
  }

  /**
   * Queues several writes atomically, with a single threshold check.
   *
   * @return a future completed with all results in input order, or exceptionally if
   *     any item is rejected (after every item has settled)
   * @throws IllegalStateException if the coordinator is closed
   */
  public CompletableFuture<List<WriteResult>> addMany(List<T> entities) {
    Objects.requireNonNull(entities, "entities");
    List<BatchItem<T>> items = new ArrayList<>(entities.size());
    for (T entity : entities) {
      items.add(new BatchItem<>(Objects.requireNonNull(entity, "entity"), clock.instant()));
    }
    synchronized (lock) {
      ensureOpen();
      queue.addAll(items);
      afterEnqueueLocked();
    }
    CompletableFuture<?>[] futures = items.stream().map(BatchItem::result).toArray(CompletableFuture[]::new);
    return CompletableFuture.allOf(futures).thenApply(ignored -> {
      List<WriteResult> results = new ArrayList<>(items.size());
      for (BatchItem<T> item : items) {
        results.add(item.result().join());
      }
      return results;
    });
  }

  /**
   * Runs one flush cycle over the current queue and waits for it. Items whose chunk
   * failed and that still have retries left remain queued.
   *
   * <p>Must not be called from an event handler or a future callback of this
   * coordinator.
   */
  public void flush() {
    Future<?> cycle;
    synchronized (lock) {
      if (closed) {
        return;
      }
      cycle = flusher.submit(this::runCycle);
    }
    await(cycle, "flush");
  }

  public int queueSize() {
    synchronized (lock) {
      return queue.size();
    }
  }

  public String name() {
    return name;
  }

  /**
   * Stops the timer, rejects new writes and flushes until the queue is empty.
   */
  @Override
  public void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
    }
    timerTask.cancel(false);
    await(flusher.submit(this::drain), "drain");
    flusher.shutdown();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      workers.shutdownNow();
    }
    rejectRemaining();
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("BatchWriteCoordinator '" + name + "' has been closed");
    }
  }

  private void afterEnqueueLocked() {
    metrics.recordBatchQueueDepth(name, queue.size());
    if (queue.size() >= batchSize) {
      triggerLocked();
    }
  }

  private void triggerLocked() {
    if (flushPending || closed) {
      return;
    }
    flushPending = true;
    flusher.execute(this::runTriggeredCycle);
  }

  private void onTimer() {
    synchronized (lock) {
      if (!queue.isEmpty()) {
        triggerLocked();
      }
    }
  }

  private void runTriggeredCycle() {
    synchronized (lock) {
      flushPending = false;
    }
    try {
      runCycle();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Flush cycle failed for batch '" + name + "'", t);
    }
    synchronized (lock) {
      if (queue.size() >= batchSize) {
        triggerLocked();
      }
    }
  }

  private void drain() {
    while (runCycle() > 0) {
      // keep flushing: failed chunks re-queue items until they run out of retries
    }
  }

  /**
   * Flushes one snapshot of the queue. Runs on the flush thread only.
   *
   * @return number of items in the snapshot
   */
  private int runCycle() {
    List<BatchItem<T>> snapshot;
    synchronized (lock) {
      if (queue.isEmpty()) {
        return 0;
      }
      snapshot = new ArrayList<>(queue);
      queue.clear();
      metrics.recordBatchQueueDepth(name, 0);
    }

    List<Future<?>> chunks = new ArrayList<>();
    for (int from = 0; from < snapshot.size(); from += batchSize) {
      List<BatchItem<T>> chunk = snapshot.subList(from, Math.min(from + batchSize, snapshot.size()));
      chunks.add(workers.submit(() -> processChunk(chunk)));
    }
    for (Future<?> chunk : chunks) {
      try {
        chunk.get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Chunk task failed unexpectedly for batch '" + name + "'", e.getCause());
      }
    }
    return snapshot.size();
  }

  private void processChunk(List<BatchItem<T>> chunk) {
    List<WriteResult> results;
    try {
      results = chunkRetrier.execute(() -> writeChunk(chunk));
    } catch (Exception e) {
      metrics.incrementChunkRolledBack();
      handleFailedChunk(chunk, e);
      return;
    }
    metrics.recordChunkCommitted(chunk.size());
    for (int i = 0; i < chunk.size(); i++) {
      chunk.get(i).result().complete(results.get(i));
    }
  }

  private List<WriteResult> writeChunk(List<BatchItem<T>> chunk) {
    try (ConnectionLease lease = pool.acquire()) {
      Connection conn = lease.connection();
      try {
        conn.setAutoCommit(false);
      } catch (SQLException e) {
        throw StoreErrors.translate("Failed to begin chunk transaction", e);
      }
      txContext.bind(conn);
      boolean committed = false;
      try {
        List<WriteResult> results = new ArrayList<>(chunk.size());
        for (BatchItem<T> item : chunk) {
          T entity = item.payload();
          WriteOutcome outcome = store.upsert(conn, entity);
          results.add(new WriteResult(store.idOf(entity), outcome));
        }
        if (eventBus != null) {
          for (int i = 0; i < chunk.size(); i++) {
            eventFactory.eventFor(chunk.get(i).payload(), results.get(i)).ifPresent(eventBus::publish);
          }
        }
        conn.commit();
        committed = true;
        return results;
      } catch (SQLException e) {
        throw StoreErrors.translate("Failed to commit chunk of " + chunk.size() + " item(s)", e);
      } finally {
        if (!committed) {
          rollbackQuietly(conn);
        }
        txContext.unbind(committed);
      }
    }
  }

  private void handleFailedChunk(List<BatchItem<T>> chunk, Exception error) {
    List<BatchItem<T>> requeue = new ArrayList<>();
    List<BatchItem<T>> rejected = new ArrayList<>();
    for (BatchItem<T> item : chunk) {
      if (item.incrementRetryCount() <= maxRetries) {
        requeue.add(item);
      } else {
        rejected.add(item);
      }
    }
    synchronized (lock) {
      for (int i = requeue.size() - 1; i >= 0; i--) {
        queue.addFirst(requeue.get(i));
      }
      metrics.recordBatchQueueDepth(name, queue.size());
    }
    logger.log(Level.WARNING, "Batch ''{0}'': chunk of {1} item(s) rolled back ({2} requeued, {3} rejected): {4}",
        new Object[]{name, chunk.size(), requeue.size(), rejected.size(), error.toString()});
    if (!rejected.isEmpty()) {
      metrics.incrementItemsRejected(rejected.size());
      for (BatchItem<T> item : rejected) {
        item.result().completeExceptionally(error);
      }
    }
  }

  private void rejectRemaining() {
    List<BatchItem<T>> remaining;
    synchronized (lock) {
      remaining = new ArrayList<>(queue);
      queue.clear();
    }
    if (remaining.isEmpty()) {
      return;
    }
    logger.log(Level.SEVERE, "Batch ''{0}'' closed with {1} unwritten item(s)", new Object[]{name, remaining.size()});
    IllegalStateException error = new IllegalStateException("BatchWriteCoordinator '" + name
        + "' closed before the item was written");
    metrics.incrementItemsRejected(remaining.size());
    for (BatchItem<T> item : remaining) {
      item.result().completeExceptionally(error);
    }
  }

  private void await(Future<?> future, String what) {
    try {
      future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (ExecutionException e) {
      logger.log(Level.SEVERE, "Batch '" + name + "' " + what + " failed", e.getCause());
    }
  }

  private static void rollbackQuietly(Connection conn) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Chunk rollback failed", e);
    }
  }

  private static Retrier defaultChunkRetrier() {
    return new Retrier(RetryOptions.builder()
        .maxAttempts(3)
        .initialDelayMs(100)
        .maxDelayMs(2000)
        .backoffMultiplier(2.0)
        .shouldRetry(Retries.transientStoreErrors())
        .build());
  }

  /**
   * Builder for {@link BatchWriteCoordinator}.
   *
   * @param <T> the entity type
   */
  public static final class Builder<T> {
    private String name;
    private ConnectionPool pool;
    private EntityStore<T> store;
    private ThreadLocalTxContext txContext;
    private EventBus eventBus;
    private EventFactory<T> eventFactory;
    private int batchSize = 100;
    private Duration flushInterval = Duration.ofSeconds(1);
    private int concurrency = 2;
    private int maxRetries = 3;
    private Retrier chunkRetrier;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {
    }

    /**
     * Name used in thread names and log messages.
     *
     * <p>Optional. Defaults to the store's entity name.
     */
    public Builder<T> name(String name) {
      this.name = name;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<T> pool(ConnectionPool pool) {
      this.pool = pool;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder<T> store(EntityStore<T> store) {
      this.store = store;
      return this;
    }

    /**
     * Context each chunk transaction is bound to.
     *
     * <p><b>Required.</b>
     */
    public Builder<T> txContext(ThreadLocalTxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Bus that receives one event per written item.
     *
     * <p>Optional. Without a bus no events are published.
     */
    public Builder<T> eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Optional. Defaults to {@link EventFactory#none()}.
     */
    public Builder<T> eventFactory(EventFactory<T> eventFactory) {
      this.eventFactory = eventFactory;
      return this;
    }

    /**
     * Queue size that triggers a flush, and the chunk size.
     *
     * <p>Optional. Defaults to 100.
     */
    public Builder<T> batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to 1 second.
     */
    public Builder<T> flushInterval(Duration flushInterval) {
      this.flushInterval = flushInterval;
      return this;
    }

    /**
     * Chunks written in parallel.
     *
     * <p>Optional. Defaults to 2.
     */
    public Builder<T> concurrency(int concurrency) {
      this.concurrency = concurrency;
      return this;
    }

    /**
     * Re-queues allowed per item after its chunk failed.
     *
     * <p>Optional. Defaults to 3.
     */
    public Builder<T> maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * In-place retry around each chunk transaction.
     *
     * <p>Optional. Defaults to 3 attempts with 100 ms initial backoff, retrying only
     * transient store errors and pool exhaustion.
     */
    public Builder<T> chunkRetrier(Retrier chunkRetrier) {
      this.chunkRetrier = chunkRetrier;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder<T> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to the system UTC clock.
     */
    public Builder<T> clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public BatchWriteCoordinator<T> build() {
      return new BatchWriteCoordinator<>(this);
    }
  }
}
