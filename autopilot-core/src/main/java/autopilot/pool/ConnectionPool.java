package autopilot.pool;

import autopilot.StoreErrors;
import autopilot.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded pool of reusable JDBC connections.
 *
 * <p>The pool holds between {@code minConnections} and {@code maxConnections}
 * physical connections. {@link #acquire()} reuses an idle connection when one is
 * available, opens a new one while below the maximum, and otherwise blocks until a
 * connection is released or the acquire timeout elapses, in which case it throws
 * {@link PoolExhaustedException}. Blocked callers are served in arrival order.
 *
 * <p>A background sweep running every {@code idleTimeout / 2} closes idle connections
 * older than {@code idleTimeout} while more than {@code minConnections} are open.
 *
 * <p>{@link #close()} rejects new acquisitions and fails pending waiters, closes idle
 * connections immediately and waits for outstanding leases to be released before
 * closing their connections. A leased connection is never closed by the pool.
 *
 * <p>This class is thread-safe.
 *
 * @see ConnectionLease
 */
public final class ConnectionPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ConnectionPool.class.getName());

  private final ConnectionFactory connectionFactory;
  private final int minConnections;
  private final int maxConnections;
  private final Duration acquireTimeout;
  private final Duration idleTimeout;
  private final Duration closeTimeout;
  private final Clock clock;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition allReleased = lock.newCondition();
  private final Deque<PooledConnection> idle = new ArrayDeque<>();
  private final Set<PooledConnection> leased = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Deque<CompletableFuture<PooledConnection>> waiters = new ArrayDeque<>();
  private int opening;
  private boolean closed;

  private final ScheduledExecutorService sweeper;

  private ConnectionPool(Builder builder) {
    this.connectionFactory = Objects.requireNonNull(builder.connectionFactory, "connectionFactory");
    if (builder.minConnections < 0) {
      throw new IllegalArgumentException("minConnections must be >= 0");
    }
    if (builder.maxConnections <= 0) {
      throw new IllegalArgumentException("maxConnections must be > 0");
    }
    if (builder.minConnections > builder.maxConnections) {
      throw new IllegalArgumentException("minConnections must be <= maxConnections");
    }
    requirePositive(builder.acquireTimeout, "acquireTimeout");
    requirePositive(builder.idleTimeout, "idleTimeout");
    requirePositive(builder.closeTimeout, "closeTimeout");
    this.minConnections = builder.minConnections;
    this.maxConnections = builder.maxConnections;
    this.acquireTimeout = builder.acquireTimeout;
    this.idleTimeout = builder.idleTimeout;
    this.closeTimeout = builder.closeTimeout;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();

    openMinimum();

    long sweepMs = Math.max(1L, idleTimeout.toMillis() / 2);
    this.sweeper = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("autopilot-pool-sweeper-"));
    sweeper.scheduleWithFixedDelay(this::sweep, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Acquires a connection, waiting at most the configured acquire timeout.
   *
   * @return a lease that must be closed to return the connection
   * @throws PoolExhaustedException if no connection became available in time or the pool is closed
   * @throws autopilot.StoreException if a new connection could not be opened
   */
  public ConnectionLease acquire() {
    return acquire(acquireTimeout);
  }

  /**
   * Acquires a connection, waiting at most {@code timeout}.
   *
   * @throws PoolExhaustedException if no connection became available in time or the pool is closed
   * @throws autopilot.StoreException if a new connection could not be opened
   */
  public ConnectionLease acquire(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    CompletableFuture<PooledConnection> waiter = null;
    lock.lock();
    try {
      if (closed) {
        throw new PoolExhaustedException("Connection pool is closed");
      }
      PooledConnection pooled = idle.pollFirst();
      if (pooled != null) {
        pooled.markLeased();
        leased.add(pooled);
        return new ConnectionLease(this, pooled);
      }
      if (totalLocked() < maxConnections) {
        opening++;
      } else {
        waiter = new CompletableFuture<>();
        waiters.addLast(waiter);
      }
    } finally {
      lock.unlock();
    }

    if (waiter == null) {
      return new ConnectionLease(this, openReserved());
    }
    return awaitHandoff(waiter, timeout);
  }

  /**
   * Returns a leased connection to the pool. The connection is handed to the
   * longest-waiting caller if there is one, otherwise it becomes idle. A connection
   * that is closed or cannot be reset to auto-commit is discarded.
   *
   * @throws IllegalStateException if the lease belongs to another pool or was already released
   */
  public void release(ConnectionLease lease) {
    Objects.requireNonNull(lease, "lease");
    if (lease.pool() != this) {
      throw new IllegalStateException("Connection lease belongs to a different pool");
    }
    if (!lease.markReleased()) {
      throw new IllegalStateException("Connection lease already released");
    }
    PooledConnection pooled = lease.pooled();
    boolean reusable = resetForReuse(pooled.connection());
    boolean discard;

    lock.lock();
    try {
      leased.remove(pooled);
      discard = !reusable || closed;
      if (!discard) {
        CompletableFuture<PooledConnection> waiter = waiters.pollFirst();
        if (waiter != null) {
          pooled.markLeased();
          leased.add(pooled);
          waiter.complete(pooled);
        } else {
          pooled.markIdle(clock.instant());
          idle.addFirst(pooled);
        }
      }
      if (leased.isEmpty()) {
        allReleased.signalAll();
      }
    } finally {
      lock.unlock();
    }

    if (discard) {
      closeQuietly(pooled.connection());
      serveWaiterWithNewConnection();
    }
  }

  /**
   * Closes idle connections that have been unused for at least {@code idleTimeout},
   * never dropping below {@code minConnections}. Called periodically by the sweeper;
   * may also be invoked directly for testing.
   *
   * @return number of connections evicted
   */
  public int evictIdle() {
    List<PooledConnection> evicted = new ArrayList<>();
    Instant now = clock.instant();
    lock.lock();
    try {
      Iterator<PooledConnection> it = idle.descendingIterator();
      while (it.hasNext() && totalLocked() > minConnections) {
        PooledConnection pooled = it.next();
        if (Duration.between(pooled.lastReleasedAt(), now).compareTo(idleTimeout) >= 0) {
          it.remove();
          evicted.add(pooled);
        }
      }
    } finally {
      lock.unlock();
    }
    for (PooledConnection pooled : evicted) {
      closeQuietly(pooled.connection());
    }
    return evicted.size();
  }

  public PoolStats stats() {
    lock.lock();
    try {
      return new PoolStats(totalLocked(), leased.size(), idle.size(), waiters.size());
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Rejects new acquisitions, fails pending waiters, closes idle connections and
   * waits up to {@code closeTimeout} for outstanding leases. Leases released after
   * that point have their connections closed on release.
   */
  @Override
  public void close() {
    List<PooledConnection> idleToClose;
    List<CompletableFuture<PooledConnection>> pending;
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      idleToClose = new ArrayList<>(idle);
      idle.clear();
      pending = new ArrayList<>(waiters);
      waiters.clear();
    } finally {
      lock.unlock();
    }

    sweeper.shutdownNow();
    for (CompletableFuture<PooledConnection> waiter : pending) {
      waiter.completeExceptionally(new PoolExhaustedException("Connection pool is closed"));
    }
    for (PooledConnection pooled : idleToClose) {
      closeQuietly(pooled.connection());
    }

    lock.lock();
    try {
      long remainingNanos = closeTimeout.toNanos();
      while (!leased.isEmpty() && remainingNanos > 0) {
        remainingNanos = allReleased.awaitNanos(remainingNanos);
      }
      if (!leased.isEmpty()) {
        logger.log(Level.WARNING, "Connection pool closed with {0} outstanding lease(s); "
            + "their connections close on release", leased.size());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      lock.unlock();
    }
  }

  private void sweep() {
    try {
      int evicted = evictIdle();
      if (evicted > 0) {
        logger.log(Level.FINE, "Evicted {0} idle connection(s)", evicted);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Idle connection sweep failed", t);
    }
  }

  private void openMinimum() {
    List<PooledConnection> opened = new ArrayList<>();
    try {
      for (int i = 0; i < minConnections; i++) {
        Connection connection = connectionFactory.open();
        PooledConnection pooled = new PooledConnection(connection, clock.instant());
        pooled.markIdle(clock.instant());
        opened.add(pooled);
      }
    } catch (SQLException e) {
      opened.forEach(p -> closeQuietly(p.connection()));
      throw StoreErrors.translate("Failed to open initial pool connections", e);
    }
    idle.addAll(opened);
  }

  /**
   * Opens a connection for capacity already reserved via {@code opening++}.
   */
  private PooledConnection openReserved() {
    Connection connection;
    try {
      connection = connectionFactory.open();
    } catch (SQLException e) {
      cancelReservation();
      throw StoreErrors.translate("Failed to open connection", e);
    } catch (RuntimeException e) {
      cancelReservation();
      throw e;
    }

    PooledConnection pooled = new PooledConnection(connection, clock.instant());
    lock.lock();
    try {
      opening--;
      if (closed) {
        closeQuietly(connection);
        throw new PoolExhaustedException("Connection pool is closed");
      }
      leased.add(pooled);
    } finally {
      lock.unlock();
    }
    return pooled;
  }

  private void cancelReservation() {
    lock.lock();
    try {
      opening--;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Uses capacity freed by a discarded connection to open a fresh one for the
   * longest-waiting caller.
   */
  private void serveWaiterWithNewConnection() {
    CompletableFuture<PooledConnection> waiter;
    lock.lock();
    try {
      if (closed || waiters.isEmpty() || totalLocked() >= maxConnections) {
        return;
      }
      waiter = waiters.pollFirst();
      opening++;
    } finally {
      lock.unlock();
    }
    try {
      waiter.complete(openReserved());
    } catch (RuntimeException e) {
      waiter.completeExceptionally(e);
    }
  }

  private ConnectionLease awaitHandoff(CompletableFuture<PooledConnection> waiter, Duration timeout) {
    try {
      return new ConnectionLease(this, waiter.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      return abandonWait(waiter, "Timed out after " + timeout.toMillis() + " ms waiting for a connection");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return abandonWait(waiter, "Interrupted while waiting for a connection");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new PoolExhaustedException("Failed waiting for a connection: " + cause);
    }
  }

  /**
   * Removes a waiter that gave up. If a connection was handed to it concurrently,
   * the handoff wins and the connection is returned instead.
   */
  private ConnectionLease abandonWait(CompletableFuture<PooledConnection> waiter, String message) {
    boolean removed;
    lock.lock();
    try {
      removed = waiters.remove(waiter);
    } finally {
      lock.unlock();
    }
    if (removed) {
      throw new PoolExhaustedException(message);
    }
    try {
      return new ConnectionLease(this, waiter.join());
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new PoolExhaustedException(message);
    }
  }

  private int totalLocked() {
    return idle.size() + leased.size() + opening;
  }

  private static boolean resetForReuse(Connection connection) {
    try {
      if (connection.isClosed()) {
        return false;
      }
      if (!connection.getAutoCommit()) {
        connection.rollback();
        connection.setAutoCommit(true);
      }
      return true;
    } catch (SQLException e) {
      logger.log(Level.WARNING, "Discarding connection that could not be reset", e);
      return false;
    }
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (SQLException e) {
      logger.log(Level.FINE, "Failed to close pooled connection", e);
    }
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0");
    }
  }

  /**
   * Builder for {@link ConnectionPool}.
   */
  public static final class Builder {
    private ConnectionFactory connectionFactory;
    private int minConnections = 2;
    private int maxConnections = 10;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private Duration idleTimeout = Duration.ofMinutes(5);
    private Duration closeTimeout = Duration.ofSeconds(30);
    private Clock clock;

    private Builder() {
    }

    /**
     * Sets the factory that opens physical connections.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionFactory(ConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /**
     * Connections opened eagerly and kept through idle sweeps.
     *
     * <p>Optional. Defaults to 2.
     */
    public Builder minConnections(int minConnections) {
      this.minConnections = minConnections;
      return this;
    }

    /**
     * Upper bound on open connections, leased or idle.
     *
     * <p>Optional. Defaults to 10.
     */
    public Builder maxConnections(int maxConnections) {
      this.maxConnections = maxConnections;
      return this;
    }

    /**
     * Maximum wait in {@link ConnectionPool#acquire()}.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    /**
     * Idle age after which connections above the minimum are closed.
     *
     * <p>Optional. Defaults to 5 minutes.
     */
    public Builder idleTimeout(Duration idleTimeout) {
      this.idleTimeout = idleTimeout;
      return this;
    }

    /**
     * Maximum wait in {@link ConnectionPool#close()} for outstanding leases.
     *
     * <p>Optional. Defaults to 30 seconds.
     */
    public Builder closeTimeout(Duration closeTimeout) {
      this.closeTimeout = closeTimeout;
      return this;
    }

    /**
     * Clock used for idle ageing.
     *
     * <p>Optional. Defaults to the system UTC clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the pool and opens {@code minConnections} connections.
     *
     * @throws autopilot.StoreException if an initial connection cannot be opened
     */
    public ConnectionPool build() {
      return new ConnectionPool(this);
    }
  }
}
