package autopilot.pool;

import java.sql.Connection;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A single borrowing of a pooled connection. Closing the lease returns the connection
 * to its pool; use it with try-with-resources:
 * <pre>{@code
 * try (ConnectionLease lease = pool.acquire()) {
 *   store.findById(lease.connection(), id);
 * }
 * }</pre>
 *
 * <p>A lease is valid exactly once. After release, {@link #connection()} fails and a
 * second explicit {@link ConnectionPool#release} is rejected.
 */
public final class ConnectionLease implements AutoCloseable {
  private final ConnectionPool pool;
  private final PooledConnection pooled;
  private final AtomicBoolean released = new AtomicBoolean();

  ConnectionLease(ConnectionPool pool, PooledConnection pooled) {
    this.pool = pool;
    this.pooled = pooled;
  }

  /**
   * Returns the leased JDBC connection.
   *
   * @throws IllegalStateException if the lease was already released
   */
  public Connection connection() {
    if (released.get()) {
      throw new IllegalStateException("Connection lease already released");
    }
    return pooled.connection();
  }

  public boolean isReleased() {
    return released.get();
  }

  /**
   * Releases the lease if it has not been released yet.
   */
  @Override
  public void close() {
    if (!released.get()) {
      pool.release(this);
    }
  }

  ConnectionPool pool() {
    return pool;
  }

  PooledConnection pooled() {
    return pooled;
  }

  boolean markReleased() {
    return released.compareAndSet(false, true);
  }
}
