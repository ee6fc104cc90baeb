package autopilot.pool;

import java.sql.Connection;
import java.time.Instant;

/**
 * One physical connection owned by a {@link ConnectionPool}. Never handed out
 * directly: callers only see a {@link ConnectionLease} for it.
 */
final class PooledConnection {
  enum State { IDLE, LEASED }

  private final Connection connection;
  private final Instant createdAt;
  private State state = State.LEASED;
  private Instant lastReleasedAt;

  PooledConnection(Connection connection, Instant createdAt) {
    this.connection = connection;
    this.createdAt = createdAt;
    this.lastReleasedAt = createdAt;
  }

  Connection connection() {
    return connection;
  }

  Instant createdAt() {
    return createdAt;
  }

  State state() {
    return state;
  }

  Instant lastReleasedAt() {
    return lastReleasedAt;
  }

  void markLeased() {
    state = State.LEASED;
  }

  void markIdle(Instant now) {
    state = State.IDLE;
    lastReleasedAt = now;
  }
}
