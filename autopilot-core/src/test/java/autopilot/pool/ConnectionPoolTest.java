package autopilot.pool;

import org.h2.jdbcx.JdbcDataSource;
import autopilot.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {
  private JdbcDataSource dataSource;
  private AtomicInteger opened;
  private ConnectionPool pool;

  @BeforeEach
  void setUp() {
    dataSource = new JdbcDataSource();
    dataSource.setURL("jdbc:h2:mem:pool_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    opened = new AtomicInteger();
  }

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  private ConnectionFactory countingFactory() {
    return () -> {
      opened.incrementAndGet();
      return dataSource.getConnection();
    };
  }

  // ── Acquire / release ─────────────────────────────────────────

  @Test
  void opensMinimumEagerly() {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(2).maxConnections(4).build();

    assertEquals(2, opened.get());
    assertEquals(new PoolStats(2, 0, 2, 0), pool.stats());
  }

  @Test
  void reusesReleasedConnection() throws SQLException {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(0).maxConnections(2).build();

    Connection first;
    try (ConnectionLease lease = pool.acquire()) {
      first = lease.connection();
      assertTrue(first.isValid(1));
    }
    try (ConnectionLease lease = pool.acquire()) {
      assertSame(first, lease.connection());
    }
    assertEquals(1, opened.get());
  }

  @Test
  void neverExceedsMaxConnections() {
    pool = ConnectionPool.builder().connectionFactory(countingFactory())
        .minConnections(0).maxConnections(2).acquireTimeout(Duration.ofMillis(100)).build();

    ConnectionLease a = pool.acquire();
    ConnectionLease b = pool.acquire();

    assertThrows(PoolExhaustedException.class, () -> pool.acquire());
    assertEquals(2, pool.stats().total());
    assertEquals(0, pool.stats().waiting());
    a.close();
    b.close();
  }

  @Test
  void waiterReceivesReleasedConnection() throws Exception {
    pool = ConnectionPool.builder().connectionFactory(countingFactory())
        .minConnections(0).maxConnections(1).acquireTimeout(Duration.ofSeconds(5)).build();

    ConnectionLease held = pool.acquire();
    Connection heldConnection = held.connection();
    CountDownLatch waiting = new CountDownLatch(1);
    CompletableFuture<Connection> waiter = CompletableFuture.supplyAsync(() -> {
      waiting.countDown();
      try (ConnectionLease lease = pool.acquire()) {
        return lease.connection();
      }
    });

    assertTrue(waiting.await(1, TimeUnit.SECONDS));
    long deadline = System.currentTimeMillis() + 2000;
    while (pool.stats().waiting() == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    held.close();

    assertSame(heldConnection, waiter.get(5, TimeUnit.SECONDS));
    assertEquals(1, opened.get());
  }

  @Test
  void releasingTwiceIsRejected() {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(0).build();

    ConnectionLease lease = pool.acquire();
    pool.release(lease);

    assertTrue(lease.isReleased());
    assertThrows(IllegalStateException.class, () -> pool.release(lease));
  }

  @Test
  void leaseFromAnotherPoolIsRejected() {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(0).build();
    try (ConnectionPool other = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(0).build()) {
      ConnectionLease foreign = other.acquire();
      assertThrows(IllegalStateException.class, () -> pool.release(foreign));
      foreign.close();
    }
  }

  @Test
  void releaseRollsBackOpenTransaction() throws SQLException {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(0).maxConnections(1).build();

    try (ConnectionLease lease = pool.acquire()) {
      Connection conn = lease.connection();
      conn.createStatement().execute("CREATE TABLE t (id INT)");
      conn.setAutoCommit(false);
      conn.createStatement().execute("INSERT INTO t VALUES (1)");
    }
    try (ConnectionLease lease = pool.acquire()) {
      Connection conn = lease.connection();
      assertTrue(conn.getAutoCommit());
      var rs = conn.createStatement().executeQuery("SELECT COUNT(*) FROM t");
      rs.next();
      assertEquals(0, rs.getInt(1));
    }
  }

  @Test
  void closedConnectionIsDiscardedOnRelease() throws SQLException {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(0).maxConnections(1).build();

    try (ConnectionLease lease = pool.acquire()) {
      lease.connection().close();
    }

    assertEquals(0, pool.stats().total());
    try (ConnectionLease lease = pool.acquire()) {
      assertFalse(lease.connection().isClosed());
    }
    assertEquals(2, opened.get());
  }

  // ── Idle eviction ─────────────────────────────────────────────

  @Test
  void evictIdleKeepsMinimum() {
    MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    pool = ConnectionPool.builder().connectionFactory(countingFactory())
        .minConnections(1).maxConnections(3).idleTimeout(Duration.ofMinutes(5)).clock(clock).build();

    ConnectionLease a = pool.acquire();
    ConnectionLease b = pool.acquire();
    ConnectionLease c = pool.acquire();
    a.close();
    b.close();
    c.close();
    assertEquals(3, pool.stats().idle());

    clock.advance(Duration.ofMinutes(4));
    assertEquals(0, pool.evictIdle());

    clock.advance(Duration.ofMinutes(2));
    assertEquals(2, pool.evictIdle());
    assertEquals(1, pool.stats().total());
  }

  // ── Close ─────────────────────────────────────────────────────

  @Test
  void closeRejectsNewAcquisitions() {
    pool = ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(1).build();
    pool.close();

    assertTrue(pool.isClosed());
    assertThrows(PoolExhaustedException.class, () -> pool.acquire());
  }

  @Test
  void closeWaitsForOutstandingLease() throws Exception {
    pool = ConnectionPool.builder().connectionFactory(countingFactory())
        .minConnections(0).closeTimeout(Duration.ofSeconds(5)).build();
    ConnectionLease lease = pool.acquire();
    Connection conn = lease.connection();

    CompletableFuture<Void> closing = CompletableFuture.runAsync(pool::close);
    Thread.sleep(100);
    assertFalse(closing.isDone());
    assertFalse(conn.isClosed());

    lease.close();
    closing.get(5, TimeUnit.SECONDS);
    assertTrue(conn.isClosed());
  }

  @Test
  void invalidSizesAreRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> ConnectionPool.builder().connectionFactory(countingFactory()).minConnections(3).maxConnections(2).build());
    assertThrows(IllegalArgumentException.class,
        () -> ConnectionPool.builder().connectionFactory(countingFactory()).maxConnections(0).build());
    assertThrows(NullPointerException.class, () -> ConnectionPool.builder().build());
  }
}
