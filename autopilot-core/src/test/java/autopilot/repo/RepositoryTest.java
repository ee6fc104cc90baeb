package autopilot.repo;

import autopilot.batch.BatchWriteCoordinator;
import autopilot.batch.WriteOutcome;
import autopilot.batch.WriteResult;
import autopilot.pool.ConnectionPool;
import autopilot.testing.H2;
import autopilot.testing.Item;
import autopilot.testing.ItemStore;
import autopilot.tx.ThreadLocalTxContext;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RepositoryTest {
  private JdbcDataSource ds;
  private ConnectionPool pool;
  private ItemStore store;
  private BatchWriteCoordinator<Item> writer;
  private Repository<Item> items;

  @BeforeEach
  void setUp() {
    ds = H2.newDataSource();
    H2.execute(ds, ItemStore.DDL);
    pool = H2.newPool(ds, 3);
    store = new ItemStore();
    writer = BatchWriteCoordinator.<Item>builder()
        .pool(pool)
        .store(store)
        .txContext(new ThreadLocalTxContext())
        .batchSize(10)
        .flushInterval(Duration.ofMinutes(10))
        .build();
    items = Repository.pooled(store, writer, pool);
  }

  @AfterEach
  void tearDown() {
    writer.close();
    pool.close();
  }

  @Test
  void pooledSaveIsQueuedUntilFlush() throws Exception {
    CompletableFuture<WriteResult> pending = items.save(new Item("a", "A"));

    assertFalse(items.isTransactional());
    assertFalse(pending.isDone());
    assertFalse(items.exists("a"));

    writer.flush();

    assertEquals(new WriteResult("a", WriteOutcome.INSERTED), pending.get(5, TimeUnit.SECONDS));
    assertEquals("A", items.findById("a").orElseThrow().name());
  }

  @Test
  void secondSaveOfSameIdUpdates() throws Exception {
    items.save(new Item("a", "A"));
    writer.flush();

    CompletableFuture<WriteResult> renamed = items.save(new Item("a", "B"));
    writer.flush();

    assertEquals(WriteOutcome.UPDATED, renamed.get(5, TimeUnit.SECONDS).outcome());
    assertEquals("B", items.findById("a").orElseThrow().name());
    assertEquals(1, H2.count(ds, "items"));
  }

  @Test
  void missingIdIsEmpty() {
    assertTrue(items.findById("nope").isEmpty());
  }
}
