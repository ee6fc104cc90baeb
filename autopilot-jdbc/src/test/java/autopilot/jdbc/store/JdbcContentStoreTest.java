package autopilot.jdbc.store;

import autopilot.jdbc.TestDatabase;
import autopilot.model.ContentType;
import autopilot.model.SavedContent;
import autopilot.quality.Recommendation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcContentStoreTest {
  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private final JdbcContentStore store = new JdbcContentStore();
  private Connection conn;

  @BeforeEach
  void setUp() throws Exception {
    conn = TestDatabase.create().getConnection();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  private static SavedContent content(String id, ContentType type, Instant createdAt) {
    return new SavedContent(id, "op-" + id, "project-1", type, "Title " + id, "Body " + id,
        Map.of("theme", "heist"), 77, Recommendation.SAVE, createdAt);
  }

  @Test
  void insertAndFindKeepsAttributes() {
    SavedContent saved = content("c1", ContentType.PLOT, T0);

    store.insert(conn, saved);

    assertEquals(saved, store.findById(conn, "c1").orElseThrow());
    assertEquals("AutonomousContent", store.entityName());
  }

  @Test
  void updateRewritesTextAndScore() {
    store.insert(conn, content("c1", ContentType.PLOT, T0));
    SavedContent revised = new SavedContent("c1", "op-c1", "project-1", ContentType.PLOT, "Revised", "New body",
        Map.of(), 91, Recommendation.SAVE, T0);

    store.update(conn, revised);

    SavedContent loaded = store.findById(conn, "c1").orElseThrow();
    assertEquals("Revised", loaded.title());
    assertEquals(91, loaded.qualityScore());
    assertEquals(Map.of(), loaded.attributes());
  }

  @Test
  void findByTypeFiltersAndOrdersNewestFirst() {
    store.insert(conn, content("a", ContentType.CHARACTER, T0));
    store.insert(conn, content("b", ContentType.CHARACTER, T0.plusSeconds(10)));
    store.insert(conn, content("c", ContentType.PLOT, T0.plusSeconds(20)));

    List<SavedContent> characters = store.findByType(conn, ContentType.CHARACTER, 10);

    assertEquals(List.of("b", "a"), characters.stream().map(SavedContent::id).toList());
    assertEquals(1, store.findByType(conn, ContentType.CHARACTER, 1).size());
    assertTrue(store.findByType(conn, ContentType.INSPIRATION, 10).isEmpty());
  }
}
