package autopilot.jdbc.store;

import autopilot.StoreException;
import autopilot.config.AutonomousConfig;
import autopilot.config.AutonomousConfigPatch;
import autopilot.config.ResourceLimits;
import autopilot.config.TimeSlot;
import autopilot.jdbc.TableNames;
import autopilot.jdbc.TestDatabase;
import autopilot.model.ContentType;
import autopilot.util.JsonCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcConfigStoreTest {
  private final JdbcConfigStore store =
      new JdbcConfigStore(TableNames.CONFIG, JsonCodec.getDefault(), Clock.systemUTC());
  private Connection conn;

  @BeforeEach
  void setUp() throws Exception {
    conn = TestDatabase.create().getConnection();
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  @Test
  void emptyTableHasNoConfiguration() {
    assertTrue(store.loadLatest(conn).isEmpty());
  }

  @Test
  void highestVersionWins() {
    AutonomousConfig v1 = AutonomousConfig.defaults();
    AutonomousConfig v2 = v1.apply(AutonomousConfigPatch.builder()
        .enabled(true)
        .intervalMinutes(5)
        .timeSlots(List.of(TimeSlot.of("22:00", "06:00", true)))
        .resourceLimits(new ResourceLimits(80, 1024, 20, 2000))
        .contentTypes(List.of(ContentType.WORLD_SETTING, ContentType.PLOT))
        .build());
    store.append(conn, v1);
    store.append(conn, v2);

    assertEquals(v2, store.loadLatest(conn).orElseThrow());
  }

  @Test
  void duplicateVersionIsRejected() {
    store.append(conn, AutonomousConfig.defaults());

    assertThrows(StoreException.class, () -> store.append(conn, AutonomousConfig.defaults()));
  }

  @Test
  void missingFieldsDecodeAsDefaults() {
    AutonomousConfig decoded = store.decode(3, "{\"enabled\":true,\"qualityThreshold\":80}");

    AutonomousConfig defaults = AutonomousConfig.defaults();
    assertEquals(3, decoded.version());
    assertTrue(decoded.enabled());
    assertEquals(80, decoded.qualityThreshold());
    assertEquals(defaults.intervalMinutes(), decoded.intervalMinutes());
    assertEquals(defaults.timeSlots(), decoded.timeSlots());
    assertEquals(defaults.contentTypes(), decoded.contentTypes());
  }

  @Test
  void encodedFormUsesWireNames() {
    String json = store.encode(AutonomousConfig.defaults());

    assertTrue(json.contains("\"worldSetting\""));
    assertTrue(json.contains("\"start\":\"09:00\""));
  }
}
