package autopilot.jdbc.store;

import autopilot.config.AutonomousConfig;
import autopilot.config.ResourceLimits;
import autopilot.config.TimeSlot;
import autopilot.jdbc.JdbcTemplate;
import autopilot.jdbc.TableNames;
import autopilot.model.ContentType;
import autopilot.spi.ConfigStore;
import autopilot.util.JsonCodec;

import java.sql.Connection;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC {@link ConfigStore}: one row per version, the configuration as JSON.
 *
 * <p>The version is the primary key, so appending a version that already exists fails.
 */
public final class JdbcConfigStore implements ConfigStore {
  private final String tableName;
  private final JsonCodec jsonCodec;
  private final Clock clock;

  public JdbcConfigStore() {
    this(TableNames.CONFIG, JsonCodec.getDefault(), Clock.systemUTC());
  }

  public JdbcConfigStore(String tableName, JsonCodec jsonCodec, Clock clock) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<AutonomousConfig> loadLatest(Connection conn) {
    return JdbcTemplate.queryFirst(conn,
        "SELECT version, config FROM " + tableName + " ORDER BY version DESC LIMIT 1",
        rs -> decode(rs.getInt("version"), rs.getString("config")));
  }

  @Override
  public void append(Connection conn, AutonomousConfig config) {
    JdbcTemplate.update(conn, "INSERT INTO " + tableName + " (version, config, created_at) VALUES (?,?,?)",
        config.version(), encode(config), JdbcTemplate.timestamp(clock.instant()));
  }

  String encode(AutonomousConfig config) {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("enabled", config.enabled());
    json.put("intervalMinutes", config.intervalMinutes());
    json.put("qualityThreshold", config.qualityThreshold());
    json.put("maxConcurrentOperations", config.maxConcurrentOperations());
    json.put("maxDailyOperations", config.maxDailyOperations());
    List<Map<String, Object>> slots = new ArrayList<>();
    for (TimeSlot slot : config.timeSlots()) {
      Map<String, Object> s = new LinkedHashMap<>();
      s.put("start", slot.startText());
      s.put("end", slot.endText());
      s.put("enabled", slot.enabled());
      slots.add(s);
    }
    json.put("timeSlots", slots);
    ResourceLimits limits = config.resourceLimits();
    Map<String, Object> l = new LinkedHashMap<>();
    l.put("maxCpuUsage", limits.maxCpuUsage());
    l.put("maxMemoryUsageMb", limits.maxMemoryUsageMb());
    l.put("maxApiCallsPerHour", limits.maxApiCallsPerHour());
    l.put("maxTokensPerOperation", limits.maxTokensPerOperation());
    json.put("resourceLimits", l);
    json.put("contentTypes", config.contentTypes().stream().map(ContentType::wireName).toList());
    return jsonCodec.toJson(json);
  }

  @SuppressWarnings("unchecked")
  AutonomousConfig decode(int version, String text) {
    AutonomousConfig defaults = AutonomousConfig.defaults();
    Map<String, Object> json = jsonCodec.parseObject(text);

    List<TimeSlot> slots = defaults.timeSlots();
    if (json.get("timeSlots") instanceof List<?> rawSlots) {
      slots = new ArrayList<>();
      for (Object raw : rawSlots) {
        Map<String, Object> s = (Map<String, Object>) raw;
        slots.add(TimeSlot.of((String) s.get("start"), (String) s.get("end"), Boolean.TRUE.equals(s.get("enabled"))));
      }
    }

    ResourceLimits limits = defaults.resourceLimits();
    if (json.get("resourceLimits") instanceof Map<?, ?> rawLimits) {
      Map<String, Object> l = (Map<String, Object>) rawLimits;
      limits = new ResourceLimits(
          number(l, "maxCpuUsage", limits.maxCpuUsage()).doubleValue(),
          number(l, "maxMemoryUsageMb", limits.maxMemoryUsageMb()).longValue(),
          number(l, "maxApiCallsPerHour", limits.maxApiCallsPerHour()).intValue(),
          number(l, "maxTokensPerOperation", limits.maxTokensPerOperation()).intValue());
    }

    List<ContentType> types = defaults.contentTypes();
    if (json.get("contentTypes") instanceof List<?> rawTypes) {
      types = new ArrayList<>();
      for (Object raw : rawTypes) {
        types.add(ContentType.fromWireName((String) raw));
      }
    }

    return new AutonomousConfig(
        version,
        json.get("enabled") instanceof Boolean b ? b : defaults.enabled(),
        number(json, "intervalMinutes", defaults.intervalMinutes()).intValue(),
        number(json, "qualityThreshold", defaults.qualityThreshold()).intValue(),
        number(json, "maxConcurrentOperations", defaults.maxConcurrentOperations()).intValue(),
        number(json, "maxDailyOperations", defaults.maxDailyOperations()).intValue(),
        slots,
        limits,
        types);
  }

  private static Number number(Map<String, Object> json, String key, Number fallback) {
    Object value = json.get(key);
    return value instanceof Number n ? n : fallback;
  }
}
