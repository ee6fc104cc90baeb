package autopilot.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link JsonCodec} backed by a shared Jackson {@link ObjectMapper}.
 */
public final class JacksonJsonCodec implements JsonCodec {
  static final JacksonJsonCodec INSTANCE = new JacksonJsonCodec(new ObjectMapper()
      .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, false));

  private static final TypeReference<LinkedHashMap<String, Object>> OBJECT_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper;

  public JacksonJsonCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not serializable as JSON: " + value.getClass().getName(), e);
    }
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (isBlank(json)) {
      return Collections.emptyMap();
    }
    try {
      Map<String, Object> parsed = mapper.readValue(json, OBJECT_TYPE);
      return parsed == null ? Collections.emptyMap() : parsed;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON object", e);
    }
  }

  @Override
  public Map<String, String> parseStringMap(String json) {
    Map<String, Object> raw = parseObject(json);
    if (raw.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, String> result = new LinkedHashMap<>();
    raw.forEach((key, value) -> result.put(key, value == null ? null : String.valueOf(value)));
    return result;
  }

  private static boolean isBlank(String json) {
    return json == null || json.isBlank() || "null".equals(json.trim());
  }
}
