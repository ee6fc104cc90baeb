package autopilot.util;

import java.util.Map;

/**
 * Codec used at the persistence edge for the JSON columns (configuration, metrics,
 * results, event payloads and log metadata).
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) delegates to Jackson.
 * Domain types never carry JSON annotations; stores convert them to plain maps and
 * lists first.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

  /**
   * Returns the shared Jackson-backed implementation.
   */
  static JsonCodec getDefault() {
    return JacksonJsonCodec.INSTANCE;
  }

  /**
   * Encodes maps, lists, strings, numbers and booleans. Returns {@code null} for a
   * {@code null} value.
   */
  String toJson(Object value);

  /**
   * Parses a JSON object. Returns an empty map for {@code null}, empty or
   * {@code "null"} input.
   *
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, Object> parseObject(String json);

  /**
   * Parses a flat JSON object whose values are rendered as strings.
   *
   * @throws IllegalArgumentException if the input is not a JSON object
   */
  Map<String, String> parseStringMap(String json);
}
