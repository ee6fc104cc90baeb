package autopilot.event;

import autopilot.util.Ids;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable notification that something happened to an aggregate.
 *
 * <p>Each event is assigned a ULID {@code eventId} and a timestamp unless the builder
 * supplies them (as stores do when reading events back). The payload is a flat
 * string map.
 *
 * @see EventBus
 */
public final class DomainEvent {
  private final String eventId;
  private final String eventType;
  private final String aggregateId;
  private final String aggregateType;
  private final Map<String, String> payload;
  private final Instant timestamp;
  private final String correlationId;
  private final String causationId;

  private DomainEvent(Builder builder) {
    this.eventId = builder.eventId == null ? Ids.next() : builder.eventId;
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    if (eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    this.aggregateId = Objects.requireNonNull(builder.aggregateId, "aggregateId");
    this.aggregateType = Objects.requireNonNull(builder.aggregateType, "aggregateType");
    if (builder.payload.containsValue(null)) {
      throw new IllegalArgumentException("payload cannot contain null values");
    }
    this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
    this.timestamp = builder.timestamp == null ? Instant.now() : builder.timestamp;
    this.correlationId = builder.correlationId;
    this.causationId = builder.causationId;
  }

  public static Builder builder(String eventType) {
    return new Builder(eventType);
  }

  public String eventId() {
    return eventId;
  }

  public String eventType() {
    return eventType;
  }

  public String aggregateId() {
    return aggregateId;
  }

  public String aggregateType() {
    return aggregateType;
  }

  public Map<String, String> payload() {
    return payload;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public String correlationId() {
    return correlationId;
  }

  public String causationId() {
    return causationId;
  }

  /**
   * Returns the metadata block (timestamp, correlation and causation ids) as a map,
   * omitting absent ids.
   */
  public Map<String, String> metadata() {
    Map<String, String> metadata = new LinkedHashMap<>();
    metadata.put("timestamp", timestamp.toString());
    if (correlationId != null) {
      metadata.put("correlationId", correlationId);
    }
    if (causationId != null) {
      metadata.put("causationId", causationId);
    }
    return Collections.unmodifiableMap(metadata);
  }

  @Override
  public String toString() {
    return "DomainEvent{" + eventType + " " + aggregateType + "/" + aggregateId + " id=" + eventId + "}";
  }

  public static final class Builder {
    private final String eventType;
    private String eventId;
    private String aggregateId;
    private String aggregateType;
    private final Map<String, String> payload = new LinkedHashMap<>();
    private Instant timestamp;
    private String correlationId;
    private String causationId;

    private Builder(String eventType) {
      this.eventType = eventType;
    }

    /**
     * Optional. Defaults to a new ULID.
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder aggregate(String aggregateType, String aggregateId) {
      this.aggregateType = aggregateType;
      this.aggregateId = aggregateId;
      return this;
    }

    public Builder payload(String key, String value) {
      this.payload.put(Objects.requireNonNull(key, "key"), value);
      return this;
    }

    public Builder payload(Map<String, String> values) {
      Objects.requireNonNull(values, "values").forEach(this::payload);
      return this;
    }

    /**
     * Optional. Defaults to {@link Instant#now()} at build time.
     */
    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder causationId(String causationId) {
      this.causationId = causationId;
      return this;
    }

    public DomainEvent build() {
      return new DomainEvent(this);
    }
  }
}
