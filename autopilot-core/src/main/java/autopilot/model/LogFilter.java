package autopilot.model;

import java.time.Instant;

/**
 * Query over the activity log. Unset criteria match everything; results are newest
 * first and capped at {@code limit}.
 */
public final class LogFilter {
  public static final int DEFAULT_LIMIT = 100;

  private final int limit;
  private final LogLevel level;
  private final LogCategory category;
  private final String operationId;
  private final Instant since;
  private final String messageContains;

  private LogFilter(Builder builder) {
    if (builder.limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    this.limit = builder.limit;
    this.level = builder.level;
    this.category = builder.category;
    this.operationId = builder.operationId;
    this.since = builder.since;
    this.messageContains = builder.messageContains;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * The newest {@value #DEFAULT_LIMIT} entries.
   */
  public static LogFilter recent() {
    return builder().build();
  }

  public int limit() {
    return limit;
  }

  public LogLevel level() {
    return level;
  }

  public LogCategory category() {
    return category;
  }

  public String operationId() {
    return operationId;
  }

  public Instant since() {
    return since;
  }

  public String messageContains() {
    return messageContains;
  }

  public static final class Builder {
    private int limit = DEFAULT_LIMIT;
    private LogLevel level;
    private LogCategory category;
    private String operationId;
    private Instant since;
    private String messageContains;

    private Builder() {
    }

    public Builder limit(int limit) {
      this.limit = limit;
      return this;
    }

    public Builder level(LogLevel level) {
      this.level = level;
      return this;
    }

    public Builder category(LogCategory category) {
      this.category = category;
      return this;
    }

    public Builder operationId(String operationId) {
      this.operationId = operationId;
      return this;
    }

    /**
     * Only entries at or after {@code since}.
     */
    public Builder since(Instant since) {
      this.since = since;
      return this;
    }

    /**
     * Case-insensitive substring match on the message.
     */
    public Builder messageContains(String messageContains) {
      this.messageContains = messageContains;
      return this;
    }

    public LogFilter build() {
      return new LogFilter(this);
    }
  }
}
