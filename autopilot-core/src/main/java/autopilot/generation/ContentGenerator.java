package autopilot.generation;

import autopilot.config.ResourceLimits;
import autopilot.model.Operation;
import autopilot.retry.CircuitBreaker;
import autopilot.retry.Retrier;
import autopilot.retry.Retries;
import autopilot.retry.RetryOptions;
import autopilot.spi.ChatMessage;
import autopilot.spi.CompletionOptions;
import autopilot.spi.GenerationClient;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Produces one piece of content for an {@link Operation}.
 *
 * <p>Every completion request runs through the {@link Retrier}, and each attempt passes
 * the {@link CircuitBreaker}, so an open breaker fails the operation immediately instead
 * of being retried. Plots take two requests (draft, then editorial revision); the other
 * types take one.
 */
public final class ContentGenerator {
  private static final Logger logger = Logger.getLogger(ContentGenerator.class.getName());

  static final List<String> PLOT_THEMES = List.of(
      "an unknown adventure", "a creative discovery", "a promise broken twice",
      "the last letter", "a city that forgets");
  static final List<String> CHARACTER_TRAITS = List.of(
      "mysterious", "intellectual", "brave", "delicate", "passionate");
  static final List<String> WORLD_CONCEPTS = List.of(
      "a world where magic and science coexist", "a future city", "an ancient civilization",
      "another world", "a parallel world");
  static final List<String> INSPIRATION_SEEDS = List.of(
      "lighthouse", "forgotten recipe", "tidal clock", "borrowed name", "glass orchard",
      "night train", "silent choir", "paper moon");

  private final GenerationClient client;
  private final Retrier retrier;
  private final CircuitBreaker breaker;
  private final double temperature;
  private final Random random;

  private ContentGenerator(Builder builder) {
    this.client = Objects.requireNonNull(builder.client, "client");
    this.breaker = builder.breaker != null ? builder.breaker : CircuitBreaker.builder("content-generation").build();
    this.retrier = builder.retrier != null ? builder.retrier : new Retrier(RetryOptions.builder()
        .maxAttempts(3)
        .initialDelayMs(1000)
        .maxDelayMs(10_000)
        .shouldRetry(Retries.retryableGeneration())
        .build());
    this.temperature = builder.temperature;
    this.random = builder.random != null ? builder.random : new Random();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Generates content of the operation's type.
   *
   * @throws Exception the last generation failure once retries are exhausted, or
   *                   {@link autopilot.retry.CircuitOpenException} when the breaker is open
   */
  public GenerationOutcome generate(Operation operation, ResourceLimits limits) throws Exception {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(limits, "limits");
    Session session = new Session(new CompletionOptions(temperature, limits.maxTokensPerOperation()));
    GeneratedContent content = switch (operation.type()) {
      case PLOT -> plot(session);
      case CHARACTER -> character(session);
      case WORLD_SETTING -> worldSetting(session);
      case INSPIRATION -> inspiration(session);
    };
    logger.log(Level.FINE, "Generated {0} for operation {1} in {2} calls",
        new Object[]{operation.type().wireName(), operation.id(), session.apiCalls.get()});
    return new GenerationOutcome(content, session.tokens(), session.apiCalls.get());
  }

  private GeneratedContent plot(Session session) throws Exception {
    String theme = pick(PLOT_THEMES);
    String draft = session.complete(
        "You are an experimental novelist.",
        "Write a new plot outline. Theme: " + theme);
    String revised = session.complete(
        "You are a logical editor. Tighten the plot, fix gaps in cause and effect, keep the voice.",
        draft);
    return new GeneratedContent.PlotIdea(theme, revised);
  }

  private GeneratedContent character(Session session) throws Exception {
    String trait = pick(CHARACTER_TRAITS);
    String body = session.complete(
        "You are an emotionally perceptive novelist.",
        "Create an appealing character whose defining trait is: " + trait);
    return new GeneratedContent.CharacterProfile(trait, body);
  }

  private GeneratedContent worldSetting(Session session) throws Exception {
    String concept = pick(WORLD_CONCEPTS);
    String body = session.complete(
        "You are a novelist with a rigorous, logical mind.",
        "Create a world setting based on " + concept + ".");
    return new GeneratedContent.WorldSetting(concept, body);
  }

  private GeneratedContent inspiration(Session session) throws Exception {
    List<String> pool = new ArrayList<>(INSPIRATION_SEEDS);
    List<String> sources = new ArrayList<>(2);
    sources.add(pool.remove(random.nextInt(pool.size())));
    sources.add(pool.remove(random.nextInt(pool.size())));
    String body = session.complete(
        "You look for unexpected connections between unrelated ideas.",
        "Combine '" + sources.get(0) + "' and '" + sources.get(1)
            + "' into one idea a novelist could build on.");
    return new GeneratedContent.Inspiration(sources, body);
  }

  private String pick(List<String> values) {
    return values.get(random.nextInt(values.size()));
  }

  private final class Session {
    private final CompletionOptions options;
    private final AtomicInteger apiCalls = new AtomicInteger();
    private long characters;

    private Session(CompletionOptions options) {
      this.options = options;
    }

    private String complete(String system, String user) throws Exception {
      List<ChatMessage> messages = List.of(ChatMessage.system(system), ChatMessage.user(user));
      String reply = retrier.execute(() -> breaker.execute(() -> {
        apiCalls.incrementAndGet();
        return client.complete(messages, options);
      }));
      characters += system.length() + user.length() + (reply == null ? 0 : reply.length());
      return reply == null ? "" : reply;
    }

    private int tokens() {
      return (int) Math.min(Integer.MAX_VALUE, characters / 4);
    }
  }

  /**
   * Builder for {@link ContentGenerator}.
   */
  public static final class Builder {
    private GenerationClient client;
    private Retrier retrier;
    private CircuitBreaker breaker;
    private double temperature = 0.8;
    private Random random;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder client(GenerationClient client) {
      this.client = client;
      return this;
    }

    /**
     * Retry policy around each request.
     *
     * <p>Optional. Defaults to 3 attempts, 1 s initial delay doubling up to 10 s, retrying
     * only retryable {@link autopilot.spi.GenerationException}s.
     */
    public Builder retrier(Retrier retrier) {
      this.retrier = retrier;
      return this;
    }

    /**
     * Optional. Defaults to a breaker named {@code content-generation} with default settings.
     */
    public Builder breaker(CircuitBreaker breaker) {
      this.breaker = breaker;
      return this;
    }

    /**
     * Optional. Defaults to 0.8.
     */
    public Builder temperature(double temperature) {
      this.temperature = temperature;
      return this;
    }

    /**
     * Source of theme, trait and concept choices.
     *
     * <p>Optional. Defaults to a new {@link Random}.
     */
    public Builder random(Random random) {
      this.random = random;
      return this;
    }

    public ContentGenerator build() {
      return new ContentGenerator(this);
    }
  }
}
