package autopilot.generation;

import autopilot.config.ResourceLimits;
import autopilot.model.ContentType;
import autopilot.model.Operation;
import autopilot.retry.CircuitBreaker;
import autopilot.retry.CircuitOpenException;
import autopilot.retry.Retrier;
import autopilot.retry.Retries;
import autopilot.retry.RetryOptions;
import autopilot.spi.ChatMessage;
import autopilot.spi.CompletionOptions;
import autopilot.spi.GenerationException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ContentGeneratorTest {
  private final List<List<ChatMessage>> requests = new CopyOnWriteArrayList<>();
  private final List<CompletionOptions> options = new CopyOnWriteArrayList<>();

  private static Retrier noWaitRetrier(int attempts) {
    return new Retrier(RetryOptions.builder()
        .maxAttempts(attempts)
        .shouldRetry(Retries.retryableGeneration())
        .sleeper(ms -> { })
        .build());
  }

  private ContentGenerator.Builder recording(String reply) {
    return ContentGenerator.builder()
        .client((messages, opts) -> {
          requests.add(messages);
          options.add(opts);
          return reply;
        })
        .retrier(noWaitRetrier(3))
        .random(new Random(42));
  }

  private static Operation operation(ContentType type) {
    return Operation.pending(type, "project-1");
  }

  @Test
  void plotTakesDraftAndRevision() throws Exception {
    ContentGenerator generator = recording("A revised outline").build();

    GenerationOutcome outcome = generator.generate(operation(ContentType.PLOT), ResourceLimits.DEFAULT);

    GeneratedContent.PlotIdea plot = assertInstanceOf(GeneratedContent.PlotIdea.class, outcome.content());
    assertTrue(ContentGenerator.PLOT_THEMES.contains(plot.theme()));
    assertEquals("A revised outline", plot.body());
    assertEquals(2, outcome.apiCalls());
    assertEquals("A revised outline", requests.get(1).get(1).content());
    assertTrue(outcome.tokensUsed() > 0);
  }

  @Test
  void characterUsesKnownTrait() throws Exception {
    ContentGenerator generator = recording("Mara, a lighthouse keeper").build();

    GenerationOutcome outcome = generator.generate(operation(ContentType.CHARACTER), ResourceLimits.DEFAULT);

    GeneratedContent.CharacterProfile character =
        assertInstanceOf(GeneratedContent.CharacterProfile.class, outcome.content());
    assertTrue(ContentGenerator.CHARACTER_TRAITS.contains(character.trait()));
    assertEquals("Character: " + character.trait(), character.title());
    assertEquals(1, outcome.apiCalls());
  }

  @Test
  void worldSettingUsesKnownConcept() throws Exception {
    ContentGenerator generator = recording("Floating archipelagos").build();

    GenerationOutcome outcome = generator.generate(operation(ContentType.WORLD_SETTING), ResourceLimits.DEFAULT);

    GeneratedContent.WorldSetting world = assertInstanceOf(GeneratedContent.WorldSetting.class, outcome.content());
    assertTrue(ContentGenerator.WORLD_CONCEPTS.contains(world.concept()));
    assertEquals(ContentType.WORLD_SETTING, world.type());
  }

  @Test
  void inspirationCombinesTwoDistinctSeeds() throws Exception {
    for (int seed = 0; seed < 20; seed++) {
      ContentGenerator generator = recording("idea").random(new Random(seed)).build();

      GenerationOutcome outcome = generator.generate(operation(ContentType.INSPIRATION), ResourceLimits.DEFAULT);

      GeneratedContent.Inspiration inspiration =
          assertInstanceOf(GeneratedContent.Inspiration.class, outcome.content());
      assertEquals(2, inspiration.sources().size());
      assertNotEquals(inspiration.sources().get(0), inspiration.sources().get(1));
    }
  }

  @Test
  void tokenBudgetComesFromResourceLimits() throws Exception {
    ContentGenerator generator = recording("x").temperature(0.5).build();

    generator.generate(operation(ContentType.CHARACTER), new ResourceLimits(70, 2048, 100, 1234));

    assertEquals(new CompletionOptions(0.5, 1234), options.get(0));
  }

  @Test
  void retryableFailuresAreRetried() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    ContentGenerator generator = ContentGenerator.builder()
        .client((messages, opts) -> {
          if (calls.incrementAndGet() == 1) {
            throw new GenerationException(GenerationException.Kind.RATE_LIMITED, "slow down");
          }
          return "ok";
        })
        .retrier(noWaitRetrier(3))
        .build();

    GenerationOutcome outcome = generator.generate(operation(ContentType.CHARACTER), ResourceLimits.DEFAULT);

    assertEquals(2, outcome.apiCalls());
  }

  @Test
  void nonRetryableFailureFailsImmediately() {
    AtomicInteger calls = new AtomicInteger();
    ContentGenerator generator = ContentGenerator.builder()
        .client((messages, opts) -> {
          calls.incrementAndGet();
          throw new GenerationException(GenerationException.Kind.INVALID_REQUEST, "bad prompt");
        })
        .retrier(noWaitRetrier(3))
        .build();

    assertThrows(GenerationException.class,
        () -> generator.generate(operation(ContentType.CHARACTER), ResourceLimits.DEFAULT));
    assertEquals(1, calls.get());
  }

  @Test
  void openBreakerIsNotRetried() {
    AtomicInteger calls = new AtomicInteger();
    CircuitBreaker breaker = CircuitBreaker.builder("content-generation")
        .failureThreshold(1)
        .resetTimeout(Duration.ofMinutes(1))
        .build();
    ContentGenerator generator = ContentGenerator.builder()
        .client((messages, opts) -> {
          calls.incrementAndGet();
          throw new GenerationException(GenerationException.Kind.TIMEOUT, "timeout");
        })
        .retrier(noWaitRetrier(5))
        .breaker(breaker)
        .build();

    assertThrows(CircuitOpenException.class,
        () -> generator.generate(operation(ContentType.CHARACTER), ResourceLimits.DEFAULT));
    assertEquals(1, calls.get());
  }
}
