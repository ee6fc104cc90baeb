package autopilot.quality;

import autopilot.generation.GeneratedContent;
import autopilot.model.ContentType;
import autopilot.retry.CircuitBreaker;
import autopilot.spi.ChatMessage;
import autopilot.spi.CompletionOptions;
import autopilot.spi.GenerationClient;
import autopilot.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Scores generated content against the weighted criteria of its type and recommends
 * whether to keep it.
 *
 * <p>{@link #assess} never throws. When the assessor fails, or its circuit is open,
 * the result is {@link QualityAssessment#degraded degraded}: score 50, recommendation
 * REVIEW. Degraded results never pass a save threshold.
 */
public final class QualityGate {
  private static final Logger logger = Logger.getLogger(QualityGate.class.getName());

  private final GenerationClient client;
  private final CircuitBreaker breaker;
  private final CompletionOptions options;
  private final MetricsExporter metrics;

  private QualityGate(Builder builder) {
    this.client = Objects.requireNonNull(builder.client, "client");
    this.breaker = builder.breaker != null ? builder.breaker : CircuitBreaker.builder("quality-assessment").build();
    this.options = builder.options != null ? builder.options : new CompletionOptions(0.3, 1000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  public QualityAssessment assess(GeneratedContent content, ContentType type) {
    Objects.requireNonNull(content, "content");
    Objects.requireNonNull(type, "type");
    QualityAssessment assessment;
    try {
      List<CriterionSpec> specs = QualityCriteria.forType(type);
      List<ChatMessage> prompt = prompt(content, type, specs);
      String reply = breaker.execute(() -> client.complete(prompt, options));
      assessment = QualityAssessment.fromCriteria(AssessmentParser.parse(reply, specs));
    } catch (Exception e) {
      logger.log(Level.WARNING, "Quality assessment failed for " + type.wireName()
          + " '" + content.title() + "'", e);
      assessment = QualityAssessment.degraded(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
    metrics.recordQualityScore(assessment.overallScore());
    return assessment;
  }

  static List<ChatMessage> prompt(GeneratedContent content, ContentType type, List<CriterionSpec> specs) {
    String criteria = specs.stream()
        .map(s -> "- " + s.name() + " (weight " + s.weight() + "): " + s.description())
        .collect(Collectors.joining("\n"));
    String system = "You are a strict editor assessing " + type.wireName() + " material for novelists.\n"
        + "Score each criterion from 0 to 100.\n"
        + "Answer inside <evaluation></evaluation>, one line per criterion, formatted as\n"
        + "criterion name: score - short reason\n\n"
        + "Criteria:\n" + criteria;
    String user = "Title: " + content.title() + "\n\n" + content.body();
    return List.of(ChatMessage.system(system), ChatMessage.user(user));
  }

  /**
   * Builder for {@link QualityGate}.
   */
  public static final class Builder {
    private GenerationClient client;
    private CircuitBreaker breaker;
    private CompletionOptions options;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Assessor used to score content.
     *
     * <p><b>Required.</b>
     */
    public Builder client(GenerationClient client) {
      this.client = client;
      return this;
    }

    /**
     * Optional. Defaults to a breaker named {@code quality-assessment} with default settings.
     */
    public Builder breaker(CircuitBreaker breaker) {
      this.breaker = breaker;
      return this;
    }

    /**
     * Optional. Defaults to temperature 0.3 and 1000 tokens.
     */
    public Builder options(CompletionOptions options) {
      this.options = options;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public QualityGate build() {
      return new QualityGate(this);
    }
  }
}
