package autopilot.quality;

import autopilot.generation.GeneratedContent;
import autopilot.model.ContentType;
import autopilot.retry.CircuitBreaker;
import autopilot.spi.ChatMessage;
import autopilot.spi.GenerationException;
import autopilot.testing.RecordingMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class QualityGateTest {
  private static final GeneratedContent PLOT = new GeneratedContent.PlotIdea("time loop", "A courier relives one day.");

  private static String uniformReply(ContentType type, int score) {
    return "<evaluation>\n" + QualityCriteria.forType(type).stream()
        .map(s -> s.name() + ": " + score + " - ok")
        .collect(Collectors.joining("\n")) + "\n</evaluation>";
  }

  @Test
  void highScoresAreSaved() {
    RecordingMetrics metrics = new RecordingMetrics();
    QualityGate gate = QualityGate.builder()
        .client((messages, options) -> uniformReply(ContentType.PLOT, 82))
        .metrics(metrics)
        .build();

    QualityAssessment assessment = gate.assess(PLOT, ContentType.PLOT);

    assertEquals(82, assessment.overallScore());
    assertEquals(Recommendation.SAVE, assessment.recommendation());
    assertEquals(QualityCriteria.forType(ContentType.PLOT).size(), assessment.criteria().size());
    assertEquals(List.of(82), metrics.qualityScores);
  }

  @Test
  void lowScoresAreDiscarded() {
    QualityGate gate = QualityGate.builder()
        .client((messages, options) -> uniformReply(ContentType.WORLD_SETTING, 30))
        .build();

    QualityAssessment assessment = gate.assess(
        new GeneratedContent.WorldSetting("floating cities", "Cities drift on thermals."), ContentType.WORLD_SETTING);

    assertEquals(Recommendation.DISCARD, assessment.recommendation());
  }

  @Test
  void promptCarriesCriteriaAndContent() {
    AtomicReference<List<ChatMessage>> seen = new AtomicReference<>();
    QualityGate gate = QualityGate.builder()
        .client((messages, options) -> {
          seen.set(messages);
          assertEquals(0.3, options.temperature());
          return uniformReply(ContentType.PLOT, 70);
        })
        .build();

    gate.assess(PLOT, ContentType.PLOT);

    List<ChatMessage> messages = seen.get();
    assertEquals("system", messages.get(0).role());
    assertTrue(messages.get(0).content().contains("story structure"));
    assertTrue(messages.get(0).content().contains("<evaluation>"));
    assertEquals("user", messages.get(1).role());
    assertTrue(messages.get(1).content().contains("Plot: time loop"));
    assertTrue(messages.get(1).content().contains("A courier relives one day."));
  }

  @Test
  void assessorFailureDegradesInsteadOfThrowing() {
    RecordingMetrics metrics = new RecordingMetrics();
    QualityGate gate = QualityGate.builder()
        .client((messages, options) -> {
          throw new GenerationException(GenerationException.Kind.TIMEOUT, "assessor timed out");
        })
        .metrics(metrics)
        .build();

    QualityAssessment assessment = gate.assess(PLOT, ContentType.PLOT);

    assertTrue(assessment.degraded());
    assertEquals(50, assessment.overallScore());
    assertEquals(Recommendation.REVIEW, assessment.recommendation());
    assertTrue(assessment.reasoning().contains("assessor timed out"));
    assertEquals(List.of(50), metrics.qualityScores);
  }

  @Test
  void openCircuitDegradesWithoutCallingAssessor() {
    AtomicInteger calls = new AtomicInteger();
    CircuitBreaker breaker = CircuitBreaker.builder("quality-assessment")
        .failureThreshold(2)
        .resetTimeout(Duration.ofMinutes(5))
        .build();
    QualityGate gate = QualityGate.builder()
        .client((messages, options) -> {
          calls.incrementAndGet();
          throw new GenerationException(GenerationException.Kind.UNAVAILABLE, "down");
        })
        .breaker(breaker)
        .build();

    gate.assess(PLOT, ContentType.PLOT);
    gate.assess(PLOT, ContentType.PLOT);
    QualityAssessment third = gate.assess(PLOT, ContentType.PLOT);

    assertEquals(2, calls.get());
    assertTrue(third.degraded());
    assertTrue(third.reasoning().contains("CircuitOpenException"));
  }
}
