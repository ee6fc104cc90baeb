package autopilot.quality;

import autopilot.model.ContentType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityAssessmentTest {

  @Test
  void recommendationThresholds() {
    assertEquals(Recommendation.SAVE, Recommendation.forScore(100));
    assertEquals(Recommendation.SAVE, Recommendation.forScore(70));
    assertEquals(Recommendation.REVIEW, Recommendation.forScore(69));
    assertEquals(Recommendation.REVIEW, Recommendation.forScore(50));
    assertEquals(Recommendation.DISCARD, Recommendation.forScore(49));
    assertEquals(Recommendation.DISCARD, Recommendation.forScore(0));
  }

  @Test
  void overallScoreIsWeightedAverage() {
    List<QualityCriterion> criteria = new ArrayList<>();
    for (CriterionSpec spec : QualityCriteria.forType(ContentType.CHARACTER)) {
      int score = spec.name().equals("distinct personality") ? 100 : 50;
      criteria.add(new QualityCriterion(spec.name(), score, spec.weight(), ""));
    }

    QualityAssessment assessment = QualityAssessment.fromCriteria(criteria);

    // (1.2 * 100 + 4.8 * 50) / 6.0
    assertEquals(60, assessment.overallScore());
    assertEquals(Recommendation.REVIEW, assessment.recommendation());
    assertFalse(assessment.degraded());
  }

  @Test
  void reasoningNamesStrengthsAndWeaknesses() {
    QualityAssessment assessment = QualityAssessment.fromCriteria(List.of(
        new QualityCriterion("originality", 90, 1.0, ""),
        new QualityCriterion("logic", 40, 1.0, ""),
        new QualityCriterion("reader appeal", 70, 1.0, "")));

    assertTrue(assessment.reasoning().startsWith("Overall 67."));
    assertTrue(assessment.reasoning().contains("Strengths: originality (90)"));
    assertTrue(assessment.reasoning().contains("logic (40)"));
  }

  @Test
  void passesRequiresSaveAndThreshold() {
    QualityAssessment high = QualityAssessment.fromCriteria(List.of(new QualityCriterion("x", 75, 1.0, "")));

    assertTrue(high.passes(70));
    assertTrue(high.passes(75));
    assertFalse(high.passes(76));
  }

  @Test
  void raisingThresholdNeverTurnsFailIntoPass() {
    for (int score = 0; score <= 100; score += 5) {
      QualityAssessment a = QualityAssessment.fromCriteria(List.of(new QualityCriterion("x", score, 1.0, "")));
      boolean failedBefore = false;
      for (int threshold = 0; threshold <= 100; threshold += 10) {
        boolean passes = a.passes(threshold);
        assertFalse(failedBefore && passes, "score " + score + " threshold " + threshold);
        failedBefore |= !passes;
      }
    }
  }

  @Test
  void degradedNeverPasses() {
    QualityAssessment degraded = QualityAssessment.degraded("timeout");

    assertEquals(QualityAssessment.DEGRADED_SCORE, degraded.overallScore());
    assertEquals(Recommendation.REVIEW, degraded.recommendation());
    assertTrue(degraded.degraded());
    assertFalse(degraded.passes(0));
    assertEquals("system error", degraded.criteria().get(0).name());
  }

  @Test
  void everyTypeHasPositivelyWeightedCriteria() {
    for (ContentType type : ContentType.values()) {
      List<CriterionSpec> specs = QualityCriteria.forType(type);
      assertFalse(specs.isEmpty(), type.name());
      assertTrue(specs.stream().allMatch(s -> s.weight() > 0));
    }
  }

  @Test
  void invalidValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> QualityAssessment.fromCriteria(List.of()));
    assertThrows(IllegalArgumentException.class, () -> new CriterionSpec("x", 0, "d"));
  }
}
