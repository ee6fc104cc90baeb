package autopilot.quality;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Immutable result of a quality assessment.
 *
 * @param overallScore   weight-normalized average of criterion scores (0-100)
 * @param recommendation verdict derived from {@code overallScore}
 * @param degraded       {@code true} when assessment failed and this is the fallback
 */
public record QualityAssessment(int overallScore, List<QualityCriterion> criteria,
    Recommendation recommendation, String reasoning, boolean degraded) {

  public static final int DEGRADED_SCORE = 50;

  public QualityAssessment {
    Objects.requireNonNull(recommendation, "recommendation");
    Objects.requireNonNull(reasoning, "reasoning");
    criteria = List.copyOf(Objects.requireNonNull(criteria, "criteria"));
    if (overallScore < 0 || overallScore > 100) {
      throw new IllegalArgumentException("overallScore must be between 0 and 100, got: " + overallScore);
    }
  }

  /**
   * Aggregates criterion scores: {@code round(sum(score * weight) / sum(weight))}.
   */
  public static QualityAssessment fromCriteria(List<QualityCriterion> criteria) {
    if (criteria.isEmpty()) {
      throw new IllegalArgumentException("criteria must not be empty");
    }
    double weighted = 0;
    double totalWeight = 0;
    for (QualityCriterion criterion : criteria) {
      weighted += criterion.score() * criterion.weight();
      totalWeight += criterion.weight();
    }
    int overall = (int) Math.round(weighted / totalWeight);
    return new QualityAssessment(overall, criteria, Recommendation.forScore(overall),
        reasoning(criteria, overall), false);
  }

  /**
   * Fallback when assessment fails: score 50, one synthetic criterion, REVIEW.
   */
  public static QualityAssessment degraded(String failure) {
    String details = failure == null ? "assessment failed" : failure;
    return new QualityAssessment(DEGRADED_SCORE,
        List.of(new QualityCriterion("system error", DEGRADED_SCORE, 1.0, details)),
        Recommendation.REVIEW,
        "Quality assessment failed; manual review required: " + details,
        true);
  }

  /**
   * Whether the content is persisted under {@code qualityThreshold}: the verdict must
   * be SAVE and the score must reach the threshold. Raising the threshold can only
   * turn a pass into a fail.
   */
  public boolean passes(int qualityThreshold) {
    return recommendation == Recommendation.SAVE && overallScore >= qualityThreshold;
  }

  private static String reasoning(List<QualityCriterion> criteria, int overall) {
    List<QualityCriterion> ranked = criteria.stream()
        .sorted(Comparator.comparingInt(QualityCriterion::score).reversed())
        .collect(Collectors.toList());
    String strengths = describe(ranked.subList(0, Math.min(2, ranked.size())));
    String weaknesses = describe(ranked.subList(Math.max(0, ranked.size() - 2), ranked.size()));
    return "Overall " + overall + ". Strengths: " + strengths + ". Needs work: " + weaknesses + ".";
  }

  private static String describe(List<QualityCriterion> criteria) {
    return criteria.stream()
        .map(c -> c.name() + " (" + c.score() + ")")
        .collect(Collectors.joining(", "));
  }
}
