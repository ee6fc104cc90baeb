package autopilot.quality;

import java.util.Objects;

/**
 * Score of one criterion within a {@link QualityAssessment}.
 *
 * @param score   0-100
 * @param details assessor's reason, or a note that the default score was used
 */
public record QualityCriterion(String name, int score, double weight, String details) {
  public QualityCriterion {
    Objects.requireNonNull(name, "name");
    if (score < 0 || score > 100) {
      throw new IllegalArgumentException("score must be between 0 and 100, got: " + score);
    }
    details = details == null ? "" : details;
  }
}
