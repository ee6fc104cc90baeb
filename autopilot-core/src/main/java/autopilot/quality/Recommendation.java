package autopilot.quality;

import java.util.Locale;

/**
 * Quality gate verdict.
 */
public enum Recommendation {
  SAVE,
  REVIEW,
  DISCARD;

  public static final int SAVE_THRESHOLD = 70;
  public static final int REVIEW_THRESHOLD = 50;

  /**
   * {@code >= 70} saves, {@code 50..69} asks for review, anything lower discards.
   */
  public static Recommendation forScore(int overallScore) {
    if (overallScore >= SAVE_THRESHOLD) {
      return SAVE;
    }
    if (overallScore >= REVIEW_THRESHOLD) {
      return REVIEW;
    }
    return DISCARD;
  }

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Recommendation fromCode(String code) {
    return valueOf(code.toUpperCase(Locale.ROOT));
  }
}
