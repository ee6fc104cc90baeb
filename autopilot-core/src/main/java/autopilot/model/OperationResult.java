package autopilot.model;

import autopilot.quality.Recommendation;

import java.util.Objects;

/**
 * Outcome of a completed operation.
 *
 * @param contentId      id of the saved content, {@code null} when not saved
 * @param title          title of the generated content
 * @param qualityScore   overall quality score (0-100)
 * @param recommendation quality gate verdict
 * @param saved          whether the content passed the gate and threshold and was persisted
 */
public record OperationResult(String contentId, String title, int qualityScore,
    Recommendation recommendation, boolean saved) {
  public OperationResult {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(recommendation, "recommendation");
    if (saved && contentId == null) {
      throw new IllegalArgumentException("saved result requires a contentId");
    }
  }
}
