package autopilot.model;

import autopilot.quality.Recommendation;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Generated content that passed the quality gate, as persisted.
 *
 * @param attributes type-specific fields of the generated content (theme, trait, ...)
 */
public record SavedContent(
    String id,
    String operationId,
    String projectId,
    ContentType type,
    String title,
    String body,
    Map<String, String> attributes,
    int qualityScore,
    Recommendation recommendation,
    Instant createdAt) {

  public SavedContent {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(body, "body");
    Objects.requireNonNull(recommendation, "recommendation");
    Objects.requireNonNull(createdAt, "createdAt");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }
}
