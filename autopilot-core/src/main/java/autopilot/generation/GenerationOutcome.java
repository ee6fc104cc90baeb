package autopilot.generation;

import java.util.Objects;

/**
 * Generated content together with what producing it cost.
 *
 * @param tokensUsed estimated tokens across all requests, at four characters per token
 * @param apiCalls   completion requests issued, retries included
 */
public record GenerationOutcome(GeneratedContent content, int tokensUsed, int apiCalls) {
  public GenerationOutcome {
    Objects.requireNonNull(content, "content");
    if (tokensUsed < 0 || apiCalls < 0) {
      throw new IllegalArgumentException("tokensUsed and apiCalls must be >= 0");
    }
  }
}
