package autopilot.spi;

import java.util.List;

/**
 * Text completion collaborator used for content generation and for quality assessment.
 *
 * <p>Implementations own their request timeout and report failures as
 * {@link GenerationException}, flagging rate limits and timeouts as retryable.
 */
@FunctionalInterface
public interface GenerationClient {

  /**
   * Completes the conversation and returns the generated text.
   *
   * @throws GenerationException if the request fails
   */
  String complete(List<ChatMessage> messages, CompletionOptions options);
}
