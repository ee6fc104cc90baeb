package autopilot.spi;

/**
 * Sampling options passed to a {@link GenerationClient}.
 *
 * @param temperature sampling temperature
 * @param maxTokens   upper bound on generated tokens
 */
public record CompletionOptions(double temperature, int maxTokens) {
  public CompletionOptions {
    if (maxTokens <= 0) {
      throw new IllegalArgumentException("maxTokens must be > 0");
    }
  }
}
