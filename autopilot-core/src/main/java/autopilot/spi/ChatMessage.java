package autopilot.spi;

import java.util.Objects;

/**
 * One message of a completion request.
 *
 * @param role    {@code system}, {@code user} or {@code assistant}
 * @param content message text
 */
public record ChatMessage(String role, String content) {
  public ChatMessage {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(content, "content");
  }

  public static ChatMessage system(String content) {
    return new ChatMessage("system", content);
  }

  public static ChatMessage user(String content) {
    return new ChatMessage("user", content);
  }
}
