package autopilot.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation. Every operation, event, log entry and saved content row
 * gets a monotonic ULID so ids sort by creation time.
 */
public final class Ids {

  public static String next() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  private Ids() {}
}
