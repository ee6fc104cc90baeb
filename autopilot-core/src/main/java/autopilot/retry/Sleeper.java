package autopilot.retry;

/**
 * Blocks the calling thread between retry attempts. Replaced in tests to avoid
 * real waiting.
 */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
