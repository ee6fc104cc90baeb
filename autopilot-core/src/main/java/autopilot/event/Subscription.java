package autopilot.event;

/**
 * Handle returned by {@link EventBus#subscribe}. Unsubscribing twice is a no-op.
 */
@FunctionalInterface
public interface Subscription {
  void unsubscribe();
}
