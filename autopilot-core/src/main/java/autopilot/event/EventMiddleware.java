package autopilot.event;

/**
 * Hook run on the publishing thread, in registration order, before handlers are
 * dispatched.
 *
 * <p>An exception thrown by {@link #beforePublish} aborts the publication and
 * propagates to the publisher, which is how a failed event-log append rolls back the
 * surrounding transaction.
 */
public interface EventMiddleware {

  void beforePublish(DomainEvent event);

  /**
   * Called after every handler settled. Exceptions are logged and swallowed.
   */
  default void afterPublish(DomainEvent event) {
  }
}
