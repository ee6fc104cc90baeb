package autopilot.event;

/**
 * Reacts to published {@link DomainEvent}s.
 *
 * <p>Handlers run concurrently on the bus executor. A thrown exception is reported
 * to the bus error listeners and does not affect other handlers or the publisher.
 * Handler side effects are not transactional with the write that produced the event.
 */
@FunctionalInterface
public interface EventHandler {
  void handle(DomainEvent event) throws Exception;
}
