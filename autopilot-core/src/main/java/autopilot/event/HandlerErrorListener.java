package autopilot.event;

/**
 * Error channel of the {@link EventBus}: receives every handler failure.
 */
@FunctionalInterface
public interface HandlerErrorListener {
  void onHandlerError(DomainEvent event, Exception error);
}
