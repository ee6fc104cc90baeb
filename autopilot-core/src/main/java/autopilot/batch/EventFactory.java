package autopilot.batch;

import autopilot.event.DomainEvent;

import java.util.Optional;

/**
 * Derives the domain event published for a persisted entity, inside the same
 * transaction as the write.
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface EventFactory<T> {

  Optional<DomainEvent> eventFor(T entity, WriteResult result);

  /**
   * A factory that publishes nothing, for high-volume rows such as activity logs.
   */
  static <T> EventFactory<T> none() {
    return (entity, result) -> Optional.empty();
  }

  /**
   * Publishes {@code <entityName>Created} or {@code <entityName>Updated} with the
   * entity id as aggregate id.
   */
  static <T> EventFactory<T> createdOrUpdated(String entityName) {
    return (entity, result) -> Optional.of(DomainEvent.builder(
            entityName + (result.outcome() == WriteOutcome.INSERTED ? "Created" : "Updated"))
        .aggregate(entityName, result.id())
        .build());
  }
}
