package autopilot.event;

import autopilot.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe bus for {@link DomainEvent}s.
 *
 * <p>{@link #publish} runs the middleware chain on the calling thread, then runs every
 * handler subscribed to the event type (plus wildcard handlers) concurrently on a
 * bounded executor and returns once all of them have settled. Handler failures are
 * logged and forwarded to the {@link HandlerErrorListener}s; they never reach sibling
 * handlers or the publisher.
 *
 * <p>The registry is bounded: at most {@code maxHandlersPerType} handlers per event
 * type. Every subscription returns a {@link Subscription} handle.
 *
 * <p>A publish issued from inside a handler runs its handlers inline on that thread,
 * so nested publications cannot exhaust the executor.
 *
 * <p>This class is thread-safe.
 */
public final class EventBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventBus.class.getName());

  /** Event type used by {@link #subscribeAll}. */
  public static final String WILDCARD = "*";

  private final ThreadLocal<Boolean> dispatching = ThreadLocal.withInitial(() -> Boolean.FALSE);
  private final Map<String, List<Registration>> handlers = new ConcurrentHashMap<>();
  private final List<EventMiddleware> middlewares = new CopyOnWriteArrayList<>();
  private final List<HandlerErrorListener> errorListeners = new CopyOnWriteArrayList<>();
  private final ExecutorService executor;
  private final int maxHandlersPerType;
  private final long closeTimeoutMs;
  private volatile boolean closed;

  private EventBus(Builder builder) {
    if (builder.handlerThreads <= 0) {
      throw new IllegalArgumentException("handlerThreads must be > 0");
    }
    if (builder.maxHandlersPerType <= 0) {
      throw new IllegalArgumentException("maxHandlersPerType must be > 0");
    }
    if (builder.closeTimeoutMs < 0) {
      throw new IllegalArgumentException("closeTimeoutMs must be >= 0");
    }
    this.maxHandlersPerType = builder.maxHandlersPerType;
    this.closeTimeoutMs = builder.closeTimeoutMs;
    this.middlewares.addAll(builder.middlewares);
    this.executor = Executors.newFixedThreadPool(builder.handlerThreads, new DaemonThreadFactory("autopilot-event-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Appends a middleware to the end of the chain.
   */
  public void use(EventMiddleware middleware) {
    middlewares.add(Objects.requireNonNull(middleware, "middleware"));
  }

  /**
   * Subscribes a handler to one event type.
   *
   * @throws IllegalStateException if the type already has {@code maxHandlersPerType} handlers
   */
  public Subscription subscribe(String eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    Registration registration = new Registration(eventType, handler);
    List<Registration> list = handlers.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>());
    synchronized (list) {
      if (list.size() >= maxHandlersPerType) {
        throw new IllegalStateException("Handler limit of " + maxHandlersPerType
            + " reached for event type " + eventType);
      }
      list.add(registration);
    }
    return registration::unsubscribe;
  }

  /**
   * Subscribes a handler to every event type.
   */
  public Subscription subscribeAll(EventHandler handler) {
    return subscribe(WILDCARD, handler);
  }

  /**
   * Subscribes one handler to several event types. The returned handle removes all of them.
   */
  public Subscription subscribeMany(Collection<String> eventTypes, EventHandler handler) {
    Objects.requireNonNull(eventTypes, "eventTypes");
    List<Subscription> subscriptions = new ArrayList<>(eventTypes.size());
    try {
      for (String eventType : eventTypes) {
        subscriptions.add(subscribe(eventType, handler));
      }
    } catch (RuntimeException e) {
      subscriptions.forEach(Subscription::unsubscribe);
      throw e;
    }
    return () -> subscriptions.forEach(Subscription::unsubscribe);
  }

  /**
   * Registers a listener on the error channel.
   */
  public Subscription onError(HandlerErrorListener listener) {
    errorListeners.add(Objects.requireNonNull(listener, "listener"));
    return () -> errorListeners.remove(listener);
  }

  public int handlerCount(String eventType) {
    List<Registration> list = handlers.get(eventType);
    return list == null ? 0 : list.size();
  }

  /**
   * Publishes an event: middlewares first, then all matching handlers concurrently.
   * Returns when every handler has settled.
   *
   * @throws IllegalStateException if the bus is closed
   * @throws RuntimeException      thrown by a middleware, in which case no handler runs
   */
  public void publish(DomainEvent event) {
    Objects.requireNonNull(event, "event");
    if (closed) {
      throw new IllegalStateException("EventBus has been closed");
    }
    for (EventMiddleware middleware : middlewares) {
      middleware.beforePublish(event);
    }

    List<Registration> targets = new ArrayList<>();
    targets.addAll(handlers.getOrDefault(event.eventType(), List.of()));
    targets.addAll(handlers.getOrDefault(WILDCARD, List.of()));
    if (!targets.isEmpty()) {
      dispatch(event, targets);
    }

    for (EventMiddleware middleware : middlewares) {
      try {
        middleware.afterPublish(event);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Middleware afterPublish failed for " + event, e);
      }
    }
  }

  /**
   * Publishes events one after another, in list order.
   */
  public void publishAll(List<DomainEvent> events) {
    Objects.requireNonNull(events, "events");
    for (DomainEvent event : events) {
      publish(event);
    }
  }

  /**
   * Stops accepting publications and waits for in-flight handlers.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    executor.shutdown();
    try {
      if (!executor.awaitTermination(closeTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Event handlers still running after {0} ms; forcing shutdown", closeTimeoutMs);
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      executor.shutdownNow();
    }
    handlers.clear();
  }

  private void dispatch(DomainEvent event, List<Registration> targets) {
    if (dispatching.get()) {
      for (Registration target : targets) {
        invoke(target, event);
      }
      return;
    }
    CompletableFuture<?>[] futures = new CompletableFuture<?>[targets.size()];
    for (int i = 0; i < targets.size(); i++) {
      Registration target = targets.get(i);
      futures[i] = CompletableFuture.runAsync(() -> {
        dispatching.set(Boolean.TRUE);
        try {
          invoke(target, event);
        } finally {
          dispatching.remove();
        }
      }, executor);
    }
    CompletableFuture.allOf(futures).join();
  }

  private void invoke(Registration target, DomainEvent event) {
    if (!target.active.get()) {
      return;
    }
    try {
      target.handler.handle(event);
    } catch (Exception e) {
      logger.log(Level.WARNING, "Event handler failed for " + event, e);
      reportError(event, e);
    }
  }

  private void reportError(DomainEvent event, Exception error) {
    for (HandlerErrorListener listener : errorListeners) {
      try {
        listener.onHandlerError(event, error);
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Handler error listener failed", e);
      }
    }
  }

  private final class Registration {
    private final String eventType;
    private final EventHandler handler;
    private final AtomicBoolean active = new AtomicBoolean(true);

    private Registration(String eventType, EventHandler handler) {
      this.eventType = eventType;
      this.handler = handler;
    }

    private void unsubscribe() {
      if (!active.compareAndSet(true, false)) {
        return;
      }
      List<Registration> list = handlers.get(eventType);
      if (list != null) {
        synchronized (list) {
          list.remove(this);
        }
      }
    }
  }

  /**
   * Builder for {@link EventBus}.
   */
  public static final class Builder {
    private int handlerThreads = 4;
    private int maxHandlersPerType = 100;
    private long closeTimeoutMs = 5000;
    private final List<EventMiddleware> middlewares = new ArrayList<>();

    private Builder() {
    }

    /**
     * Threads running handlers.
     *
     * <p>Optional. Defaults to 4.
     */
    public Builder handlerThreads(int handlerThreads) {
      this.handlerThreads = handlerThreads;
      return this;
    }

    /**
     * Optional. Defaults to 100.
     */
    public Builder maxHandlersPerType(int maxHandlersPerType) {
      this.maxHandlersPerType = maxHandlersPerType;
      return this;
    }

    /**
     * Optional. Defaults to 5000 ms.
     */
    public Builder closeTimeoutMs(long closeTimeoutMs) {
      this.closeTimeoutMs = closeTimeoutMs;
      return this;
    }

    public Builder middleware(EventMiddleware middleware) {
      this.middlewares.add(Objects.requireNonNull(middleware, "middleware"));
      return this;
    }

    public EventBus build() {
      return new EventBus(this);
    }
  }
}
