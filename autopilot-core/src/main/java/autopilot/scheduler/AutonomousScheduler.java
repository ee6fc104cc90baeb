package autopilot.scheduler;

import autopilot.batch.BatchWriteCoordinator;
import autopilot.batch.EventFactory;
import autopilot.batch.WriteResult;
import autopilot.config.AutonomousConfig;
import autopilot.config.AutonomousConfigPatch;
import autopilot.event.DomainEvent;
import autopilot.event.EventBus;
import autopilot.generation.ContentGenerator;
import autopilot.generation.GeneratedContent;
import autopilot.generation.GenerationOutcome;
import autopilot.log.ActivityLogger;
import autopilot.model.ContentType;
import autopilot.model.LogCategory;
import autopilot.model.LogEntry;
import autopilot.model.LogFilter;
import autopilot.model.LogLevel;
import autopilot.model.Operation;
import autopilot.model.OperationMetrics;
import autopilot.model.OperationResult;
import autopilot.model.OperationStatus;
import autopilot.model.SavedContent;
import autopilot.pool.ConnectionLease;
import autopilot.pool.ConnectionPool;
import autopilot.quality.QualityAssessment;
import autopilot.quality.QualityGate;
import autopilot.repo.Repository;
import autopilot.spi.ConfigStore;
import autopilot.spi.ContentStore;
import autopilot.spi.MetricsExporter;
import autopilot.spi.OperationStore;
import autopilot.spi.ResourceHealthProbe;
import autopilot.spi.ResourceSnapshot;
import autopilot.spi.SystemHealth;
import autopilot.tx.UnitOfWorkFactory;
import autopilot.util.DaemonThreadFactory;
import autopilot.util.Ids;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically generates content, scores it and keeps what passes the quality gate.
 *
 * <p>Lifecycle: {@link #initialize()} loads the latest persisted configuration (or
 * persists the defaults), {@link #start()} schedules the tick when the configuration is
 * enabled, {@link #stop()} cancels it. Each tick runs {@link #runOnce()}:
 * <ol>
 *   <li>skip outside every enabled time slot, evaluated in the configured zone;</li>
 *   <li>skip when the last health sample is unhealthy;</li>
 *   <li>skip when the UTC-day quota is used up;</li>
 *   <li>skip when the generation requests of the last hour reached the ceiling;</li>
 *   <li>skip when an operation is in flight;</li>
 *   <li>take the oldest queued operation, else synthesize one of a random configured type;</li>
 *   <li>generate, assess, save when the gate says SAVE and the score reaches the
 *       threshold, then persist the terminal operation.</li>
 * </ol>
 *
 * <p>At most one operation is in flight. It is claimed by compare-and-set on the current
 * slot and released the same way, so {@link #stop()} and a finishing tick never both
 * settle it: whichever swaps the slot first records the outcome, the other backs off.
 * A tick checks that its operation is still current after every step, and a saving tick
 * releases the slot inside the content transaction before it commits. A cycle that fails
 * unexpectedly fails the operation it left in the slot.
 *
 * <p>Operation failures never escape a tick; they are recorded on the operation.
 */
public final class AutonomousScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AutonomousScheduler.class.getName());
  private static final String CONTENT_AGGREGATE = "AutonomousContent";

  private final String schedulerId;
  private final ConfigStore configStore;
  private final OperationStore operationStore;
  private final BatchWriteCoordinator<Operation> operationWriter;
  private final Repository<Operation> operations;
  private final ContentStore contentStore;
  private final EventFactory<SavedContent> contentEvents;
  private final UnitOfWorkFactory units;
  private final ConnectionPool pool;
  private final ContentGenerator generator;
  private final QualityGate qualityGate;
  private final ResourceHealthProbe healthProbe;
  private final ActivityLogger activityLog;
  private final EventBus eventBus;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final ZoneId zone;
  private final Random random;

  private final ConcurrentLinkedDeque<Operation> queue = new ConcurrentLinkedDeque<>();
  private final AtomicReference<Operation> current = new AtomicReference<>();
  private final ReentrantLock tickLock = new ReentrantLock();
  private final DailyQuota quota;
  private final HourlyApiBudget apiBudget;
  private final AtomicLong totalOperations = new AtomicLong();
  private final AtomicLong savedOperations = new AtomicLong();

  private volatile AutonomousConfig config = AutonomousConfig.defaults();
  private volatile boolean initialized;
  private volatile boolean running;
  private volatile boolean closed;
  private volatile Instant lastOperationTime;
  private ScheduledExecutorService executor;
  private ScheduledFuture<?> tickTask;
  private ScheduledFuture<?> resetTask;

  private AutonomousScheduler(Builder builder) {
    this.configStore = Objects.requireNonNull(builder.configStore, "configStore");
    this.operationStore = Objects.requireNonNull(builder.operationStore, "operationStore");
    this.operationWriter = Objects.requireNonNull(builder.operationWriter, "operationWriter");
    this.contentStore = Objects.requireNonNull(builder.contentStore, "contentStore");
    this.units = Objects.requireNonNull(builder.unitOfWorkFactory, "unitOfWorkFactory");
    this.pool = Objects.requireNonNull(builder.pool, "pool");
    this.generator = Objects.requireNonNull(builder.generator, "generator");
    this.qualityGate = Objects.requireNonNull(builder.qualityGate, "qualityGate");
    this.healthProbe = Objects.requireNonNull(builder.healthProbe, "healthProbe");
    this.activityLog = Objects.requireNonNull(builder.activityLogger, "activityLogger");
    this.eventBus = Objects.requireNonNull(builder.eventBus, "eventBus");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.zone = builder.zone != null ? builder.zone : clock.getZone();
    this.random = builder.random != null ? builder.random : new Random();
    this.schedulerId = builder.schedulerId != null ? builder.schedulerId : Ids.next();
    this.operations = Repository.pooled(operationStore, operationWriter, pool);
    this.contentEvents = this::contentSaved;
    this.quota = new DailyQuota(clock);
    this.apiBudget = new HourlyApiBudget(clock);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Loads the latest persisted configuration, persisting the defaults as version 1 when
   * none exists. Idempotent.
   */
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    Optional<AutonomousConfig> latest;
    try (ConnectionLease lease = pool.acquire()) {
      latest = configStore.loadLatest(lease.connection());
    }
    if (latest.isPresent()) {
      config = latest.get();
    } else {
      AutonomousConfig defaults = AutonomousConfig.defaults();
      units.inTransaction(uow -> {
        configStore.append(uow.connection(), defaults);
        return null;
      });
      config = defaults;
    }
    initialized = true;
    activityLog.log(LogLevel.INFO, LogCategory.SYSTEM,
        "Autonomous scheduler initialized with configuration version " + config.version());
  }

  /**
   * Starts the periodic tick. The first tick runs one interval after this call.
   *
   * @return {@code true} if the scheduler is running on return, {@code false} when the
   *     configuration is disabled
   * @throws IllegalStateException if not initialized or already closed
   */
  public synchronized boolean start() {
    requireUsable();
    if (running) {
      activityLog.log(LogLevel.WARN, LogCategory.SYSTEM, "Autonomous mode already running");
      return true;
    }
    AutonomousConfig cfg = config;
    if (!cfg.enabled()) {
      activityLog.log(LogLevel.INFO, LogCategory.SYSTEM, "Autonomous mode is disabled");
      return false;
    }
    if (executor == null) {
      executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("autopilot-scheduler-"));
    }
    running = true;
    scheduleTick(cfg.intervalMinutes());
    scheduleDailyReset();
    activityLog.log(LogLevel.INFO, LogCategory.SYSTEM,
        "Autonomous mode started with " + cfg.intervalMinutes() + " minute intervals");
    publishQuietly(OperationEvents.lifecycle(OperationEvents.STARTED, schedulerId, clock.instant()));
    return true;
  }

  /**
   * Stops the tick, clears the queue and cancels the operation in flight, if any.
   * No-op when not running.
   */
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    cancelTasks();
    int dropped = queue.size();
    queue.clear();

    Operation inFlight = current.getAndSet(null);
    if (inFlight != null) {
      Operation cancelled = inFlight.cancel(clock.instant());
      persist(cancelled);
      metrics.incrementOperationCancelled();
      activityLog.log(LogLevel.INFO, LogCategory.OPERATION,
          "Cancelled " + cancelled.type().wireName() + " operation", cancelled.id());
    }
    activityLog.log(LogLevel.INFO, LogCategory.SYSTEM, "Autonomous mode stopped",
        null, Map.of("droppedQueued", Integer.toString(dropped)));
    publishQuietly(OperationEvents.lifecycle(OperationEvents.STOPPED, schedulerId, clock.instant()));
  }

  /**
   * Executes one scheduler cycle. Called by the tick, but may be invoked directly for
   * testing. Never throws.
   */
  public TickOutcome runOnce() {
    if (!tickLock.tryLock()) {
      return skipped(TickOutcome.BUSY);
    }
    try {
      return cycle();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Scheduler cycle failed", e);
      activityLog.log(LogLevel.ERROR, LogCategory.SYSTEM, "Error in operation cycle",
          null, Map.of("error", describe(e)));
      releaseStranded(e);
      return skipped(TickOutcome.ERROR);
    } finally {
      tickLock.unlock();
    }
  }

  public SchedulerStatus getStatus() {
    long total = totalOperations.get();
    double successRate = total == 0 ? 0 : savedOperations.get() * 100.0 / total;
    return new SchedulerStatus(
        running,
        config.enabled(),
        current.get(),
        queue.size(),
        quota.count(),
        total,
        successRate,
        lastOperationTime,
        healthProbe.lastHealth());
  }

  public AutonomousConfig getConfiguration() {
    return config;
  }

  /**
   * Validates and persists a new configuration version, then applies it: disabling stops
   * the scheduler, an interval change reschedules the tick. {@code ConfigurationUpdated}
   * is published once the new version is in effect.
   *
   * @throws autopilot.ValidationException if the patched configuration is invalid
   */
  public synchronized AutonomousConfig updateConfiguration(AutonomousConfigPatch patch) {
    Objects.requireNonNull(patch, "patch");
    requireUsable();
    AutonomousConfig previous = config;
    AutonomousConfig next = previous.apply(patch);
    units.inTransaction(uow -> {
      configStore.append(uow.connection(), next);
      return null;
    });
    config = next;
    activityLog.log(LogLevel.INFO, LogCategory.SYSTEM,
        "Configuration updated to version " + next.version());
    publishQuietly(DomainEvent.builder(OperationEvents.CONFIGURATION_UPDATED)
        .aggregate(OperationEvents.CONFIG_AGGREGATE, schedulerId)
        .payload("version", Integer.toString(next.version()))
        .payload("enabled", Boolean.toString(next.enabled()))
        .timestamp(clock.instant())
        .build());

    if (running && !next.enabled()) {
      stop();
    } else if (running && next.intervalMinutes() != previous.intervalMinutes()) {
      scheduleTick(next.intervalMinutes());
    }
    return next;
  }

  /**
   * Queues an operation ahead of synthesized ones. Queued operations run in FIFO order.
   *
   * @param projectId owning project, may be {@code null}
   * @return the new operation's id
   */
  public String queueOperation(ContentType type, String projectId) {
    Objects.requireNonNull(type, "type");
    if (closed) {
      throw new IllegalStateException("Scheduler has been closed");
    }
    Operation operation = Operation.pending(type, projectId);
    queue.addLast(operation);
    activityLog.log(LogLevel.INFO, LogCategory.OPERATION, "Queued " + type.wireName() + " operation",
        operation.id());
    DomainEvent.Builder event = DomainEvent.builder(OperationEvents.OPERATION_QUEUED)
        .aggregate(OperationEvents.OPERATION_AGGREGATE, operation.id())
        .payload("type", type.wireName())
        .timestamp(clock.instant());
    if (projectId != null) {
      event.payload("projectId", projectId);
    }
    publishQuietly(event.build());
    return operation.id();
  }

  public List<LogEntry> getLogs(LogFilter filter) {
    return activityLog.query(filter);
  }

  /**
   * Returns persisted operations, most recently started first. Pending writes are
   * flushed first.
   */
  public List<Operation> recentOperations(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    operationWriter.flush();
    try (ConnectionLease lease = pool.acquire()) {
      return operationStore.findRecent(lease.connection(), limit);
    }
  }

  public boolean isRunning() {
    return running;
  }

  /**
   * Stops the scheduler and its threads. Components passed to the builder are not closed.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    stop();
    closed = true;
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  private TickOutcome cycle() {
    if (!running) {
      return TickOutcome.STOPPED;
    }
    AutonomousConfig cfg = config;
    LocalTime now = LocalTime.ofInstant(clock.instant(), zone);
    if (!cfg.isWithinTimeSlot(now)) {
      return skipped(TickOutcome.OUTSIDE_TIME_SLOT);
    }

    SystemHealth health = healthProbe.lastHealth();
    if (!health.healthy()) {
      activityLog.log(LogLevel.WARN, LogCategory.RESOURCE, "System health check failed, skipping operation",
          null, Map.of(
              "cpuUsage", Long.toString(Math.round(health.cpuUsage())),
              "memoryUsageMb", Long.toString(Math.round(health.memoryUsageMb()))));
      return skipped(TickOutcome.UNHEALTHY);
    }

    if (!quota.hasCapacity(cfg.maxDailyOperations())) {
      activityLog.log(LogLevel.INFO, LogCategory.SYSTEM, "Daily operation limit reached");
      return skipped(TickOutcome.DAILY_LIMIT);
    }

    if (!apiBudget.hasCapacity(cfg.resourceLimits().maxApiCallsPerHour())) {
      activityLog.log(LogLevel.INFO, LogCategory.RESOURCE, "Hourly API call limit reached");
      return skipped(TickOutcome.API_LIMIT);
    }

    if (current.get() != null) {
      return skipped(TickOutcome.BUSY);
    }

    Operation next = queue.pollFirst();
    boolean fromQueue = next != null;
    if (next == null) {
      List<ContentType> types = cfg.contentTypes();
      if (types.isEmpty()) {
        return skipped(TickOutcome.NOTHING_TO_DO);
      }
      next = Operation.pending(types.get(random.nextInt(types.size())), null);
      activityLog.log(LogLevel.INFO, LogCategory.OPERATION,
          "Generated new " + next.type().wireName() + " operation", next.id());
    }

    Operation started = next.start(clock.instant());
    if (!current.compareAndSet(null, started)) {
      if (fromQueue) {
        queue.addFirst(next);
      }
      return skipped(TickOutcome.BUSY);
    }
    if (!running) {
      current.compareAndSet(started, null);
      return TickOutcome.STOPPED;
    }
    return execute(started, cfg);
  }

  private TickOutcome execute(Operation operation, AutonomousConfig cfg) {
    long startedAt = clock.millis();
    OperationMetrics usage = OperationMetrics.EMPTY;
    AtomicBoolean claimed = new AtomicBoolean();
    try {
      ResourceSnapshot before = healthProbe.currentSnapshot();
      activityLog.log(LogLevel.INFO, LogCategory.OPERATION,
          "Starting " + operation.type().wireName() + " operation", operation.id());
      GenerationOutcome generated = generator.generate(operation, cfg.resourceLimits());
      apiBudget.record(generated.apiCalls());
      checkStillCurrent(operation);

      ResourceSnapshot after = healthProbe.currentSnapshot();
      usage = new OperationMetrics(
          Math.max(0, clock.millis() - startedAt),
          generated.tokensUsed(),
          generated.apiCalls(),
          Math.max(0, after.cpuUsage() - before.cpuUsage()),
          Math.max(0, after.memoryUsageMb() - before.memoryUsageMb()));

      GeneratedContent content = generated.content();
      QualityAssessment assessment = qualityGate.assess(content, operation.type());
      checkStillCurrent(operation);

      boolean save = assessment.passes(cfg.qualityThreshold());
      String contentId = save ? saveContent(operation, content, assessment, claimed) : null;
      Map<String, String> details = Map.of(
          "qualityScore", Integer.toString(assessment.overallScore()),
          "threshold", Integer.toString(cfg.qualityThreshold()),
          "recommendation", assessment.recommendation().code());
      if (save) {
        activityLog.log(LogLevel.INFO, LogCategory.QUALITY,
            "High quality " + operation.type().wireName() + " saved", operation.id(), details);
      } else {
        activityLog.log(LogLevel.INFO, LogCategory.QUALITY,
            operation.type().wireName() + " discarded due to low quality", operation.id(), details);
      }

      OperationResult result = new OperationResult(contentId, content.title(), assessment.overallScore(),
          assessment.recommendation(), save);
      return finish(operation, operation.complete(clock.instant(), usage, result), claimed.get());
    } catch (OperationAbandonedException e) {
      activityLog.log(LogLevel.INFO, LogCategory.OPERATION,
          "Operation abandoned after cancellation", operation.id());
      return TickOutcome.STOPPED;
    } catch (Exception e) {
      logger.log(Level.WARNING, "Operation " + operation.id() + " failed", e);
      OperationMetrics failedUsage = usage == OperationMetrics.EMPTY
          ? new OperationMetrics(Math.max(0, clock.millis() - startedAt), 0, 0, 0, 0)
          : usage;
      return finish(operation, operation.fail(clock.instant(), failedUsage, describe(e)), claimed.get());
    }
  }

  /**
   * Saves the content and takes the operation out of {@code current} in the same
   * transaction, so a concurrent {@link #stop()} either rolls the save back or finds
   * nothing left to cancel. A retried attempt keeps the claim made by the first one.
   */
  private String saveContent(Operation operation, GeneratedContent content, QualityAssessment assessment,
      AtomicBoolean claimed) {
    SavedContent saved = new SavedContent(
        Ids.next(),
        operation.id(),
        operation.projectId(),
        operation.type(),
        content.title(),
        content.body(),
        content.attributes(),
        assessment.overallScore(),
        assessment.recommendation(),
        clock.instant());
    units.inTransaction(uow -> {
      uow.repository(contentStore, contentEvents).save(saved);
      if (!claimed.get()) {
        if (!current.compareAndSet(operation, null)) {
          throw new OperationAbandonedException();
        }
        claimed.set(true);
      }
      return null;
    });
    metrics.incrementContentSaved();
    return saved.id();
  }

  private TickOutcome finish(Operation running, Operation terminal, boolean claimed) {
    if (!claimed && !current.compareAndSet(running, null)) {
      activityLog.log(LogLevel.INFO, LogCategory.OPERATION,
          "Operation abandoned after cancellation", running.id());
      return TickOutcome.STOPPED;
    }
    quota.record();
    totalOperations.incrementAndGet();
    lastOperationTime = terminal.endTime();
    if (terminal.status() == OperationStatus.COMPLETED) {
      if (terminal.result().saved()) {
        savedOperations.incrementAndGet();
      }
      metrics.incrementOperationCompleted();
      activityLog.log(LogLevel.INFO, LogCategory.OPERATION,
          "Completed " + terminal.type().wireName() + " operation", terminal.id());
    } else {
      metrics.incrementOperationFailed();
      activityLog.log(LogLevel.ERROR, LogCategory.OPERATION,
          "Operation failed: " + terminal.error(), terminal.id());
    }
    persist(terminal);
    return TickOutcome.EXECUTED;
  }

  /** Fails whatever operation a crashed cycle left in {@code current}. */
  private void releaseStranded(RuntimeException cause) {
    Operation stranded = current.getAndSet(null);
    if (stranded == null) {
      return;
    }
    try {
      finish(stranded, stranded.fail(clock.instant(), OperationMetrics.EMPTY, describe(cause)), true);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to release operation " + stranded.id(), e);
    }
  }

  private void persist(Operation operation) {
    try {
      operations.save(operation).whenComplete((result, error) -> {
        if (error != null) {
          logger.log(Level.SEVERE, "Failed to persist operation " + operation.id()
              + " in status " + operation.status(), error);
        }
      });
    } catch (IllegalStateException e) {
      logger.log(Level.SEVERE, "Operation writer closed; operation " + operation.id() + " not persisted", e);
    }
  }

  private void checkStillCurrent(Operation operation) {
    if (current.get() != operation) {
      throw new OperationAbandonedException();
    }
  }

  private TickOutcome skipped(TickOutcome outcome) {
    metrics.incrementTickSkipped(outcome.code());
    return outcome;
  }

  private Optional<DomainEvent> contentSaved(SavedContent content, WriteResult result) {
    DomainEvent.Builder event = DomainEvent.builder(OperationEvents.CONTENT_SAVED)
        .aggregate(CONTENT_AGGREGATE, content.id())
        .causationId(content.operationId())
        .payload("operationId", content.operationId())
        .payload("type", content.type().wireName())
        .payload("qualityScore", Integer.toString(content.qualityScore()))
        .timestamp(content.createdAt());
    if (content.projectId() != null) {
      event.payload("projectId", content.projectId());
    }
    return Optional.of(event.build());
  }

  private void publishQuietly(DomainEvent event) {
    try {
      eventBus.publish(event);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Failed to publish " + event, e);
    }
  }

  private void scheduleTick(int intervalMinutes) {
    if (tickTask != null) {
      tickTask.cancel(false);
    }
    long intervalMs = TimeUnit.MINUTES.toMillis(intervalMinutes);
    tickTask = executor.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  private void scheduleDailyReset() {
    long delayMs = Math.max(1, quota.untilNextReset().toMillis());
    resetTask = executor.schedule(() -> {
      quota.reset();
      activityLog.log(LogLevel.INFO, LogCategory.SYSTEM, "Daily operation counter reset");
      synchronized (this) {
        if (running) {
          scheduleDailyReset();
        }
      }
    }, delayMs, TimeUnit.MILLISECONDS);
  }

  private void cancelTasks() {
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (resetTask != null) {
      resetTask.cancel(false);
      resetTask = null;
    }
  }

  private void requireUsable() {
    if (closed) {
      throw new IllegalStateException("Scheduler has been closed");
    }
    if (!initialized) {
      throw new IllegalStateException("Scheduler has not been initialized");
    }
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  /**
   * Thrown inside a tick when {@link #stop()} has taken its operation.
   */
  private static final class OperationAbandonedException extends RuntimeException {
    private OperationAbandonedException() {
      super("operation is no longer current", null, false, false);
    }
  }

  /**
   * Builder for {@link AutonomousScheduler}.
   */
  public static final class Builder {
    private ConfigStore configStore;
    private OperationStore operationStore;
    private BatchWriteCoordinator<Operation> operationWriter;
    private ContentStore contentStore;
    private UnitOfWorkFactory unitOfWorkFactory;
    private ConnectionPool pool;
    private ContentGenerator generator;
    private QualityGate qualityGate;
    private ResourceHealthProbe healthProbe;
    private ActivityLogger activityLogger;
    private EventBus eventBus;
    private MetricsExporter metrics;
    private Clock clock;
    private ZoneId zone;
    private Random random;
    private String schedulerId;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder configStore(ConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    /**
     * Store read by {@link #recentOperations}.
     *
     * <p><b>Required.</b>
     */
    public Builder operationStore(OperationStore operationStore) {
      this.operationStore = operationStore;
      return this;
    }

    /**
     * Writer persisting operation records. Its event factory should be
     * {@link OperationEvents#terminalStatus()}.
     *
     * <p><b>Required.</b>
     */
    public Builder operationWriter(BatchWriteCoordinator<Operation> operationWriter) {
      this.operationWriter = operationWriter;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder contentStore(ContentStore contentStore) {
      this.contentStore = contentStore;
      return this;
    }

    /**
     * Units used to save content and configuration versions.
     *
     * <p><b>Required.</b>
     */
    public Builder unitOfWorkFactory(UnitOfWorkFactory unitOfWorkFactory) {
      this.unitOfWorkFactory = unitOfWorkFactory;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder pool(ConnectionPool pool) {
      this.pool = pool;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder generator(ContentGenerator generator) {
      this.generator = generator;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder qualityGate(QualityGate qualityGate) {
      this.qualityGate = qualityGate;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder healthProbe(ResourceHealthProbe healthProbe) {
      this.healthProbe = healthProbe;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder activityLogger(ActivityLogger activityLogger) {
      this.activityLogger = activityLogger;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder eventBus(EventBus eventBus) {
      this.eventBus = eventBus;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to the system UTC clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Zone in which time slots are evaluated.
     *
     * <p>Optional. Defaults to the clock's zone.
     */
    public Builder zone(ZoneId zone) {
      this.zone = zone;
      return this;
    }

    /**
     * Source of synthesized content types.
     *
     * <p>Optional. Defaults to a new {@link Random}.
     */
    public Builder random(Random random) {
      this.random = random;
      return this;
    }

    /**
     * Aggregate id of lifecycle and configuration events.
     *
     * <p>Optional. Defaults to a new ULID.
     */
    public Builder schedulerId(String schedulerId) {
      this.schedulerId = schedulerId;
      return this;
    }

    public AutonomousScheduler build() {
      return new AutonomousScheduler(this);
    }
  }
}
