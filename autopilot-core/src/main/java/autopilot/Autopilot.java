package autopilot;

import autopilot.batch.BatchWriteCoordinator;
import autopilot.event.EventBus;
import autopilot.event.EventLog;
import autopilot.event.EventLogMiddleware;
import autopilot.generation.ContentGenerator;
import autopilot.log.ActivityLogger;
import autopilot.model.LogEntry;
import autopilot.model.Operation;
import autopilot.pool.ConnectionFactory;
import autopilot.pool.ConnectionPool;
import autopilot.quality.QualityGate;
import autopilot.resource.JvmResourceMonitor;
import autopilot.retry.CircuitBreaker;
import autopilot.retry.CircuitBreakerListener;
import autopilot.retry.CircuitState;
import autopilot.scheduler.AutonomousScheduler;
import autopilot.scheduler.OperationEvents;
import autopilot.spi.ActivityLogStore;
import autopilot.spi.ConfigStore;
import autopilot.spi.ContentStore;
import autopilot.spi.EventLogStore;
import autopilot.spi.GenerationClient;
import autopilot.spi.MetricsExporter;
import autopilot.spi.OperationStore;
import autopilot.spi.ResourceHealthProbe;
import autopilot.tx.ThreadLocalTxContext;
import autopilot.tx.UnitOfWork;
import autopilot.tx.UnitOfWorkFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the connection pool, transactions, event bus,
 * batch writers, quality gate, generator, activity log and scheduler into one context
 * object, and shuts them down in reverse order.
 *
 * <pre>{@code
 * try (Autopilot autopilot = Autopilot.builder()
 *     .connectionFactory(new DataSourceConnectionFactory(dataSource))
 *     .operationStore(new JdbcOperationStore())
 *     .contentStore(new JdbcContentStore())
 *     .configStore(new JdbcConfigStore())
 *     .activityLogStore(new JdbcActivityLogStore())
 *     .eventLogStore(new JdbcEventLogStore())
 *     .generationClient(client)
 *     .build()) {
 *   autopilot.initialize();
 *   autopilot.scheduler().start();
 * }
 * }</pre>
 */
public final class Autopilot implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Autopilot.class.getName());

  private final ConnectionPool pool;
  private final ThreadLocalTxContext txContext;
  private final EventBus eventBus;
  private final EventLog eventLog;
  private final UnitOfWorkFactory units;
  private final BatchWriteCoordinator<LogEntry> logWriter;
  private final BatchWriteCoordinator<Operation> operationWriter;
  private final ActivityLogger activityLogger;
  private final QualityGate qualityGate;
  private final JvmResourceMonitor ownedMonitor;
  private final AutonomousScheduler scheduler;
  private final MetricsExporter metrics;
  private final Duration logRetention;

  private Autopilot(ConnectionPool pool, ThreadLocalTxContext txContext, EventBus eventBus, EventLog eventLog,
      UnitOfWorkFactory units, BatchWriteCoordinator<LogEntry> logWriter,
      BatchWriteCoordinator<Operation> operationWriter, ActivityLogger activityLogger, QualityGate qualityGate,
      JvmResourceMonitor ownedMonitor, AutonomousScheduler scheduler, MetricsExporter metrics,
      Duration logRetention) {
    this.pool = pool;
    this.txContext = txContext;
    this.eventBus = eventBus;
    this.eventLog = eventLog;
    this.units = units;
    this.logWriter = logWriter;
    this.operationWriter = operationWriter;
    this.activityLogger = activityLogger;
    this.qualityGate = qualityGate;
    this.ownedMonitor = ownedMonitor;
    this.scheduler = scheduler;
    this.metrics = metrics;
    this.logRetention = logRetention;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Initializes the scheduler from the persisted configuration and applies its resource
   * limits to the built-in monitor.
   */
  public void initialize() {
    scheduler.initialize();
    if (ownedMonitor != null) {
      ownedMonitor.updateLimits(scheduler.getConfiguration().resourceLimits());
    }
  }

  public AutonomousScheduler scheduler() {
    return scheduler;
  }

  public ConnectionPool pool() {
    return pool;
  }

  public EventBus eventBus() {
    return eventBus;
  }

  /**
   * Durable event log, or {@code null} when no {@link EventLogStore} was configured.
   */
  public EventLog eventLog() {
    return eventLog;
  }

  public ActivityLogger activityLogger() {
    return activityLogger;
  }

  public QualityGate qualityGate() {
    return qualityGate;
  }

  public ThreadLocalTxContext txContext() {
    return txContext;
  }

  public UnitOfWorkFactory unitOfWorkFactory() {
    return units;
  }

  /**
   * Creates a new, not yet begun, unit of work.
   */
  public UnitOfWork unitOfWork() {
    return units.create();
  }

  /**
   * Stops the scheduler, purges activity log entries past retention, drains the batch
   * writers, then closes the bus, the built-in monitor and the pool. Every component is
   * closed even if an earlier one fails; the first failure is rethrown with the rest
   * suppressed.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      activityLogger.purgeOlderThan(logRetention);
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Activity log purge failed during close", e);
    }
    first = closeQuietly(operationWriter, first);
    first = closeQuietly(logWriter, first);
    first = closeQuietly(eventBus, first);
    if (ownedMonitor != null) {
      first = closeQuietly(ownedMonitor, first);
    }
    first = closeQuietly(pool, first);
    if (metrics instanceof AutoCloseable closeable) {
      first = closeQuietly(closeable, first);
    }
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(AutoCloseable closeable, RuntimeException first) {
    try {
      closeable.close();
    } catch (Exception e) {
      RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      if (first == null) {
        return re;
      }
      first.addSuppressed(re);
    }
    return first;
  }

  /**
   * Builder for {@link Autopilot}.
   */
  public static final class Builder {
    private ConnectionFactory connectionFactory;
    private int minConnections = 2;
    private int maxConnections = 10;
    private Duration acquireTimeout = Duration.ofSeconds(30);
    private OperationStore operationStore;
    private ContentStore contentStore;
    private ConfigStore configStore;
    private ActivityLogStore activityLogStore;
    private EventLogStore eventLogStore;
    private GenerationClient generationClient;
    private GenerationClient assessmentClient;
    private ResourceHealthProbe healthProbe;
    private MetricsExporter metrics = MetricsExporter.NOOP;
    private Clock clock = Clock.systemUTC();
    private ZoneId zone;
    private Random random;
    private int batchSize = 100;
    private Duration operationFlushInterval = Duration.ofSeconds(1);
    private Duration logFlushInterval = Duration.ofSeconds(10);
    private Duration logRetention = Duration.ofDays(30);
    private int breakerFailureThreshold = 5;
    private Duration breakerResetTimeout = Duration.ofMinutes(1);
    private boolean built;

    private Builder() {
    }

    /**
     * Source of physical connections for the pool.
     *
     * <p><b>Required.</b>
     */
    public Builder connectionFactory(ConnectionFactory connectionFactory) {
      this.connectionFactory = connectionFactory;
      return this;
    }

    /**
     * Optional. Defaults to 2 and 10.
     */
    public Builder poolSize(int minConnections, int maxConnections) {
      this.minConnections = minConnections;
      this.maxConnections = maxConnections;
      return this;
    }

    /**
     * Optional. Defaults to 30 seconds.
     */
    public Builder acquireTimeout(Duration acquireTimeout) {
      this.acquireTimeout = acquireTimeout;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder operationStore(OperationStore operationStore) {
      this.operationStore = operationStore;
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
     * <p><b>Required.</b>
     */
    public Builder configStore(ConfigStore configStore) {
      this.configStore = configStore;
      return this;
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder activityLogStore(ActivityLogStore activityLogStore) {
      this.activityLogStore = activityLogStore;
      return this;
    }

    /**
     * Durable event log. When set, every published event is appended to it.
     *
     * <p>Optional.
     */
    public Builder eventLogStore(EventLogStore eventLogStore) {
      this.eventLogStore = eventLogStore;
      return this;
    }

    /**
     * Client producing content.
     *
     * <p><b>Required.</b>
     */
    public Builder generationClient(GenerationClient generationClient) {
      this.generationClient = generationClient;
      return this;
    }

    /**
     * Client scoring content.
     *
     * <p>Optional. Defaults to the generation client.
     */
    public Builder assessmentClient(GenerationClient assessmentClient) {
      this.assessmentClient = assessmentClient;
      return this;
    }

    /**
     * Optional. Defaults to a started {@link JvmResourceMonitor} owned by the composite.
     */
    public Builder healthProbe(ResourceHealthProbe healthProbe) {
      this.healthProbe = healthProbe;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}. Closed with the composite when
     * it implements {@link AutoCloseable}.
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

    public Builder random(Random random) {
      this.random = random;
      return this;
    }

    /**
     * Chunk size of the operation and activity log writers.
     *
     * <p>Optional. Defaults to 100.
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to 1 second for operations and 10 seconds for activity log entries.
     */
    public Builder flushIntervals(Duration operations, Duration activityLog) {
      this.operationFlushInterval = operations;
      this.logFlushInterval = activityLog;
      return this;
    }

    /**
     * Age past which activity log entries are purged on close.
     *
     * <p>Optional. Defaults to 30 days.
     */
    public Builder logRetention(Duration logRetention) {
      this.logRetention = logRetention;
      return this;
    }

    /**
     * Settings shared by the generation and assessment circuit breakers.
     *
     * <p>Optional. Defaults to 5 failures and 1 minute.
     */
    public Builder circuitBreaker(int failureThreshold, Duration resetTimeout) {
      this.breakerFailureThreshold = failureThreshold;
      this.breakerResetTimeout = resetTimeout;
      return this;
    }

    /**
     * Builds the composite. Components created before a failure are closed before the
     * failure is rethrown.
     *
     * @throws IllegalStateException if this builder was already used
     */
    public Autopilot build() {
      if (built) {
        throw new IllegalStateException("Builder already used");
      }
      built = true;
      Objects.requireNonNull(connectionFactory, "connectionFactory");
      Objects.requireNonNull(operationStore, "operationStore");
      Objects.requireNonNull(contentStore, "contentStore");
      Objects.requireNonNull(configStore, "configStore");
      Objects.requireNonNull(activityLogStore, "activityLogStore");
      Objects.requireNonNull(generationClient, "generationClient");
      Objects.requireNonNull(metrics, "metrics");
      Objects.requireNonNull(clock, "clock");
      Objects.requireNonNull(logRetention, "logRetention");

      Deque<AutoCloseable> created = new ArrayDeque<>();
      try {
        ConnectionPool pool = ConnectionPool.builder()
            .connectionFactory(connectionFactory)
            .minConnections(minConnections)
            .maxConnections(maxConnections)
            .acquireTimeout(acquireTimeout)
            .clock(clock)
            .build();
        created.push(pool);

        JvmResourceMonitor ownedMonitor = null;
        ResourceHealthProbe probe = healthProbe;
        if (probe == null) {
          ownedMonitor = JvmResourceMonitor.builder().clock(clock).build();
          created.push(ownedMonitor);
          ownedMonitor.start();
          probe = ownedMonitor;
        }

        ThreadLocalTxContext txContext = new ThreadLocalTxContext();
        EventBus eventBus = EventBus.builder().build();
        created.push(eventBus);
        EventLog eventLog = null;
        if (eventLogStore != null) {
          eventBus.use(new EventLogMiddleware(eventLogStore, txContext, pool));
          eventLog = new EventLog(eventLogStore, pool);
        }
        UnitOfWorkFactory units = new UnitOfWorkFactory(pool, txContext, eventBus);

        BatchWriteCoordinator<LogEntry> logWriter = BatchWriteCoordinator.<LogEntry>builder()
            .pool(pool)
            .store(activityLogStore)
            .txContext(txContext)
            .batchSize(batchSize)
            .flushInterval(logFlushInterval)
            .metrics(metrics)
            .clock(clock)
            .build();
        created.push(logWriter);
        ActivityLogger activityLogger = new ActivityLogger(activityLogStore, logWriter, pool, clock);

        BatchWriteCoordinator<Operation> operationWriter = BatchWriteCoordinator.<Operation>builder()
            .pool(pool)
            .store(operationStore)
            .txContext(txContext)
            .eventBus(eventBus)
            .eventFactory(OperationEvents.terminalStatus())
            .batchSize(batchSize)
            .flushInterval(operationFlushInterval)
            .metrics(metrics)
            .clock(clock)
            .build();
        created.push(operationWriter);

        CircuitBreakerListener breakerListener = (name, from, to) -> {
          if (to == CircuitState.OPEN) {
            metrics.incrementCircuitOpened(name);
          }
        };
        ContentGenerator.Builder generator = ContentGenerator.builder()
            .client(generationClient)
            .breaker(breaker("content-generation", breakerListener));
        if (random != null) {
          generator.random(random);
        }
        QualityGate qualityGate = QualityGate.builder()
            .client(assessmentClient != null ? assessmentClient : generationClient)
            .breaker(breaker("quality-assessment", breakerListener))
            .metrics(metrics)
            .build();

        AutonomousScheduler.Builder scheduler = AutonomousScheduler.builder()
            .configStore(configStore)
            .operationStore(operationStore)
            .operationWriter(operationWriter)
            .contentStore(contentStore)
            .unitOfWorkFactory(units)
            .pool(pool)
            .generator(generator.build())
            .qualityGate(qualityGate)
            .healthProbe(probe)
            .activityLogger(activityLogger)
            .eventBus(eventBus)
            .metrics(metrics)
            .clock(clock)
            .zone(zone);
        if (random != null) {
          scheduler.random(random);
        }
        AutonomousScheduler autonomousScheduler = scheduler.build();

        if (ownedMonitor != null) {
          JvmResourceMonitor monitor = ownedMonitor;
          eventBus.subscribe(OperationEvents.CONFIGURATION_UPDATED,
              event -> monitor.updateLimits(autonomousScheduler.getConfiguration().resourceLimits()));
        }
        return new Autopilot(pool, txContext, eventBus, eventLog, units, logWriter, operationWriter,
            activityLogger, qualityGate, ownedMonitor, autonomousScheduler, metrics, logRetention);
      } catch (RuntimeException e) {
        while (!created.isEmpty()) {
          try {
            created.pop().close();
          } catch (Exception suppressed) {
            e.addSuppressed(suppressed);
          }
        }
        throw e;
      }
    }

    private CircuitBreaker breaker(String name, CircuitBreakerListener listener) {
      return CircuitBreaker.builder(name)
          .failureThreshold(breakerFailureThreshold)
          .resetTimeout(breakerResetTimeout)
          .clock(clock)
          .listener(listener)
          .build();
    }
  }
}
