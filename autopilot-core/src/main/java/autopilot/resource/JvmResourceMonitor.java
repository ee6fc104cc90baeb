package autopilot.resource;

import autopilot.config.ResourceLimits;
import autopilot.spi.ResourceHealthProbe;
import autopilot.spi.ResourceSnapshot;
import autopilot.spi.SystemHealth;
import autopilot.util.DaemonThreadFactory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ResourceHealthProbe} backed by the JVM's management beans.
 *
 * <p>Samples process CPU load and heap usage on a daemon thread and keeps the latest
 * {@code historySize} samples. The host is unhealthy while CPU usage exceeds
 * {@link ResourceLimits#maxCpuUsage()} or heap usage exceeds
 * {@link ResourceLimits#maxMemoryUsageMb()}. Limits may be replaced at runtime with
 * {@link #updateLimits}.
 */
public final class JvmResourceMonitor implements ResourceHealthProbe, AutoCloseable {
  private static final Logger logger = Logger.getLogger(JvmResourceMonitor.class.getName());
  private static final double BYTES_PER_MB = 1024.0 * 1024.0;

  private final DoubleSupplier cpuUsage;
  private final DoubleSupplier memoryUsageMb;
  private final Duration sampleInterval;
  private final int historySize;
  private final Clock clock;
  private final Deque<ResourceSnapshot> history = new ArrayDeque<>();
  private final Object lock = new Object();

  private volatile ResourceLimits limits;
  private volatile SystemHealth lastHealth = SystemHealth.unknown();
  private ScheduledExecutorService sampler;
  private volatile boolean closed;

  private JvmResourceMonitor(Builder builder) {
    this.limits = Objects.requireNonNull(builder.limits, "limits");
    Objects.requireNonNull(builder.sampleInterval, "sampleInterval");
    if (builder.sampleInterval.isZero() || builder.sampleInterval.isNegative()) {
      throw new IllegalArgumentException("sampleInterval must be > 0");
    }
    if (builder.historySize <= 0) {
      throw new IllegalArgumentException("historySize must be > 0");
    }
    this.sampleInterval = builder.sampleInterval;
    this.historySize = builder.historySize;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.cpuUsage = builder.cpuUsage != null ? builder.cpuUsage : JvmResourceMonitor::processCpuPercent;
    this.memoryUsageMb = builder.memoryUsageMb != null ? builder.memoryUsageMb : JvmResourceMonitor::heapUsedMb;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts periodic sampling. Takes one sample immediately.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Monitor has been closed");
    }
    if (sampler != null) {
      return;
    }
    sampler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("autopilot-resource-monitor-"));
    long intervalMs = sampleInterval.toMillis();
    sampler.scheduleWithFixedDelay(this::sampleSafely, 0, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Takes one sample and re-evaluates health. Called periodically once started; may be
   * invoked directly for testing.
   */
  public SystemHealth sample() {
    ResourceSnapshot snapshot = currentSnapshot();
    ResourceLimits current = limits;
    boolean healthy = snapshot.cpuUsage() <= current.maxCpuUsage()
        && snapshot.memoryUsageMb() <= current.maxMemoryUsageMb();
    SystemHealth health = new SystemHealth(snapshot.cpuUsage(), snapshot.memoryUsageMb(), healthy,
        snapshot.timestamp());
    synchronized (lock) {
      history.addLast(snapshot);
      while (history.size() > historySize) {
        history.removeFirst();
      }
    }
    if (lastHealth.healthy() && !healthy) {
      logger.log(Level.WARNING, "System unhealthy: cpu {0}%, heap {1} MB",
          new Object[]{Math.round(snapshot.cpuUsage()), Math.round(snapshot.memoryUsageMb())});
    } else if (!lastHealth.healthy() && healthy) {
      logger.log(Level.INFO, "System healthy again");
    }
    lastHealth = health;
    return health;
  }

  @Override
  public SystemHealth lastHealth() {
    return lastHealth;
  }

  @Override
  public ResourceSnapshot currentSnapshot() {
    double cpu = Math.max(0, cpuUsage.getAsDouble());
    double memory = Math.max(0, memoryUsageMb.getAsDouble());
    return new ResourceSnapshot(cpu, memory, clock.instant());
  }

  /**
   * Recent samples, oldest first.
   */
  public List<ResourceSnapshot> history() {
    synchronized (lock) {
      return new ArrayList<>(history);
    }
  }

  public void updateLimits(ResourceLimits limits) {
    this.limits = Objects.requireNonNull(limits, "limits");
  }

  public ResourceLimits limits() {
    return limits;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (sampler != null) {
      sampler.shutdownNow();
    }
  }

  private void sampleSafely() {
    try {
      sample();
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Resource sampling failed", e);
    }
  }

  private static double processCpuPercent() {
    OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    if (os instanceof com.sun.management.OperatingSystemMXBean platform) {
      double load = platform.getProcessCpuLoad();
      if (load >= 0) {
        return load * 100.0;
      }
    }
    double loadAverage = os.getSystemLoadAverage();
    if (loadAverage < 0) {
      return 0;
    }
    return Math.min(100.0, loadAverage / os.getAvailableProcessors() * 100.0);
  }

  private static double heapUsedMb() {
    MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
    return memory.getHeapMemoryUsage().getUsed() / BYTES_PER_MB;
  }

  /**
   * Builder for {@link JvmResourceMonitor}.
   */
  public static final class Builder {
    private ResourceLimits limits = ResourceLimits.DEFAULT;
    private Duration sampleInterval = Duration.ofSeconds(5);
    private int historySize = 100;
    private Clock clock;
    private DoubleSupplier cpuUsage;
    private DoubleSupplier memoryUsageMb;

    private Builder() {
    }

    /**
     * Optional. Defaults to {@link ResourceLimits#DEFAULT}.
     */
    public Builder limits(ResourceLimits limits) {
      this.limits = limits;
      return this;
    }

    /**
     * Optional. Defaults to 5 seconds.
     */
    public Builder sampleInterval(Duration sampleInterval) {
      this.sampleInterval = sampleInterval;
      return this;
    }

    /**
     * Samples kept in {@link #history()}.
     *
     * <p>Optional. Defaults to 100.
     */
    public Builder historySize(int historySize) {
      this.historySize = historySize;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * CPU usage source, as a percentage.
     *
     * <p>Optional. Defaults to the process CPU load reported by the platform MXBean.
     */
    public Builder cpuUsage(DoubleSupplier cpuUsage) {
      this.cpuUsage = cpuUsage;
      return this;
    }

    /**
     * Memory usage source, in megabytes.
     *
     * <p>Optional. Defaults to used heap.
     */
    public Builder memoryUsageMb(DoubleSupplier memoryUsageMb) {
      this.memoryUsageMb = memoryUsageMb;
      return this;
    }

    public JvmResourceMonitor build() {
      return new JvmResourceMonitor(this);
    }
  }
}
