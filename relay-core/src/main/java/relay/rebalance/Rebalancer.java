package relay.rebalance;

import relay.model.Priority;
import relay.queue.QueuedItem;
import relay.spi.MetricsExporter;
import relay.target.TargetRegistry;
import relay.target.TargetSnapshot;
import relay.target.TargetState;
import relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that moves queued items from the most to the least loaded
 * healthy target.
 *
 * <p>Only targets that are not cooling down, have no open circuit and are below the
 * unhealthy failure streak take part. They are ranked by
 * {@code queueSize / max(0.1, successRate)}, then by average processing time. If the raw
 * queue sizes of the two ends differ by less than {@code minGap}, nothing moves;
 * otherwise {@code min(gap / 2, maxMoves)} items move, highest priority first, with both
 * targets locked in registration order.
 *
 * <p>Scheduled passes only run while adaptive mode is on; {@link #runOnce()} always does.
 */
public final class Rebalancer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Rebalancer.class.getName());

  private final TargetRegistry registry;
  private final BooleanSupplier enabled;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long intervalMs;
  private final int minGap;
  private final int maxMoves;
  private final int unhealthyThreshold;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private Rebalancer(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.enabled = builder.enabled != null ? builder.enabled : () -> true;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.interval == null || builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.minGap <= 0) {
      throw new IllegalArgumentException("minGap must be > 0");
    }
    if (builder.maxMoves <= 0) {
      throw new IllegalArgumentException("maxMoves must be > 0");
    }
    this.intervalMs = builder.interval.toMillis();
    this.minGap = builder.minGap;
    this.maxMoves = builder.maxMoves;
    this.unhealthyThreshold = builder.unhealthyThreshold;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled rebalancing loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Rebalancer has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-rebalance-"));
    task = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  private void tick() {
    if (closed || !enabled.getAsBoolean()) {
      return;
    }
    try {
      runOnce();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Rebalance cycle failed", t);
    }
  }

  /**
   * Executes a single rebalancing pass.
   *
   * @return number of items moved
   */
  public int runOnce() {
    long now = clock.millis();
    List<TargetSnapshot> eligible = new ArrayList<>();
    for (TargetSnapshot snapshot : registry.snapshots(now)) {
      if (!snapshot.rateLimited() && !snapshot.circuitOpen()
          && snapshot.consecutiveFailures() < unhealthyThreshold) {
        eligible.add(snapshot);
      }
    }
    if (eligible.size() < 2) {
      return 0;
    }
    eligible.sort(Comparator
        .comparingDouble((TargetSnapshot s) -> s.queueSize() / Math.max(0.1, s.successRate()))
        .thenComparingDouble(TargetSnapshot::avgProcessingTime));
    TargetSnapshot least = eligible.get(0);
    TargetSnapshot most = eligible.get(eligible.size() - 1);
    int gap = most.queueSize() - least.queueSize();
    if (gap < minGap) {
      return 0;
    }
    int moves = Math.min(gap / 2, maxMoves);
    int moved = move(registry.get(most.id()), registry.get(least.id()), moves, now);
    if (moved > 0) {
      metrics.incrementRebalanced(moved);
      logger.log(Level.INFO, "Rebalanced {0} items from {1} to {2}",
          new Object[]{moved, most.id(), least.id()});
    }
    return moved;
  }

  private static int move(TargetState source, TargetState destination, int limit, long now) {
    TargetState first = source.index() < destination.index() ? source : destination;
    TargetState second = first == source ? destination : source;
    first.lock().lock();
    try {
      second.lock().lock();
      try {
        int moved = 0;
        for (Priority priority : Priority.descending()) {
          QueuedItem item;
          while (moved < limit && (item = source.queues().poll(priority)) != null) {
            item.retimestamp(now);
            destination.queues().push(destination.id(), item);
            moved++;
          }
        }
        if (moved > 0) {
          destination.itemsAvailable().signalAll();
        }
        return moved;
      } finally {
        second.lock().unlock();
      }
    } finally {
      first.lock().unlock();
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link Rebalancer}. */
  public static final class Builder {
    private TargetRegistry registry;
    private BooleanSupplier enabled;
    private MetricsExporter metrics;
    private Clock clock;
    private Duration interval = Duration.ofSeconds(10);
    private int minGap = 10;
    private int maxMoves = 20;
    private int unhealthyThreshold = 3;

    private Builder() {}

    /**
     * Sets the targets to balance.
     *
     * <p><b>Required.</b>
     */
    public Builder registry(TargetRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets the switch consulted before each scheduled pass.
     *
     * <p>Optional. Defaults to always enabled.
     */
    public Builder enabled(BooleanSupplier enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10s}.
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the queue-size gap below which a pass does nothing.
     *
     * <p>Optional. Defaults to {@code 10}.
     */
    public Builder minGap(int minGap) {
      this.minGap = minGap;
      return this;
    }

    /**
     * Optional. Defaults to {@code 20}.
     */
    public Builder maxMoves(int maxMoves) {
      this.maxMoves = maxMoves;
      return this;
    }

    /**
     * Sets the failure streak at which a target stops taking part.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder unhealthyThreshold(int unhealthyThreshold) {
      this.unhealthyThreshold = unhealthyThreshold;
      return this;
    }

    public Rebalancer build() {
      return new Rebalancer(this);
    }
  }
}
