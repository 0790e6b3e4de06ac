package relay.reaper;

import relay.dispatch.DispatchQueue;
import relay.target.TargetRegistry;
import relay.target.TargetState;
import relay.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that evicts stale items: older than the retention window, or
 * out of retries.
 *
 * <p>Each cycle visits a single target, rotating through them in registration order,
 * so only one target lock is held per cycle.
 */
public final class QueueReaper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueReaper.class.getName());

  private final DispatchQueue queue;
  private final TargetRegistry registry;
  private final long retentionMs;
  private final long intervalMs;
  private int cursor;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  public QueueReaper(DispatchQueue queue, Duration retention, Duration interval) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.registry = queue.registry();
    Objects.requireNonNull(retention, "retention");
    Objects.requireNonNull(interval, "interval");
    if (retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.retentionMs = retention.toMillis();
    this.intervalMs = interval.toMillis();
  }

  /**
   * Starts the scheduled reaping loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueueReaper has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-reaper-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Reaps the next target in rotation.
   *
   * <p>May be invoked directly for testing.
   *
   * @return number of items evicted
   */
  public synchronized int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      TargetState target = registry.all().get(cursor);
      cursor = (cursor + 1) % registry.size();
      int evicted = queue.evictStale(target, retentionMs);
      if (evicted > 0) {
        logger.log(Level.INFO, "Evicted {0} stale items from {1}", new Object[]{evicted, target.id()});
      }
      return evicted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reaper cycle failed", t);
      return 0;
    }
  }

  /** Cancels the schedule and shuts down the scheduler thread. */
  @Override
  public void close() {
    ScheduledExecutorService toStop;
    synchronized (this) {
      closed = true;
      if (task != null) {
        task.cancel(false);
        task = null;
      }
      toStop = scheduler;
    }
    if (toStop != null) {
      toStop.shutdownNow();
      try {
        toStop.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
