package relay.monitor;

import relay.dispatch.DispatchQueue;
import relay.ratelimit.RateLimiter;
import relay.spi.MetricsExporter;
import relay.target.TargetRegistry;
import relay.target.TargetState;
import relay.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled rate and health monitor.
 *
 * <p>Each cycle, for every target: lowers the consecutive failure count by one if the
 * target is not cooling down, closes its circuit once the circuit timeout has passed,
 * retunes its rate limits while adaptive mode is on, and exports its queue depth. It then exports the pending gauge and logs throughput and
 * success rate since the previous cycle.
 */
public final class HealthMonitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(HealthMonitor.class.getName());

  private final TargetRegistry registry;
  private final DispatchQueue queue;
  private final RateLimiter rateLimiter;
  private final BooleanSupplier adaptive;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final long intervalMs;

  private long lastRunMillis;
  private long lastProcessed;
  private long lastFailed;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  public HealthMonitor(DispatchQueue queue, RateLimiter rateLimiter, BooleanSupplier adaptive,
      MetricsExporter metrics, Clock clock, Duration interval) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.registry = queue.registry();
    this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    this.adaptive = Objects.requireNonNull(adaptive, "adaptive");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(interval, "interval");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.intervalMs = interval.toMillis();
    this.lastRunMillis = clock.millis();
  }

  /**
   * Starts the scheduled monitoring loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("HealthMonitor has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("relay-monitor-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single monitoring cycle.
   *
   * <p>May be invoked directly for testing.
   */
  public synchronized void runOnce() {
    if (closed) {
      return;
    }
    try {
      long now = clock.millis();
      boolean tune = adaptive.getAsBoolean();
      for (TargetState target : registry.all()) {
        if (target.decayFailures(now)) {
          logger.log(Level.FINE, "Target {0} failure streak decayed to {1}",
              new Object[]{target.id(), target.consecutiveFailures()});
        }
        queue.circuitBreaker().closeIfExpired(target, now);
        if (tune) {
          rateLimiter.adapt(target, now);
        }
        metrics.recordQueueDepth(target.id(), target.queueSize());
      }
      metrics.recordPending(queue.pending());
      logPerformance(now);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Monitor cycle failed", t);
    }
  }

  private void logPerformance(long now) {
    long processed = queue.processedCount();
    long failed = queue.failedCount();
    long deltaProcessed = processed - lastProcessed;
    long deltaFailed = failed - lastFailed;
    double seconds = Math.max(1L, now - lastRunMillis) / 1000.0;
    lastProcessed = processed;
    lastFailed = failed;
    lastRunMillis = now;
    if (deltaProcessed == 0 && deltaFailed == 0) {
      return;
    }
    double throughput = deltaProcessed / seconds;
    double successPercent = 100.0 * deltaProcessed / (deltaProcessed + deltaFailed);
    logger.log(Level.INFO, String.format(
        "Relay performance: %.2f msg/s, %.1f%% success, %d pending",
        throughput, successPercent, queue.pending()));
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
