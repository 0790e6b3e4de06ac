package relay.dispatch;

import relay.model.WorkerState;
import relay.queue.QueuedItem;
import relay.resilience.DeliveryOutcome;
import relay.resilience.ErrorKind;
import relay.resilience.ResilientSender;
import relay.spi.GuardedMetricsExporter;
import relay.spi.MetricsExporter;
import relay.target.TargetState;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The loop that drains one target: dequeue, deliver, acknowledge, requeue on failure.
 *
 * <p>The worker supervises itself. Every {@code healthCheckInterval} it logs its state
 * and, if nothing happened for {@code stuckThreshold}, soft-restarts. A run of
 * {@code errorThreshold} failed deliveries or loop errors also triggers a soft restart:
 * counters are reset and the loop pauses for {@code restartPause} before resuming.
 */
public final class TargetWorker implements Runnable {
  private static final Logger logger = Logger.getLogger(TargetWorker.class.getName());

  private static final long PAUSED_POLL_MS = 100;
  private static final long MAX_CRASH_BACKOFF_MS = 30_000;

  private final TargetState target;
  private final DispatchQueue queue;
  private final ResilientSender sender;
  private final List<DeliveryInterceptor> interceptors;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final BooleanSupplier paused;
  private final long dequeueTimeoutMs;
  private final long stuckThresholdMs;
  private final long healthCheckIntervalMs;
  private final int errorThreshold;
  private final long restartPauseMs;

  private volatile boolean running = true;
  private volatile WorkerState state = WorkerState.IDLE;
  private volatile long lastActivity;
  private volatile long lastHealthCheck;
  private volatile int consecutiveErrors;
  private volatile long processedSinceRestart;
  private volatile int restarts;

  TargetWorker(TargetState target, DispatchQueue queue, ResilientSender sender,
      List<DeliveryInterceptor> interceptors, MetricsExporter metrics, Clock clock,
      BooleanSupplier paused, Duration dequeueTimeout, Duration stuckThreshold,
      Duration healthCheckInterval, int errorThreshold, Duration restartPause) {
    this.target = Objects.requireNonNull(target, "target");
    this.queue = Objects.requireNonNull(queue, "queue");
    this.sender = Objects.requireNonNull(sender, "sender");
    this.interceptors = List.copyOf(interceptors);
    this.metrics = metrics != null ? GuardedMetricsExporter.guard(metrics) : MetricsExporter.NOOP;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.paused = Objects.requireNonNull(paused, "paused");
    this.dequeueTimeoutMs = dequeueTimeout.toMillis();
    this.stuckThresholdMs = stuckThreshold.toMillis();
    this.healthCheckIntervalMs = healthCheckInterval.toMillis();
    this.errorThreshold = errorThreshold;
    this.restartPauseMs = restartPause.toMillis();
    long now = clock.millis();
    this.lastActivity = now;
    this.lastHealthCheck = now;
  }

  @Override
  public void run() {
    logger.log(Level.INFO, "Worker for target {0} started", target.id());
    while (running && !Thread.currentThread().isInterrupted()) {
      try {
        checkHealth();
        if (paused.getAsBoolean()) {
          state = WorkerState.IDLE;
          lastActivity = clock.millis();
          TimeUnit.MILLISECONDS.sleep(PAUSED_POLL_MS);
          continue;
        }
        state = WorkerState.DEQUEUING;
        QueuedItem item = queue.dequeue(target, dequeueTimeoutMs);
        if (item == null) {
          long now = clock.millis();
          if (!target.isRateLimited(now)) {
            lastActivity = now;
          }
          state = WorkerState.IDLE;
          continue;
        }
        state = WorkerState.PROCESSING;
        process(item);
        state = WorkerState.IDLE;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        int errors = ++consecutiveErrors;
        logger.log(Level.SEVERE, "Worker for target " + target.id() + " failed (" + errors + " in a row)", t);
        try {
          if (errors >= errorThreshold) {
            restart("too many consecutive errors");
          } else {
            TimeUnit.MILLISECONDS.sleep(Math.min(1000L << Math.min(errors, 15), MAX_CRASH_BACKOFF_MS));
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
    }
    state = WorkerState.STOPPED;
    logger.log(Level.INFO, "Worker for target {0} stopped", target.id());
  }

  /**
   * Delivers one dequeued item and settles it.
   */
  void process(QueuedItem item) throws InterruptedException {
    long startNanos = System.nanoTime();
    DeliveryOutcome outcome;
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeSend(target.id(), item);
        completedBefore = i + 1;
      }
      outcome = sender.deliver(target, item);
    } catch (InterruptedException | Error e) {
      queue.restore(item);
      throw e;
    } catch (Exception e) {
      logger.log(Level.WARNING, "Interceptor rejected " + item.id() + " on " + target.id(), e);
      outcome = DeliveryOutcome.failed(ErrorKind.REJECTED, 0, e);
    }
    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
    runAfterSend(item, outcome, completedBefore);
    lastActivity = clock.millis();
    settle(item, outcome, elapsed);
    metrics.recordSendDurationMs(target.id(), elapsed.toMillis());
  }

  private void settle(QueuedItem item, DeliveryOutcome outcome, Duration elapsed) throws InterruptedException {
    switch (outcome.status()) {
      case DELIVERED -> {
        queue.ack(item, true, elapsed);
        consecutiveErrors = 0;
        processedSinceRestart++;
      }
      case SKIPPED -> queue.skip(item);
      case FAILED -> {
        queue.ack(item, false, elapsed);
        queue.requeue(item, outcome.kind());
        int errors = ++consecutiveErrors;
        if (errors >= errorThreshold) {
          logger.log(Level.WARNING, "Worker for target {0}: {1} consecutive failed deliveries",
              new Object[]{target.id(), errors});
          restart("too many consecutive failures");
        }
      }
    }
  }

  private void runAfterSend(QueuedItem item, DeliveryOutcome outcome, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterSend(target.id(), item, outcome);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterSend failed", ex);
      }
    }
  }

  /**
   * Logs the worker's state and restarts it if it has been inactive for too long. Runs
   * at most once per health check interval.
   */
  void checkHealth() throws InterruptedException {
    long now = clock.millis();
    if (now - lastHealthCheck < healthCheckIntervalMs) {
      return;
    }
    lastHealthCheck = now;
    long inactiveMs = now - lastActivity;
    logger.log(Level.INFO, "Worker for target {0}: {1} processed, last activity {2} ms ago, {3} consecutive errors",
        new Object[]{target.id(), processedSinceRestart, inactiveMs, consecutiveErrors});
    if (inactiveMs > stuckThresholdMs) {
      logger.log(Level.WARNING, "Worker for target {0} appears stuck", target.id());
      restart("inactive for " + inactiveMs + " ms");
    }
  }

  private void restart(String reason) throws InterruptedException {
    state = WorkerState.RESTARTING;
    logger.log(Level.INFO, "Restarting worker for target {0}: {1}", new Object[]{target.id(), reason});
    consecutiveErrors = 0;
    processedSinceRestart = 0;
    restarts++;
    metrics.incrementWorkerRestarts(target.id());
    TimeUnit.MILLISECONDS.sleep(restartPauseMs);
    lastActivity = clock.millis();
    state = WorkerState.IDLE;
    logger.log(Level.INFO, "Worker for target {0} restarted", target.id());
  }

  /** Asks the loop to exit after the current iteration. */
  void stop() {
    running = false;
  }

  public String targetId() {
    return target.id();
  }

  public WorkerState state() {
    return state;
  }

  public int restarts() {
    return restarts;
  }

  public int consecutiveErrors() {
    return consecutiveErrors;
  }
}
