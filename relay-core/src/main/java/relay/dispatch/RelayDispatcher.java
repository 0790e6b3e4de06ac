package relay.dispatch;

import relay.RelayConfig;
import relay.model.WorkerState;
import relay.resilience.ResilientSender;
import relay.spi.MetricsExporter;
import relay.target.TargetRegistry;
import relay.target.TargetState;
import relay.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The worker pool: one {@link TargetWorker} per target on its own daemon thread.
 *
 * <p>Workers are created up front and started by {@link #start()}. Pausing stops them
 * from dequeuing without stopping the threads. {@link #close()} stops the loops, waits
 * up to the drain timeout for in-flight deliveries, then interrupts what is left;
 * interrupted items are put back on their target.
 */
public final class RelayDispatcher implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RelayDispatcher.class.getName());

  private final List<TargetWorker> workers;
  private final ExecutorService sendExecutor;
  private final AtomicBoolean paused = new AtomicBoolean(false);
  private final long drainTimeoutMs;

  private ExecutorService workerThreads;
  private volatile boolean closed;

  /**
   * @param registry     targets to serve, one worker each
   * @param queue        the queue manager
   * @param senderFactory builds the resilience layer around the executor that runs sends
   * @param interceptors delivery hooks, in registration order
   * @param metrics      metrics exporter
   * @param config       worker timing and supervision settings
   */
  public RelayDispatcher(TargetRegistry registry, DispatchQueue queue,
      SenderFactory senderFactory, List<DeliveryInterceptor> interceptors,
      MetricsExporter metrics, RelayConfig config) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(senderFactory, "senderFactory");
    Objects.requireNonNull(config, "config");
    this.sendExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("relay-send-"));
    ResilientSender sender = senderFactory.create(sendExecutor);
    List<TargetWorker> created = new ArrayList<>(registry.size());
    for (TargetState target : registry.all()) {
      created.add(new TargetWorker(target, queue, sender, interceptors, metrics, config.clock(),
          paused::get, config.dequeueTimeout(), config.stuckThreshold(), config.healthCheckInterval(),
          config.workerErrorThreshold(), config.restartPause()));
    }
    this.workers = Collections.unmodifiableList(created);
    this.drainTimeoutMs = config.drainTimeout().toMillis();
  }

  /**
   * Builds the resilience layer once the dispatcher's send executor exists.
   */
  @FunctionalInterface
  public interface SenderFactory {
    ResilientSender create(ExecutorService sendExecutor);
  }

  /**
   * Starts one thread per worker. Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the dispatcher has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("RelayDispatcher has been closed");
    }
    if (workerThreads != null) {
      return;
    }
    workerThreads = Executors.newFixedThreadPool(workers.size(), new DaemonThreadFactory("relay-worker-"));
    for (TargetWorker worker : workers) {
      workerThreads.submit(worker);
    }
    logger.log(Level.INFO, "Started {0} workers", workers.size());
  }

  public void pause() {
    if (paused.compareAndSet(false, true)) {
      logger.info("Workers paused");
    }
  }

  public void resume() {
    if (paused.compareAndSet(true, false)) {
      logger.info("Workers resumed");
    }
  }

  public boolean isPaused() {
    return paused.get();
  }

  public List<TargetWorker> workers() {
    return workers;
  }

  /** Current state of each target's worker, in registration order. */
  public Map<String, WorkerState> workerStates() {
    Map<String, WorkerState> states = new LinkedHashMap<>();
    for (TargetWorker worker : workers) {
      states.put(worker.targetId(), worker.state());
    }
    return states;
  }

  /**
   * Stops the workers, waiting up to the drain timeout for in-flight deliveries.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    for (TargetWorker worker : workers) {
      worker.stop();
    }
    if (workerThreads != null) {
      workerThreads.shutdown();
      try {
        if (!workerThreads.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "Drain timeout exceeded; interrupting workers");
          workerThreads.shutdownNow();
          workerThreads.awaitTermination(5, TimeUnit.SECONDS);
        }
      } catch (InterruptedException e) {
        workerThreads.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    sendExecutor.shutdownNow();
  }
}
