package relay;

import relay.dispatch.DeliveryInterceptor;
import relay.dispatch.DispatchQueue;
import relay.dispatch.RelayDispatcher;
import relay.dispatch.TargetWorker;
import relay.model.RelayStats;
import relay.model.TargetStats;
import relay.model.Totals;
import relay.model.WorkerState;
import relay.monitor.HealthMonitor;
import relay.queue.QueuedItem;
import relay.ratelimit.RateLimit;
import relay.ratelimit.RateLimiter;
import relay.reaper.QueueReaper;
import relay.rebalance.Rebalancer;
import relay.resilience.CircuitBreaker;
import relay.resilience.ErrorKind;
import relay.resilience.ExponentialBackoffRetryPolicy;
import relay.resilience.RequeueBackoffPolicy;
import relay.resilience.ResilientSender;
import relay.select.SelectionStrategy;
import relay.select.TargetSelection;
import relay.spi.GuardedMetricsExporter;
import relay.spi.MetricsExporter;
import relay.spi.PriorityClassifier;
import relay.spi.Sender;
import relay.target.TargetDefinition;
import relay.target.TargetRegistry;
import relay.target.TargetSnapshot;
import relay.target.TargetState;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the target registry, queue manager, worker pool and
 * background loops into a single {@link AutoCloseable} unit.
 *
 * <p>Building a relay allocates everything but starts no threads; items submitted
 * before {@link #start()} wait in their queues.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Relay relay = Relay.builder()
 *     .sender((targetId, message) -> bots.get(targetId).send(message.payload()))
 *     .target("bot-1")
 *     .target("bot-2", new RateLimit(10, 20, Duration.ofSeconds(5), true))
 *     .build()) {
 *   relay.start();
 *   relay.submit(RelayMessage.ofText("hello"));
 * }
 * }</pre>
 *
 * @see RelayConfig
 * @see Sender
 */
public final class Relay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Relay.class.getName());

  private final TargetRegistry registry;
  private final TargetSelection selection;
  private final DispatchQueue queue;
  private final RelayDispatcher dispatcher;
  private final HealthMonitor monitor;
  private final Rebalancer rebalancer;
  private final QueueReaper reaper;
  private final MetricsExporter metrics;
  private final AtomicBoolean adaptive;
  private final Clock clock;
  private final long createdAtMillis;

  private final AtomicBoolean accepting = new AtomicBoolean(true);
  private boolean started;
  private boolean closed;

  private Relay(Builder builder) {
    Sender sender = Objects.requireNonNull(builder.sender, "sender");
    RelayConfig config = builder.config != null ? builder.config : RelayConfig.defaults();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = config.clock();
    this.createdAtMillis = clock.millis();
    this.adaptive = new AtomicBoolean(config.adaptiveEnabled());
    MetricsExporter guarded = GuardedMetricsExporter.guard(metrics);

    this.registry = TargetRegistry.of(builder.targets, config.rateWindow().toMillis(), createdAtMillis);
    this.selection = new TargetSelection(registry, config.selectionStrategy(), config.unhealthyThreshold());
    RateLimiter rateLimiter = new RateLimiter();
    CircuitBreaker circuitBreaker = new CircuitBreaker(config.circuitThreshold(), config.circuitTimeout(), guarded);

    this.queue = DispatchQueue.builder()
        .registry(registry)
        .selection(selection)
        .rateLimiter(rateLimiter)
        .circuitBreaker(circuitBreaker)
        .classifier(builder.classifier)
        .requeueBackoff(new RequeueBackoffPolicy(config.requeueBackoffUnit().toMillis(),
            config.requeueBackoffFactor(), config.requeueMaxBackoff().toMillis()))
        .metrics(guarded)
        .clock(clock)
        .maxQueueSize(config.maxQueueSize())
        .maxRetries(config.maxRetries())
        .maxItemAge(config.maxItemAge())
        .unhealthyThreshold(config.unhealthyThreshold())
        .build();

    ExponentialBackoffRetryPolicy sendBackoff = new ExponentialBackoffRetryPolicy(
        config.sendBaseDelay().toMillis(), config.sendMaxJitter().toMillis(),
        config.requeueMaxBackoff().toMillis());
    this.dispatcher = new RelayDispatcher(registry, queue,
        sendExecutor -> new ResilientSender(sender, circuitBreaker, sendBackoff,
            config.sendAttempts(), config.maxRetryAfterWaits(), config.sendTimeout(),
            sendExecutor, clock),
        builder.interceptors, guarded, config);

    this.monitor = new HealthMonitor(queue, rateLimiter, adaptive::get, guarded, clock, config.monitorInterval());
    this.rebalancer = Rebalancer.builder()
        .registry(registry)
        .enabled(adaptive::get)
        .metrics(guarded)
        .clock(clock)
        .interval(config.rebalanceInterval())
        .minGap(config.rebalanceMinGap())
        .maxMoves(config.rebalanceMaxMoves())
        .unhealthyThreshold(config.unhealthyThreshold())
        .build();
    this.reaper = new QueueReaper(queue, config.retention(), config.reaperInterval());
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts one worker per target and the monitor, rebalancer and reaper loops.
   * Subsequent calls are no-ops.
   *
   * @throws IllegalStateException if the relay has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("Relay has been closed");
    }
    if (started) {
      return;
    }
    started = true;
    dispatcher.start();
    monitor.start();
    rebalancer.start();
    reaper.start();
    logger.log(Level.INFO, "Relay started with {0} targets, strategy {1}",
        new Object[]{registry.size(), selection.strategy()});
  }

  /**
   * Submits a message, letting the selection engine choose its target.
   *
   * @param message the message
   * @return {@code true} if queued, {@code false} if the queue is full or the relay closed
   */
  public boolean submit(RelayMessage message) {
    return submit(message, null);
  }

  /**
   * Submits a message to a preferred target. The preference is ignored if the target
   * is unknown, cooling down, unhealthy or has its circuit open.
   *
   * @param message           the message
   * @param preferredTargetId target to try first, or {@code null}
   * @return {@code true} if queued, {@code false} if the queue is full or the relay closed
   * @throws NullPointerException if {@code message} is null
   */
  public boolean submit(RelayMessage message, String preferredTargetId) {
    Objects.requireNonNull(message, "message");
    if (!accepting.get()) {
      return false;
    }
    try {
      return queue.submit(message, preferredTargetId) != null;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to enqueue " + message.messageId(), e);
      return false;
    }
  }

  /**
   * Reports the outcome of a delivery made outside the worker pool. A failed item is
   * requeued, or dropped once out of retries.
   *
   * @param item       an item previously handed out by the engine
   * @param success    whether it was delivered
   * @param processing time spent on it
   */
  public void ack(QueuedItem item, boolean success, Duration processing) {
    Objects.requireNonNull(item, "item");
    try {
      queue.ack(item, success, processing);
      if (!success) {
        queue.requeue(item, ErrorKind.REJECTED);
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to acknowledge " + item.id(), e);
    }
  }

  /**
   * Switches the selection strategy and adaptive mode; both take effect on the next
   * selection or background cycle.
   */
  public void configure(SelectionStrategy strategy, boolean adaptiveEnabled) {
    selection.strategy(strategy);
    adaptive.set(adaptiveEnabled);
    logger.log(Level.INFO, "Relay configured: strategy {0}, adaptive {1}",
        new Object[]{strategy, adaptiveEnabled});
  }

  /**
   * Forces one rebalancing pass, whether or not adaptive mode is on.
   *
   * @return number of items moved
   */
  public int rebalanceNow() {
    return rebalancer.runOnce();
  }

  /**
   * Drops every queued item on one target.
   *
   * @return number of items dropped
   * @throws IllegalArgumentException if the target is unknown
   */
  public int clearQueue(String targetId) {
    return queue.clear(registry.get(targetId));
  }

  /**
   * Drops every queued item on every target.
   *
   * @return number of items dropped
   */
  public int clearAll() {
    return queue.clearAll();
  }

  /** Stops workers from taking new items. Queues keep accepting submissions. */
  public void pause() {
    dispatcher.pause();
  }

  public void resume() {
    dispatcher.resume();
  }

  public boolean isPaused() {
    return dispatcher.isPaused();
  }

  /** Target ids in registration order. */
  public List<String> targetIds() {
    List<String> ids = new ArrayList<>(registry.size());
    for (TargetState target : registry.all()) {
      ids.add(target.id());
    }
    return ids;
  }

  /**
   * Returns a snapshot of per-target and engine-wide statistics.
   */
  public RelayStats stats() {
    long now = clock.millis();
    Map<String, WorkerState> workerStates = dispatcher.workerStates();
    Map<String, TargetStats> targets = new LinkedHashMap<>();
    for (TargetSnapshot s : registry.snapshots(now)) {
      RateLimit limit = s.rateLimit();
      targets.put(s.id(), new TargetStats(s.queueSize(), s.currentLoad(), s.messagesProcessed(),
          s.successRate(), s.avgProcessingTime(), s.consecutiveFailures(), s.rateLimited(),
          s.circuitOpen(), limit.messagesPerSecond(), limit.burstLimit(),
          workerStates.getOrDefault(s.id(), WorkerState.IDLE)));
    }
    long uptimeMs = Math.max(0L, now - createdAtMillis);
    long enqueued = queue.enqueuedCount();
    long processed = queue.processedCount();
    Totals totals = new Totals(enqueued, processed, queue.failedCount(), queue.expiredCount(),
        queue.evictedCount(), queue.rejectedCount(), queue.pending(),
        processed / (Math.max(1L, uptimeMs) / 1000.0),
        enqueued == 0 ? 0.0 : (double) processed / enqueued);
    return new RelayStats(targets, totals, selection.strategy(), adaptive.get(),
        dispatcher.isPaused(), Duration.ofMillis(uptimeMs));
  }

  List<TargetWorker> workers() {
    return dispatcher.workers();
  }

  /**
   * Shuts down components in order: reaper, rebalancer, monitor, workers, then the
   * metrics exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    synchronized (this) {
      if (closed) {
        return;
      }
      closed = true;
    }
    accepting.set(false);
    RuntimeException first = null;
    for (AutoCloseable component : List.<AutoCloseable>of(reaper, rebalancer, monitor, dispatcher)) {
      first = closeQuietly(component, first);
    }
    if (metrics instanceof AutoCloseable closeable) {
      first = closeQuietly(closeable, first);
    }
    logger.log(Level.INFO, "Relay closed with {0} items pending", queue.pending());
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(AutoCloseable component, RuntimeException first) {
    try {
      component.close();
    } catch (Exception e) {
      RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      if (first == null) {
        return re;
      }
      first.addSuppressed(re);
    }
    return first;
  }

  /** Builder for {@link Relay}. */
  public static final class Builder {
    private Sender sender;
    private final List<TargetDefinition> targets = new ArrayList<>();
    private RelayConfig config;
    private PriorityClassifier classifier;
    private MetricsExporter metrics;
    private final List<DeliveryInterceptor> interceptors = new ArrayList<>();

    private Builder() {}

    /**
     * Sets the function that delivers messages through a target.
     *
     * <p><b>Required.</b>
     *
     * @param sender the send function
     * @return this builder
     */
    public Builder sender(Sender sender) {
      this.sender = sender;
      return this;
    }

    /**
     * Adds a target with default rate limits.
     *
     * <p><b>At least one target is required.</b> Registration order is the tie-break
     * order for selection and the lock order for rebalancing.
     *
     * @param id unique target id
     * @return this builder
     */
    public Builder target(String id) {
      this.targets.add(TargetDefinition.of(id));
      return this;
    }

    /**
     * Adds a target with its own rate limits.
     *
     * @param id        unique target id
     * @param rateLimit initial limits
     * @return this builder
     */
    public Builder target(String id, RateLimit rateLimit) {
      this.targets.add(new TargetDefinition(id, rateLimit));
      return this;
    }

    public Builder targets(List<TargetDefinition> targets) {
      this.targets.addAll(targets);
      return this;
    }

    /**
     * Sets the engine configuration.
     *
     * <p>Optional. Defaults to {@link RelayConfig#defaults()}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(RelayConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the classifier for messages submitted without an explicit priority.
     *
     * <p>Optional. Defaults to {@link relay.dispatch.ContentPriorityClassifier}.
     *
     * @param classifier the classifier
     * @return this builder
     */
    public Builder classifier(PriorityClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    /**
     * Sets the metrics exporter. Closed with the relay if it is {@link AutoCloseable}.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Appends a delivery interceptor.
     *
     * <p>Optional. Interceptors run in registration order before a delivery and in
     * reverse order after it.
     *
     * @param interceptor the interceptor to add
     * @return this builder
     */
    public Builder interceptor(DeliveryInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    public Builder interceptors(List<DeliveryInterceptor> interceptors) {
      interceptors.forEach(this::interceptor);
      return this;
    }

    /**
     * Builds the relay. No threads are started until {@link Relay#start()}.
     *
     * @return a new relay
     * @throws NullPointerException     if {@code sender} is null
     * @throws IllegalArgumentException if no target was added or a target id repeats
     */
    public Relay build() {
      return new Relay(this);
    }
  }
}
