package relay.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import relay.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends. Per-target meters carry a
 * {@code target} tag and are registered the first time a target reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code relay.submitted} - messages accepted into a queue</li>
 *   <li>{@code relay.rejected} - messages rejected (queue cap reached)</li>
 *   <li>{@code relay.delivered} - deliveries, per target</li>
 *   <li>{@code relay.requeued} - failed deliveries rescheduled, per failing target</li>
 *   <li>{@code relay.failed.permanent} - messages dropped after exhausting retries</li>
 *   <li>{@code relay.deferred} - dequeues deferred by the rate limiter</li>
 *   <li>{@code relay.expired} - messages discarded for exceeding the maximum age</li>
 *   <li>{@code relay.evicted} - stale messages evicted by the reaper</li>
 *   <li>{@code relay.circuit.opened} / {@code relay.circuit.rejected} - circuit breaker activity</li>
 *   <li>{@code relay.rebalanced} - messages moved between targets</li>
 *   <li>{@code relay.worker.restarts} - worker soft restarts</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code relay.pending} - queued plus in-flight messages</li>
 *   <li>{@code relay.queue.depth} - queued messages, per target</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code relay.send.duration} - time per delivery including retries, per target</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  static final String TARGET_TAG = "target";

  private final MeterRegistry registry;
  private final String prefix;
  private final Counter submitted;
  private final Counter rejected;
  private final Counter rebalanced;
  private final Gauge pendingGauge;

  private final AtomicInteger pending = new AtomicInteger();
  private final Map<String, Counter> targetCounters = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> depths = new ConcurrentHashMap<>();
  private final Map<String, Timer> sendTimers = new ConcurrentHashMap<>();
  private final List<Meter> targetMeters = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "relay"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "relay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "news.relay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.prefix = namePrefix;
    this.submitted = Counter.builder(namePrefix + ".submitted")
        .description("Messages accepted into a queue")
        .register(registry);
    this.rejected = Counter.builder(namePrefix + ".rejected")
        .description("Messages rejected (queue cap reached)")
        .register(registry);
    this.rebalanced = Counter.builder(namePrefix + ".rebalanced")
        .description("Messages moved between targets by the rebalancer")
        .register(registry);
    this.pendingGauge = Gauge.builder(namePrefix + ".pending", pending, AtomicInteger::get)
        .description("Queued plus in-flight messages")
        .register(registry);
  }

  @Override
  public void incrementSubmitted() {
    if (closed) return;
    submitted.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementDelivered(String targetId) {
    increment("delivered", "Messages delivered", targetId, 1);
  }

  @Override
  public void incrementRequeued(String targetId) {
    increment("requeued", "Failed deliveries rescheduled", targetId, 1);
  }

  @Override
  public void incrementPermanentFailure(String targetId) {
    increment("failed.permanent", "Messages dropped after exhausting retries", targetId, 1);
  }

  @Override
  public void incrementDeferred(String targetId) {
    increment("deferred", "Dequeues deferred by the rate limiter", targetId, 1);
  }

  @Override
  public void incrementExpired(String targetId) {
    increment("expired", "Messages discarded for exceeding the maximum age", targetId, 1);
  }

  @Override
  public void incrementCircuitOpened(String targetId) {
    increment("circuit.opened", "Circuit breaker openings", targetId, 1);
  }

  @Override
  public void incrementCircuitRejected(String targetId) {
    increment("circuit.rejected", "Deliveries skipped by an open circuit", targetId, 1);
  }

  @Override
  public void incrementRebalanced(int moved) {
    if (closed) return;
    rebalanced.increment(moved);
  }

  @Override
  public void incrementEvicted(String targetId, int evicted) {
    increment("evicted", "Stale messages evicted by the reaper", targetId, evicted);
  }

  @Override
  public void incrementWorkerRestarts(String targetId) {
    increment("worker.restarts", "Worker soft restarts", targetId, 1);
  }

  @Override
  public void recordPending(int pending) {
    if (closed) return;
    this.pending.set(pending);
  }

  @Override
  public void recordQueueDepth(String targetId, int depth) {
    if (closed) return;
    depths.computeIfAbsent(targetId, id -> {
      AtomicInteger holder = new AtomicInteger();
      targetMeters.add(Gauge.builder(prefix + ".queue.depth", holder, AtomicInteger::get)
          .description("Queued messages")
          .tag(TARGET_TAG, id)
          .register(registry));
      return holder;
    }).set(depth);
  }

  @Override
  public void recordSendDurationMs(String targetId, long durationMs) {
    if (closed) return;
    sendTimers.computeIfAbsent(targetId, id -> {
      Timer timer = Timer.builder(prefix + ".send.duration")
          .description("Time per delivery including retries")
          .tag(TARGET_TAG, id)
          .register(registry);
      targetMeters.add(timer);
      return timer;
    }).record(durationMs, TimeUnit.MILLISECONDS);
  }

  private void increment(String name, String description, String targetId, int amount) {
    if (closed) return;
    targetCounters.computeIfAbsent(name + '|' + targetId, key -> {
      Counter counter = Counter.builder(prefix + '.' + name)
          .description(description)
          .tag(TARGET_TAG, targetId)
          .register(registry);
      targetMeters.add(counter);
      return counter;
    }).increment(amount);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link relay.Relay#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(submitted, rejected, rebalanced, pendingGauge));
    meters.addAll(targetMeters);
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    targetCounters.clear();
    depths.clear();
    sendTimers.clear();
    targetMeters.clear();
    if (first != null) throw first;
  }
}
