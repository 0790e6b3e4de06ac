package relay.dispatch;

import relay.RelayMessage;
import relay.model.Priority;
import relay.queue.PriorityQueueSet;
import relay.queue.QueuedItem;
import relay.ratelimit.RateLimiter;
import relay.resilience.CircuitBreaker;
import relay.resilience.ErrorKind;
import relay.resilience.RetryPolicy;
import relay.select.TargetSelection;
import relay.spi.GuardedMetricsExporter;
import relay.spi.MetricsExporter;
import relay.spi.PriorityClassifier;
import relay.target.TargetRegistry;
import relay.target.TargetSnapshot;
import relay.target.TargetState;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The queue manager: admission, routing, dequeue, acknowledgement and requeue of items
 * across every target's priority heaps.
 *
 * <p>Occupancy counts every item from acceptance until it is delivered or dropped,
 * queued or in flight. It is reserved before an item is routed, so concurrent
 * submitters can never push it past {@code maxQueueSize}.
 *
 * <p>Target metrics are updated in exactly one place, {@link #ack}. {@link #requeue}
 * only reroutes.
 */
public final class DispatchQueue {
  private static final Logger logger = Logger.getLogger(DispatchQueue.class.getName());

  private final TargetRegistry registry;
  private final TargetSelection selection;
  private final RateLimiter rateLimiter;
  private final CircuitBreaker circuitBreaker;
  private final PriorityClassifier classifier;
  private final RetryPolicy requeueBackoff;
  private final MetricsExporter metrics;
  private final Clock clock;
  private final int maxQueueSize;
  private final int maxRetries;
  private final long maxItemAgeMs;
  private final int unhealthyThreshold;

  private final AtomicInteger occupancy = new AtomicInteger();
  private final AtomicLong enqueued = new AtomicLong();
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong expired = new AtomicLong();
  private final AtomicLong evicted = new AtomicLong();
  private final AtomicLong requeued = new AtomicLong();
  private final AtomicLong rejected = new AtomicLong();

  private DispatchQueue(Builder builder) {
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.selection = Objects.requireNonNull(builder.selection, "selection");
    this.rateLimiter = Objects.requireNonNull(builder.rateLimiter, "rateLimiter");
    this.circuitBreaker = Objects.requireNonNull(builder.circuitBreaker, "circuitBreaker");
    this.classifier = builder.classifier != null ? builder.classifier : new ContentPriorityClassifier();
    this.requeueBackoff = Objects.requireNonNull(builder.requeueBackoff, "requeueBackoff");
    this.metrics = builder.metrics != null ? GuardedMetricsExporter.guard(builder.metrics) : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    if (builder.maxQueueSize <= 0) {
      throw new IllegalArgumentException("maxQueueSize must be > 0");
    }
    if (builder.maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    Objects.requireNonNull(builder.maxItemAge, "maxItemAge");
    this.maxQueueSize = builder.maxQueueSize;
    this.maxRetries = builder.maxRetries;
    this.maxItemAgeMs = builder.maxItemAge.toMillis();
    this.unhealthyThreshold = builder.unhealthyThreshold;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Classifies and routes a message.
   *
   * @param message           the message
   * @param preferredTargetId target to use if it is healthy, or {@code null}
   * @return the queued item, or {@code null} if the queue cap is reached
   */
  public QueuedItem submit(RelayMessage message, String preferredTargetId) {
    Objects.requireNonNull(message, "message");
    if (!reserve()) {
      rejected.incrementAndGet();
      metrics.incrementRejected();
      logger.log(Level.WARNING, "Queue full ({0} items); rejecting {1}",
          new Object[]{maxQueueSize, message.messageId()});
      return null;
    }
    QueuedItem item;
    TargetState target;
    try {
      long now = clock.millis();
      Priority priority = message.priority() != null ? message.priority() : classifier.classify(message);
      item = new QueuedItem(message, priority, now, maxRetries, classifier.estimateCostSeconds(message));
      target = preferred(preferredTargetId, now);
      if (target == null) {
        target = selection.select(Set.of(), now);
      }
      push(target, item);
    } catch (RuntimeException e) {
      // nothing was queued; give the reserved slot back
      occupancy.decrementAndGet();
      throw e;
    }
    enqueued.incrementAndGet();
    metrics.incrementSubmitted();
    logger.log(Level.FINE, "Enqueued {0} to {1} with priority {2}",
        new Object[]{item.id(), target.id(), item.priority()});
    return item;
  }

  private boolean reserve() {
    while (true) {
      int current = occupancy.get();
      if (current >= maxQueueSize) {
        return false;
      }
      if (occupancy.compareAndSet(current, current + 1)) {
        return true;
      }
    }
  }

  private TargetState preferred(String targetId, long now) {
    if (targetId == null) {
      return null;
    }
    TargetState target = registry.find(targetId);
    if (target == null) {
      logger.log(Level.WARNING, "Unknown preferred target {0}; selecting another", targetId);
      return null;
    }
    TargetSnapshot snapshot = target.snapshot(now);
    if (snapshot.rateLimited() || snapshot.circuitOpen()
        || snapshot.consecutiveFailures() >= unhealthyThreshold) {
      return null;
    }
    return target;
  }

  private static void push(TargetState target, QueuedItem item) {
    target.lock().lock();
    try {
      target.queues().push(target.id(), item);
      target.itemsAvailable().signalAll();
    } finally {
      target.lock().unlock();
    }
  }

  /**
   * Takes the next eligible item off a target's heaps, blocking up to
   * {@code timeoutMs} while there is none.
   *
   * <p>Priority classes are scanned highest first. Items past the maximum age, or out
   * of retries, are discarded on the way. An item whose backoff has not elapsed is left
   * in place. If the rate limiter refuses the send, the item is put back and the call
   * returns {@code null}.
   *
   * @param target    the target whose worker is asking
   * @param timeoutMs maximum time to wait; 0 to poll
   * @return the item, now counted as in flight, or {@code null}
   * @throws InterruptedException if interrupted while waiting
   */
  public QueuedItem dequeue(TargetState target, long timeoutMs) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, timeoutMs));
    target.lock().lock();
    try {
      while (true) {
        long now = clock.millis();
        long nextDue;
        if (target.isRateLimited(now)) {
          nextDue = target.rateLimitUntil();
        } else {
          Scan scan = scan(target, now);
          if (scan.item != null || scan.deferred) {
            return scan.item;
          }
          nextDue = scan.nextDue;
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return null;
        }
        if (nextDue != Long.MAX_VALUE) {
          remaining = Math.min(remaining, TimeUnit.MILLISECONDS.toNanos(Math.max(1L, nextDue - now)));
        }
        target.itemsAvailable().awaitNanos(remaining);
      }
    } finally {
      target.lock().unlock();
    }
  }

  private Scan scan(TargetState target, long now) {
    PriorityQueueSet queues = target.queues();
    long nextDue = Long.MAX_VALUE;
    for (Priority priority : Priority.descending()) {
      QueuedItem head;
      while ((head = queues.peek(priority)) != null) {
        if (head.timestampMillis() > now) {
          nextDue = Math.min(nextDue, head.timestampMillis());
          break;
        }
        queues.poll(priority);
        if (head.ageMillis(now) > maxItemAgeMs) {
          occupancy.decrementAndGet();
          expired.incrementAndGet();
          metrics.incrementExpired(target.id());
          logger.log(Level.FINE, "Discarded expired {0} from {1}", new Object[]{head.id(), target.id()});
          continue;
        }
        if (head.retriesExhausted()) {
          occupancy.decrementAndGet();
          failed.incrementAndGet();
          metrics.incrementPermanentFailure(target.id());
          logger.log(Level.SEVERE, "Discarded {0} from {1}: retries exhausted", new Object[]{head.id(), target.id()});
          continue;
        }
        if (!rateLimiter.tryAcquire(target, now)) {
          queues.restore(head);
          metrics.incrementDeferred(target.id());
          return Scan.DEFERRED;
        }
        target.markDispatched(now);
        return new Scan(head, false, nextDue);
      }
    }
    return new Scan(null, false, nextDue);
  }

  private record Scan(QueuedItem item, boolean deferred, long nextDue) {
    static final Scan DEFERRED = new Scan(null, true, Long.MAX_VALUE);
  }

  /**
   * Reports the outcome of a send attempt and updates the owning target's metrics.
   *
   * <p>A successful item is finished. A failed item stays accounted for until it is
   * passed to {@link #requeue}.
   *
   * @param item       the item, as returned by {@link #dequeue}
   * @param success    whether it was delivered
   * @param processing time spent delivering it
   */
  public void ack(QueuedItem item, boolean success, Duration processing) {
    TargetState target = registry.find(item.targetId());
    if (target == null) {
      logger.log(Level.WARNING, "Ack for {0} names unknown target {1}", new Object[]{item.id(), item.targetId()});
      return;
    }
    long now = clock.millis();
    double seconds = processing == null ? 0.0 : processing.toNanos() / 1_000_000_000.0;
    if (success) {
      target.recordSuccess(now, seconds);
      occupancy.decrementAndGet();
      processed.incrementAndGet();
      metrics.incrementDelivered(target.id());
    } else {
      int streak = target.recordFailure(now);
      circuitBreaker.onFailure(target, streak, now);
    }
  }

  /**
   * Reschedules a failed item, or drops it once its retries are used up.
   *
   * <p>The item's timestamp moves into the future by the requeue backoff, its priority
   * drops one class unless the failure was a rate limit, and it is routed away from the
   * target that failed it. From the third retry on, every target with a failure streak,
   * a cooldown or an open circuit is avoided too.
   *
   * @param item the failed item
   * @param kind why it failed
   * @return {@code true} if requeued, {@code false} if dropped
   */
  public boolean requeue(QueuedItem item, ErrorKind kind) {
    String from = item.targetId();
    int retry = item.incrementRetry();
    if (retry >= item.maxRetries()) {
      occupancy.decrementAndGet();
      failed.incrementAndGet();
      metrics.incrementPermanentFailure(from);
      logger.log(Level.SEVERE, "Message {0} failed permanently after {1} attempts (last: {2} on {3})",
          new Object[]{item.id(), retry, kind, from});
      return false;
    }

    long now = clock.millis();
    long delayMs = requeueBackoff.computeDelayMs(retry);
    item.retimestamp(now + delayMs);
    if (kind != ErrorKind.RATE_LIMITED) {
      item.demote();
    }

    Set<String> excluded = new HashSet<>();
    excluded.add(from);
    if (retry > 2) {
      for (TargetSnapshot snapshot : registry.snapshots(now)) {
        if (snapshot.consecutiveFailures() > 0 || snapshot.rateLimited() || snapshot.circuitOpen()) {
          excluded.add(snapshot.id());
        }
      }
    }
    TargetState next;
    try {
      next = selection.select(excluded, now);
    } catch (RuntimeException e) {
      next = registry.find(from);
      if (next == null) {
        throw e;
      }
      logger.log(Level.WARNING, "Selection failed for " + item.id() + "; keeping it on " + from, e);
    }
    push(next, item);
    requeued.incrementAndGet();
    metrics.incrementRequeued(from);
    logger.log(kind.isTransient() ? Level.INFO : Level.WARNING,
        "Requeued {0} (attempt {1}/{2}, {3}) from {4} to {5}, due in {6} ms",
        new Object[]{item.id(), retry, item.maxRetries(), kind, from, next.id(), delayMs});
    return true;
  }

  /**
   * Handles an item whose delivery was skipped because its target's circuit is open:
   * the target's in-flight count is released without recording a failure and the item
   * is requeued elsewhere.
   */
  public boolean skip(QueuedItem item) {
    TargetState target = registry.find(item.targetId());
    if (target != null) {
      target.release();
    }
    return requeue(item, ErrorKind.CIRCUIT_OPEN);
  }

  /**
   * Puts an in-flight item back on its target unchanged, for workers interrupted
   * mid-delivery.
   */
  public void restore(QueuedItem item) {
    TargetState target = registry.find(item.targetId());
    if (target == null) {
      occupancy.decrementAndGet();
      return;
    }
    target.release();
    push(target, item);
  }

  /**
   * Evicts stale items: older than {@code retentionMs}, or with no retries left. Keeps
   * the age cap enforced on targets whose worker is paused or stuck.
   *
   * @return number of items evicted
   */
  public int evictStale(TargetState target, long retentionMs) {
    long now = clock.millis();
    int removed;
    target.lock().lock();
    try {
      removed = target.queues().removeIf(item -> item.ageMillis(now) > retentionMs || item.retriesExhausted());
    } finally {
      target.lock().unlock();
    }
    if (removed > 0) {
      occupancy.addAndGet(-removed);
      evicted.addAndGet(removed);
      metrics.incrementEvicted(target.id(), removed);
    }
    return removed;
  }

  /**
   * Drops every queued item on a target. In-flight items are unaffected.
   *
   * @return number of items dropped
   */
  public int clear(TargetState target) {
    int dropped;
    target.lock().lock();
    try {
      dropped = target.queues().clear();
    } finally {
      target.lock().unlock();
    }
    if (dropped > 0) {
      occupancy.addAndGet(-dropped);
      logger.log(Level.INFO, "Cleared {0} queued items from {1}", new Object[]{dropped, target.id()});
    }
    return dropped;
  }

  public int clearAll() {
    int dropped = 0;
    for (TargetState target : registry.all()) {
      dropped += clear(target);
    }
    return dropped;
  }

  /** Items accepted and not yet delivered or dropped, queued or in flight. */
  public int pending() {
    return occupancy.get();
  }

  public long enqueuedCount() {
    return enqueued.get();
  }

  public long processedCount() {
    return processed.get();
  }

  public long failedCount() {
    return failed.get();
  }

  public long expiredCount() {
    return expired.get();
  }

  public long evictedCount() {
    return evicted.get();
  }

  public long requeuedCount() {
    return requeued.get();
  }

  public long rejectedCount() {
    return rejected.get();
  }

  public TargetRegistry registry() {
    return registry;
  }

  public CircuitBreaker circuitBreaker() {
    return circuitBreaker;
  }

  /** Builder for {@link DispatchQueue}. */
  public static final class Builder {
    private TargetRegistry registry;
    private TargetSelection selection;
    private RateLimiter rateLimiter;
    private CircuitBreaker circuitBreaker;
    private PriorityClassifier classifier;
    private RetryPolicy requeueBackoff;
    private MetricsExporter metrics;
    private Clock clock;
    private int maxQueueSize = 50_000;
    private int maxRetries = 3;
    private Duration maxItemAge = Duration.ofSeconds(300);
    private int unhealthyThreshold = 3;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder registry(TargetRegistry registry) {
      this.registry = registry;
      return this;
    }

    /** <b>Required.</b> */
    public Builder selection(TargetSelection selection) {
      this.selection = selection;
      return this;
    }

    /** <b>Required.</b> */
    public Builder rateLimiter(RateLimiter rateLimiter) {
      this.rateLimiter = rateLimiter;
      return this;
    }

    /** <b>Required.</b> */
    public Builder circuitBreaker(CircuitBreaker circuitBreaker) {
      this.circuitBreaker = circuitBreaker;
      return this;
    }

    /** <b>Required.</b> */
    public Builder requeueBackoff(RetryPolicy requeueBackoff) {
      this.requeueBackoff = requeueBackoff;
      return this;
    }

    /**
     * Optional. Defaults to {@link ContentPriorityClassifier}.
     */
    public Builder classifier(PriorityClassifier classifier) {
      this.classifier = classifier;
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
     * Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder maxItemAge(Duration maxItemAge) {
      this.maxItemAge = maxItemAge;
      return this;
    }

    public Builder unhealthyThreshold(int unhealthyThreshold) {
      this.unhealthyThreshold = unhealthyThreshold;
      return this;
    }

    /**
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a limit is out of range
     */
    public DispatchQueue build() {
      return new DispatchQueue(this);
    }
  }
}
