package relay.queue;

import relay.RelayMessage;
import relay.model.Priority;

import java.util.Comparator;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A message waiting in, or being dispatched from, a target's priority heaps.
 *
 * <p>Mutable fields are only touched by whoever owns the item at that moment: the
 * lock holder of the target whose heap contains it, or the worker that dequeued it.
 * Ownership always changes hands through a target lock, which publishes the writes.
 *
 * <p>Items order by priority (highest first), then by timestamp (oldest first), then
 * by push sequence so that items pushed within the same millisecond stay FIFO.
 */
public final class QueuedItem {

  /** Dequeue order within one target. */
  public static final Comparator<QueuedItem> ORDER = Comparator
      .comparingInt((QueuedItem item) -> -item.priority.level())
      .thenComparingLong(item -> item.timestampMillis)
      .thenComparingLong(item -> item.sequence);

  private static final AtomicLong SEQUENCE = new AtomicLong();

  private final RelayMessage message;
  private final int maxRetries;
  private final double estimatedCostSeconds;
  private final long submittedAtMillis;

  private Priority priority;
  private long timestampMillis;
  private long sequence;
  private String targetId;
  private int retryCount;

  public QueuedItem(RelayMessage message, Priority priority, long timestampMillis,
      int maxRetries, double estimatedCostSeconds) {
    this.message = Objects.requireNonNull(message, "message");
    this.priority = Objects.requireNonNull(priority, "priority");
    if (maxRetries < 1) {
      throw new IllegalArgumentException("maxRetries must be >= 1");
    }
    this.maxRetries = maxRetries;
    this.estimatedCostSeconds = estimatedCostSeconds;
    this.timestampMillis = timestampMillis;
    this.submittedAtMillis = timestampMillis;
    this.sequence = SEQUENCE.incrementAndGet();
  }

  public String id() {
    return message.messageId();
  }

  public RelayMessage message() {
    return message;
  }

  public Priority priority() {
    return priority;
  }

  /**
   * Ordering timestamp. Starts at submission time; bumped by the backoff delay on
   * requeue and reset when the rebalancer moves the item.
   */
  public long timestampMillis() {
    return timestampMillis;
  }

  public long submittedAtMillis() {
    return submittedAtMillis;
  }

  public String targetId() {
    return targetId;
  }

  public int retryCount() {
    return retryCount;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public boolean retriesExhausted() {
    return retryCount >= maxRetries;
  }

  public double estimatedCostSeconds() {
    return estimatedCostSeconds;
  }

  /** Milliseconds since the ordering timestamp; negative while a backoff is pending. */
  public long ageMillis(long nowMillis) {
    return nowMillis - timestampMillis;
  }

  void assignTo(String targetId) {
    this.targetId = targetId;
    this.sequence = SEQUENCE.incrementAndGet();
  }

  /**
   * Records one more failed delivery.
   *
   * @return the new retry count
   */
  public int incrementRetry() {
    return ++retryCount;
  }

  public void demote() {
    this.priority = priority.demote();
  }

  public void retimestamp(long timestampMillis) {
    this.timestampMillis = timestampMillis;
  }

  @Override
  public String toString() {
    return "QueuedItem{id=" + id()
        + ", priority=" + priority
        + ", target=" + targetId
        + ", retry=" + retryCount + "/" + maxRetries + '}';
  }
}
