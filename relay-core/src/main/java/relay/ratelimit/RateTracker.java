package relay.ratelimit;

/**
 * Sliding window of recent send timestamps for one target.
 *
 * <p>Timestamps live in a fixed-capacity ring, oldest first. Entries older than the
 * window are pruned lazily on every read or write. Not thread-safe; guarded by the
 * target lock.
 */
public final class RateTracker {
  /** Default ring size; large enough for the adaptive burst cap. */
  public static final int DEFAULT_CAPACITY = 64;

  private final long[] times;
  private final long windowMillis;
  private int head;
  private int count;

  public RateTracker(int capacity, long windowMillis) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    if (windowMillis <= 0) {
      throw new IllegalArgumentException("windowMillis must be > 0");
    }
    this.times = new long[capacity];
    this.windowMillis = windowMillis;
  }

  /**
   * Number of sends recorded within the window ending at {@code nowMillis}.
   */
  public int recentCount(long nowMillis) {
    prune(nowMillis);
    return count;
  }

  /**
   * Records one send. When the ring is full the oldest entry is overwritten.
   */
  public void record(long nowMillis) {
    prune(nowMillis);
    int tail = (head + count) % times.length;
    times[tail] = nowMillis;
    if (count == times.length) {
      head = (head + 1) % times.length;
    } else {
      count++;
    }
  }

  public int capacity() {
    return times.length;
  }

  public long windowMillis() {
    return windowMillis;
  }

  private void prune(long nowMillis) {
    long cutoff = nowMillis - windowMillis;
    while (count > 0 && times[head] <= cutoff) {
      head = (head + 1) % times.length;
      count--;
    }
  }
}
