package relay.spi;

/**
 * Observability hook for exporting dispatch counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Per-target methods
 * receive the target id so that implementations can tag their meters.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of submissions accepted into a queue.
   */
  void incrementSubmitted();

  /**
   * Increments the count of submissions rejected because the queue cap was reached.
   */
  void incrementRejected();

  void incrementDelivered(String targetId);

  /**
   * Increments the count of failed deliveries rescheduled on some target.
   */
  void incrementRequeued(String targetId);

  /**
   * Increments the count of items dropped after exhausting their retries.
   */
  void incrementPermanentFailure(String targetId);

  /**
   * Increments the count of dequeues deferred by the rate limiter.
   */
  default void incrementDeferred(String targetId) {
  }

  /**
   * Increments the count of items discarded at dequeue for exceeding the maximum age.
   */
  default void incrementExpired(String targetId) {
  }

  default void incrementCircuitOpened(String targetId) {
  }

  /**
   * Increments the count of deliveries skipped because the target's circuit was open.
   */
  default void incrementCircuitRejected(String targetId) {
  }

  default void incrementRebalanced(int moved) {
  }

  /**
   * Increments the count of stale items evicted by the reaper.
   */
  default void incrementEvicted(String targetId, int evicted) {
  }

  default void incrementWorkerRestarts(String targetId) {
  }

  /**
   * Records the number of submitted items not yet delivered or dropped.
   *
   * @param pending queued plus in-flight items across all targets
   */
  void recordPending(int pending);

  /**
   * Records one target's queue depth.
   */
  default void recordQueueDepth(String targetId, int depth) {
  }

  /**
   * Records the duration of one delivery, including in-layer retries.
   *
   * @param durationMs elapsed milliseconds (always non-negative)
   */
  default void recordSendDurationMs(String targetId, long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementSubmitted() {
    }

    @Override
    public void incrementRejected() {
    }

    @Override
    public void incrementDelivered(String targetId) {
    }

    @Override
    public void incrementRequeued(String targetId) {
    }

    @Override
    public void incrementPermanentFailure(String targetId) {
    }

    @Override
    public void recordPending(int pending) {
    }
  }
}
