package relay.spi;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps a {@link MetricsExporter} so that a failing backend is logged instead of
 * propagating into queue or worker code.
 *
 * <p>Every call is delegated. A {@link RuntimeException} thrown by the delegate is
 * logged at WARNING and discarded.
 */
public final class GuardedMetricsExporter implements MetricsExporter {
  private static final Logger logger = Logger.getLogger(GuardedMetricsExporter.class.getName());

  private final MetricsExporter delegate;

  private GuardedMetricsExporter(MetricsExporter delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  /**
   * Returns {@code metrics} guarded, or as-is if it is {@link #NOOP} or already guarded.
   */
  public static MetricsExporter guard(MetricsExporter metrics) {
    Objects.requireNonNull(metrics, "metrics");
    if (metrics == NOOP || metrics instanceof GuardedMetricsExporter) {
      return metrics;
    }
    return new GuardedMetricsExporter(metrics);
  }

  public MetricsExporter delegate() {
    return delegate;
  }

  @Override
  public void incrementSubmitted() {
    call("incrementSubmitted", delegate::incrementSubmitted);
  }

  @Override
  public void incrementRejected() {
    call("incrementRejected", delegate::incrementRejected);
  }

  @Override
  public void incrementDelivered(String targetId) {
    call("incrementDelivered", () -> delegate.incrementDelivered(targetId));
  }

  @Override
  public void incrementRequeued(String targetId) {
    call("incrementRequeued", () -> delegate.incrementRequeued(targetId));
  }

  @Override
  public void incrementPermanentFailure(String targetId) {
    call("incrementPermanentFailure", () -> delegate.incrementPermanentFailure(targetId));
  }

  @Override
  public void incrementDeferred(String targetId) {
    call("incrementDeferred", () -> delegate.incrementDeferred(targetId));
  }

  @Override
  public void incrementExpired(String targetId) {
    call("incrementExpired", () -> delegate.incrementExpired(targetId));
  }

  @Override
  public void incrementCircuitOpened(String targetId) {
    call("incrementCircuitOpened", () -> delegate.incrementCircuitOpened(targetId));
  }

  @Override
  public void incrementCircuitRejected(String targetId) {
    call("incrementCircuitRejected", () -> delegate.incrementCircuitRejected(targetId));
  }

  @Override
  public void incrementRebalanced(int moved) {
    call("incrementRebalanced", () -> delegate.incrementRebalanced(moved));
  }

  @Override
  public void incrementEvicted(String targetId, int evicted) {
    call("incrementEvicted", () -> delegate.incrementEvicted(targetId, evicted));
  }

  @Override
  public void incrementWorkerRestarts(String targetId) {
    call("incrementWorkerRestarts", () -> delegate.incrementWorkerRestarts(targetId));
  }

  @Override
  public void recordPending(int pending) {
    call("recordPending", () -> delegate.recordPending(pending));
  }

  @Override
  public void recordQueueDepth(String targetId, int depth) {
    call("recordQueueDepth", () -> delegate.recordQueueDepth(targetId, depth));
  }

  @Override
  public void recordSendDurationMs(String targetId, long durationMs) {
    call("recordSendDurationMs", () -> delegate.recordSendDurationMs(targetId, durationMs));
  }

  private void call(String hook, Runnable action) {
    try {
      action.run();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Metrics exporter failed in " + hook, e);
    }
  }
}
