package relay.resilience;

import relay.spi.MetricsExporter;
import relay.target.TargetState;

import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-target circuit breaker over the state kept on {@link TargetState}.
 *
 * <p>Closed to open when a failed delivery brings the consecutive failure count to
 * {@code threshold}. Open to closed on the first request after {@code timeout} has
 * elapsed since opening, which also resets the failure streak.
 */
public final class CircuitBreaker {
  private static final Logger logger = Logger.getLogger(CircuitBreaker.class.getName());

  private final int threshold;
  private final long timeoutMs;
  private final MetricsExporter metrics;

  public CircuitBreaker(int threshold, Duration timeout, MetricsExporter metrics) {
    if (threshold < 1) {
      throw new IllegalArgumentException("threshold must be >= 1, got: " + threshold);
    }
    Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be >= 0");
    }
    this.threshold = threshold;
    this.timeoutMs = timeout.toMillis();
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Returns whether a send to the target may be attempted now, closing the circuit if
   * its timeout has elapsed.
   */
  public boolean allowRequest(TargetState target, long nowMillis) {
    target.lock().lock();
    try {
      if (!target.circuitOpen() || closeIfExpired(target, nowMillis)) {
        return true;
      }
    } finally {
      target.lock().unlock();
    }
    metrics.incrementCircuitRejected(target.id());
    return false;
  }

  /**
   * Closes the target's circuit if it is open and its timeout has elapsed. Lets a
   * target that receives no traffic become selectable again.
   *
   * @return {@code true} if this call closed the circuit
   */
  public boolean closeIfExpired(TargetState target, long nowMillis) {
    target.lock().lock();
    try {
      if (!target.circuitOpen() || nowMillis - target.circuitOpenedAt() <= timeoutMs) {
        return false;
      }
      target.closeCircuit();
    } finally {
      target.lock().unlock();
    }
    logger.log(Level.INFO, "Circuit closed for target {0}", target.id());
    return true;
  }

  /**
   * Opens the circuit if a failure brought the streak to the threshold.
   *
   * @param target              the failing target
   * @param consecutiveFailures streak after the failure
   * @param nowMillis           current time
   * @return {@code true} if this call opened the circuit
   */
  public boolean onFailure(TargetState target, int consecutiveFailures, long nowMillis) {
    if (consecutiveFailures < threshold) {
      return false;
    }
    target.lock().lock();
    try {
      if (target.circuitOpen()) {
        return false;
      }
      target.openCircuit(nowMillis);
    } finally {
      target.lock().unlock();
    }
    logger.log(Level.WARNING, "Circuit opened for target {0} after {1} consecutive failures",
        new Object[]{target.id(), consecutiveFailures});
    metrics.incrementCircuitOpened(target.id());
    return true;
  }
}
