package relay.resilience;

/**
 * Delay applied to an item's timestamp when it is requeued after a failed delivery:
 * {@code min(maxDelay, unit * factor^(retry-1))}, without jitter.
 */
public final class RequeueBackoffPolicy implements RetryPolicy {
  private final long unitMs;
  private final double factor;
  private final long maxDelayMs;

  public RequeueBackoffPolicy(long unitMs, double factor, long maxDelayMs) {
    if (unitMs < 0) {
      throw new IllegalArgumentException("unitMs must be >= 0, got: " + unitMs);
    }
    if (!(factor >= 1.0)) {
      throw new IllegalArgumentException("factor must be >= 1, got: " + factor);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.unitMs = unitMs;
    this.factor = factor;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    double delay = unitMs * Math.pow(factor, attempts - 1);
    return delay >= maxDelayMs ? maxDelayMs : (long) delay;
  }
}
