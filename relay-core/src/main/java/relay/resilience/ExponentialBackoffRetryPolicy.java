package relay.resilience;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff between send attempts within one delivery.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, plus
 * uniform jitter in {@code [0, maxJitter)}.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxJitterMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the second attempt (milliseconds)
   * @param maxJitterMs upper bound of the random jitter added to every delay (milliseconds)
   * @param maxDelayMs  cap on the exponential part (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxJitterMs, long maxDelayMs) {
    if (baseDelayMs < 0) {
      throw new IllegalArgumentException("baseDelayMs must be >= 0, got: " + baseDelayMs);
    }
    if (maxJitterMs < 0) {
      throw new IllegalArgumentException("maxJitterMs must be >= 0, got: " + maxJitterMs);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxJitterMs = maxJitterMs;
    this.maxDelayMs = maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 31) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // Overflow guard: once the shift alone passes the cap, the product would too
      expDelay = (baseDelayMs != 0 && shift > maxDelayMs / baseDelayMs)
          ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    long jitter = maxJitterMs == 0 ? 0L : ThreadLocalRandom.current().nextLong(maxJitterMs);
    return capped + jitter;
  }
}
