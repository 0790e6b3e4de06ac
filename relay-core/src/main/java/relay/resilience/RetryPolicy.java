package relay.resilience;

/**
 * Strategy for computing the delay before retrying a failed delivery.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see RequeueBackoffPolicy
 */
public interface RetryPolicy {

  /**
   * Returns how long to wait before the next try.
   *
   * @param attempts failures so far for this item (1-based)
   * @return milliseconds, never negative
   */
  long computeDelayMs(int attempts);
}
