package relay;

import java.time.Duration;
import java.util.Objects;

/**
 * Thrown by a {@link relay.spi.Sender} when the destination explicitly asked the caller
 * to back off, for example an HTTP 429 with a {@code Retry-After} header or a flood-wait
 * reply.
 *
 * <p>Handled exactly like {@link SendResult.RetryAfter}: the target is put into cooldown
 * for the requested delay and the send is retried after it without consuming an attempt.
 *
 * @see SendResult.RetryAfter
 */
public class RetryAfterException extends RuntimeException {

  private final Duration retryAfter;

  /**
   * @param retryAfter how long to wait before retrying
   * @throws NullPointerException     if {@code retryAfter} is null
   * @throws IllegalArgumentException if {@code retryAfter} is negative
   */
  public RetryAfterException(Duration retryAfter) {
    super("Retry after " + validate(retryAfter));
    this.retryAfter = retryAfter;
  }

  public RetryAfterException(Duration retryAfter, String message) {
    super(message);
    this.retryAfter = validate(retryAfter);
  }

  public RetryAfterException(Duration retryAfter, Throwable cause) {
    super("Retry after " + validate(retryAfter), cause);
    this.retryAfter = retryAfter;
  }

  /**
   * Flood-wait style factory for destinations that report the wait in whole seconds.
   *
   * @param seconds requested wait, &ge; 0
   * @return a new exception
   */
  public static RetryAfterException ofSeconds(long seconds) {
    return new RetryAfterException(Duration.ofSeconds(seconds), "Flood wait of " + seconds + "s");
  }

  /**
   * Returns the destination-requested delay.
   *
   * @return the delay (never null, never negative)
   */
  public Duration retryAfter() {
    return retryAfter;
  }

  private static Duration validate(Duration retryAfter) {
    Objects.requireNonNull(retryAfter, "retryAfter");
    if (retryAfter.isNegative()) {
      throw new IllegalArgumentException("retryAfter must be >= 0, got: " + retryAfter);
    }
    return retryAfter;
  }
}
