package relay;

import relay.resilience.ErrorKind;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one {@link relay.spi.Sender#send} call.
 *
 * <ul>
 *   <li>{@link Delivered} - the destination accepted the message.</li>
 *   <li>{@link RetryAfter} - the destination asked to wait; the wait is honored without
 *       consuming a send attempt.</li>
 *   <li>{@link Failed} - the attempt failed; counts against the attempt budget.</li>
 * </ul>
 *
 * <p>Throwing from {@code send} is equivalent to returning {@link Failed} with the
 * {@link ErrorKind} derived from the exception.
 */
public sealed interface SendResult permits SendResult.Delivered, SendResult.RetryAfter, SendResult.Failed {

  /**
   * Singleton indicating successful delivery.
   */
  Delivered DELIVERED = new Delivered();

  static Delivered delivered() {
    return DELIVERED;
  }

  /**
   * Creates a {@link RetryAfter} result.
   *
   * @param delay how long the destination asked to wait
   * @return a retry-after result
   * @throws NullPointerException     if {@code delay} is null
   * @throws IllegalArgumentException if {@code delay} is negative
   */
  static RetryAfter retryAfter(Duration delay) {
    return new RetryAfter(delay);
  }

  static Failed failed(ErrorKind kind, String reason) {
    return new Failed(kind, reason);
  }

  /**
   * Message delivered.
   */
  record Delivered() implements SendResult {
  }

  /**
   * Destination is throttling; retry after the specified delay.
   *
   * @param delay how long to wait before the next attempt (must not be null or negative)
   */
  record RetryAfter(Duration delay) implements SendResult {
    public RetryAfter {
      Objects.requireNonNull(delay, "delay must not be null");
      if (delay.isNegative()) {
        throw new IllegalArgumentException("delay must not be negative");
      }
    }
  }

  /**
   * Attempt failed.
   *
   * @param kind   failure class, for logs and metrics
   * @param reason human-readable detail, may be {@code null}
   */
  record Failed(ErrorKind kind, String reason) implements SendResult {
    public Failed {
      Objects.requireNonNull(kind, "kind must not be null");
    }
  }
}
