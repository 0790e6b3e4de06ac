package relay.ratelimit;

import java.time.Duration;
import java.util.Objects;

/**
 * Throughput limits for one target.
 *
 * <p>A target may send at most {@code burstLimit} messages within the rate window; once
 * it hits that, it cools down for {@code recoveryTime}. {@code messagesPerSecond} is the
 * nominal rate used for headroom scoring and, when {@code adaptive}, is tuned by
 * {@link RateLimiter#adapt}.
 *
 * @param messagesPerSecond nominal send rate, &gt; 0
 * @param burstLimit        maximum sends per window, &gt; 0
 * @param recoveryTime      cooldown after the burst limit is hit, &ge; 0
 * @param adaptive          whether the monitor may tune these limits
 */
public record RateLimit(double messagesPerSecond, int burstLimit, Duration recoveryTime, boolean adaptive) {

  static final double MAX_MESSAGES_PER_SECOND = 30.0;
  static final double MIN_MESSAGES_PER_SECOND = 5.0;
  static final int MAX_BURST = 60;
  static final int MIN_BURST = 10;
  static final Duration MIN_RECOVERY = Duration.ofSeconds(2);
  static final Duration MAX_RECOVERY = Duration.ofSeconds(30);

  public RateLimit {
    if (!(messagesPerSecond > 0)) {
      throw new IllegalArgumentException("messagesPerSecond must be > 0, got: " + messagesPerSecond);
    }
    if (burstLimit <= 0) {
      throw new IllegalArgumentException("burstLimit must be > 0, got: " + burstLimit);
    }
    Objects.requireNonNull(recoveryTime, "recoveryTime");
    if (recoveryTime.isNegative()) {
      throw new IllegalArgumentException("recoveryTime must be >= 0");
    }
  }

  /** 20 msg/s, burst 40, 5 s recovery, adaptive. */
  public static RateLimit defaults() {
    return new RateLimit(20, 40, Duration.ofSeconds(5), true);
  }

  /**
   * Limits for a target that is performing well: rate up 10% (cap 30/s), burst at twice
   * the rate (cap 60), recovery one second shorter (floor 2 s).
   */
  public RateLimit relaxed() {
    double mps = Math.min(MAX_MESSAGES_PER_SECOND, messagesPerSecond * 1.1);
    int burst = Math.min(MAX_BURST, (int) (mps * 2));
    Duration recovery = max(MIN_RECOVERY, recoveryTime.minusSeconds(1));
    return new RateLimit(mps, burst, recovery, adaptive);
  }

  /**
   * Limits for a struggling target: rate down 20% (floor 5/s), burst at 1.5x the rate
   * (floor 10), recovery five seconds longer (cap 30 s).
   */
  public RateLimit tightened() {
    double mps = Math.max(MIN_MESSAGES_PER_SECOND, messagesPerSecond * 0.8);
    int burst = Math.max(MIN_BURST, (int) (mps * 1.5));
    Duration recovery = min(MAX_RECOVERY, recoveryTime.plusSeconds(5));
    return new RateLimit(mps, burst, recovery, adaptive);
  }

  private static Duration max(Duration a, Duration b) {
    return a.compareTo(b) >= 0 ? a : b;
  }

  private static Duration min(Duration a, Duration b) {
    return a.compareTo(b) <= 0 ? a : b;
  }
}
