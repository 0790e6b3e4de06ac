package relay.ratelimit;

import relay.target.TargetSnapshot;
import relay.target.TargetState;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sliding-window admission and adaptive tuning of per-target limits.
 *
 * <p>Stateless: every piece of state lives on the {@link TargetState}.
 */
public final class RateLimiter {
  private static final Logger logger = Logger.getLogger(RateLimiter.class.getName());

  static final double RELAX_SUCCESS_RATE = 0.95;
  static final double TIGHTEN_SUCCESS_RATE = 0.8;
  static final int TIGHTEN_CONSECUTIVE_FAILURES = 2;

  /**
   * Decides whether one more send may proceed now and, if so, records it.
   *
   * <p>A target still cooling down is refused outright. A target whose window already
   * holds {@code burstLimit} sends is refused and put into cooldown for
   * {@code recoveryTime}.
   *
   * @param target    the target, whose lock the caller must hold
   * @param nowMillis current time
   * @return {@code true} if the send may proceed
   */
  public boolean tryAcquire(TargetState target, long nowMillis) {
    if (target.isRateLimited(nowMillis)) {
      return false;
    }
    RateLimit limit = target.rateLimit();
    RateTracker tracker = target.rateTracker();
    if (tracker.recentCount(nowMillis) >= limit.burstLimit()) {
      target.deferUntil(nowMillis + limit.recoveryTime().toMillis());
      logger.log(Level.FINE, "Target {0} hit burst limit {1}; cooling down for {2}",
          new Object[]{target.id(), limit.burstLimit(), limit.recoveryTime()});
      return false;
    }
    tracker.record(nowMillis);
    return true;
  }

  /**
   * Relaxes the limits of a target that is performing well or tightens those of one
   * that is struggling. Targets with non-adaptive limits are left alone.
   *
   * @param target    the target to tune
   * @param nowMillis current time
   * @return the limits now in effect
   */
  public RateLimit adapt(TargetState target, long nowMillis) {
    TargetSnapshot snapshot = target.snapshot(nowMillis);
    RateLimit current = snapshot.rateLimit();
    if (!current.adaptive()) {
      return current;
    }
    RateLimit next = current;
    if (snapshot.successRate() > RELAX_SUCCESS_RATE && snapshot.consecutiveFailures() == 0) {
      next = current.relaxed();
    } else if (snapshot.successRate() < TIGHTEN_SUCCESS_RATE
        || snapshot.consecutiveFailures() > TIGHTEN_CONSECUTIVE_FAILURES) {
      next = current.tightened();
    }
    if (!next.equals(current)) {
      target.rateLimit(next);
      logger.log(Level.FINE, "Adjusted limits for target {0}: {1} msg/s, burst {2}, recovery {3}",
          new Object[]{target.id(), next.messagesPerSecond(), next.burstLimit(), next.recoveryTime()});
    }
    return next;
  }
}
