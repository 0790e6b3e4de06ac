package relay.select;

import relay.target.TargetSnapshot;

import java.util.List;
import java.util.Set;

/**
 * Weighted scoring over every healthy target.
 *
 * <ul>
 *   <li>40% queue load: {@code max(0, 100 - 2 * queued)}</li>
 *   <li>30% health: {@code successRate * 50 + min(50, 1000 / (errors + 10))}</li>
 *   <li>20% speed: {@code min(50, 5 / avgProcessingTime)}, 0 without timing data</li>
 *   <li>10% rate headroom: {@code max(0, (rate - recentSends) / rate * 100)}</li>
 * </ul>
 *
 * <p>Targets in cooldown, with an open circuit, or whose consecutive failures reached
 * the unhealthy threshold, are not scored. Equal scores go to the earliest registered target.
 */
public final class SmartSelector implements TargetSelector {
  static final double LOAD_WEIGHT = 0.4;
  static final double HEALTH_WEIGHT = 0.3;
  static final double SPEED_WEIGHT = 0.2;
  static final double HEADROOM_WEIGHT = 0.1;

  private final int unhealthyThreshold;

  public SmartSelector(int unhealthyThreshold) {
    if (unhealthyThreshold < 1) {
      throw new IllegalArgumentException("unhealthyThreshold must be >= 1");
    }
    this.unhealthyThreshold = unhealthyThreshold;
  }

  @Override
  public TargetSnapshot select(List<TargetSnapshot> candidates, Set<String> excluded) {
    TargetSnapshot best = null;
    double bestScore = Double.NEGATIVE_INFINITY;
    for (TargetSnapshot candidate : candidates) {
      if (excluded.contains(candidate.id())
          || candidate.rateLimited()
          || candidate.circuitOpen()
          || candidate.consecutiveFailures() >= unhealthyThreshold) {
        continue;
      }
      double score = score(candidate);
      if (score > bestScore) {
        best = candidate;
        bestScore = score;
      }
    }
    return best;
  }

  static double score(TargetSnapshot target) {
    double load = Math.max(0, 100 - 2.0 * target.queueSize());
    double health = target.successRate() * 50 + Math.min(50, 1000.0 / (target.errorCount() + 10));
    double speed = target.avgProcessingTime() > 0 ? Math.min(50, 5 / target.avgProcessingTime()) : 0;
    double rate = target.rateLimit().messagesPerSecond();
    double headroom = Math.max(0, (rate - target.recentSendCount()) / rate * 100);
    return load * LOAD_WEIGHT + health * HEALTH_WEIGHT + speed * SPEED_WEIGHT + headroom * HEADROOM_WEIGHT;
  }
}
