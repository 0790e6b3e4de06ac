package relay.select;

import relay.target.TargetSnapshot;

import java.util.List;
import java.util.Set;

/**
 * Picks the target with the fewest queued plus in-flight items. Targets in rate-limit
 * cooldown are skipped; ties go to the earliest registered target.
 */
public final class LeastLoadedSelector implements TargetSelector {

  @Override
  public TargetSnapshot select(List<TargetSnapshot> candidates, Set<String> excluded) {
    TargetSnapshot best = null;
    for (TargetSnapshot candidate : candidates) {
      if (excluded.contains(candidate.id()) || candidate.rateLimited()) {
        continue;
      }
      if (best == null || candidate.totalLoad() < best.totalLoad()) {
        best = candidate;
      }
    }
    return best;
  }
}
