package relay.select;

import relay.target.TargetSnapshot;

import java.util.List;
import java.util.Set;

/**
 * One target selection strategy.
 *
 * <p>Implementations see consistent per-target snapshots in registration order and
 * never take target locks themselves.
 */
public interface TargetSelector {

  /**
   * Picks a target.
   *
   * @param candidates every target, in registration order
   * @param excluded   ids that must not be chosen
   * @return the chosen target, or {@code null} if no target is eligible
   */
  TargetSnapshot select(List<TargetSnapshot> candidates, Set<String> excluded);
}
