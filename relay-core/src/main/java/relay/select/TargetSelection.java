package relay.select;

import relay.target.TargetRegistry;
import relay.target.TargetSnapshot;
import relay.target.TargetState;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The selection engine: routes new and retried items to a target using the active
 * {@link SelectionStrategy}, switchable at runtime.
 *
 * <p>When the strategy finds no eligible target, the least queued non-excluded target
 * is used; when every target is excluded, the first registered one. Selection never
 * fails.
 */
public final class TargetSelection {
  private static final Logger logger = Logger.getLogger(TargetSelection.class.getName());

  private final TargetRegistry registry;
  private final Map<SelectionStrategy, TargetSelector> selectors = new EnumMap<>(SelectionStrategy.class);
  private volatile SelectionStrategy strategy;

  public TargetSelection(TargetRegistry registry, SelectionStrategy strategy, int unhealthyThreshold) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    selectors.put(SelectionStrategy.ROUND_ROBIN, new RoundRobinSelector());
    selectors.put(SelectionStrategy.LEAST_LOADED, new LeastLoadedSelector());
    selectors.put(SelectionStrategy.SMART, new SmartSelector(unhealthyThreshold));
  }

  public SelectionStrategy strategy() {
    return strategy;
  }

  /** Takes effect on the next selection. */
  public void strategy(SelectionStrategy strategy) {
    this.strategy = Objects.requireNonNull(strategy, "strategy");
  }

  /**
   * Picks a target for an item.
   *
   * @param excluded  ids to avoid; may be empty
   * @param nowMillis current time
   * @return the chosen target, never {@code null}
   */
  public TargetState select(Set<String> excluded, long nowMillis) {
    List<TargetSnapshot> snapshots = registry.snapshots(nowMillis);
    TargetSnapshot chosen = selectors.get(strategy).select(snapshots, excluded);
    if (chosen == null) {
      chosen = fallback(snapshots, excluded);
    }
    return chosen == null ? registry.first() : registry.get(chosen.id());
  }

  private static TargetSnapshot fallback(List<TargetSnapshot> snapshots, Set<String> excluded) {
    TargetSnapshot best = null;
    for (TargetSnapshot snapshot : snapshots) {
      if (excluded.contains(snapshot.id())) {
        continue;
      }
      if (best == null || snapshot.queueSize() < best.queueSize()) {
        best = snapshot;
      }
    }
    if (best == null) {
      logger.log(Level.FINE, "Every target excluded; falling back to {0}", snapshots.get(0).id());
    }
    return best;
  }
}
