package relay.select;

/**
 * How the selection engine picks a target for a new or retried item.
 */
public enum SelectionStrategy {
  /** Pure rotation over the non-excluded targets. */
  ROUND_ROBIN,
  /** Fewest queued plus in-flight items, skipping targets in cooldown. */
  LEAST_LOADED,
  /** Weighted score over load, health, speed and rate headroom. */
  SMART
}
