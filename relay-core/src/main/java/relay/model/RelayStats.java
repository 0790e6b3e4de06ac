package relay.model;

import relay.select.SelectionStrategy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of the engine, as returned by {@code Relay.stats()}.
 *
 * @param targets         per-target statistics keyed by id, in registration order
 * @param totals          engine-wide counters
 * @param strategy        active selection strategy
 * @param adaptiveEnabled whether adaptive tuning and rebalancing are on
 * @param paused          whether workers are paused
 * @param uptime          time since the relay was created
 */
public record RelayStats(
    Map<String, TargetStats> targets,
    Totals totals,
    SelectionStrategy strategy,
    boolean adaptiveEnabled,
    boolean paused,
    Duration uptime) {

  public RelayStats {
    targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
  }
}
