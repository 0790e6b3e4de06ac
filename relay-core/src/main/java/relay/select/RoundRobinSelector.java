package relay.select;

import relay.target.TargetSnapshot;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Rotates over the targets, skipping excluded ones.
 */
public final class RoundRobinSelector implements TargetSelector {
  private final AtomicInteger cursor = new AtomicInteger();

  @Override
  public TargetSnapshot select(List<TargetSnapshot> candidates, Set<String> excluded) {
    int size = candidates.size();
    int start = cursor.getAndIncrement() & 0x7FFFFFFF;
    for (int i = 0; i < size; i++) {
      TargetSnapshot candidate = candidates.get((start + i) % size);
      if (!excluded.contains(candidate.id())) {
        return candidate;
      }
    }
    return null;
  }
}
