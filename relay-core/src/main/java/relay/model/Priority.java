package relay.model;

import java.util.List;

/**
 * Priority class of a queued item. Determines dequeue order within one target:
 * higher classes are always drained before lower ones.
 */
public enum Priority {
  URGENT(4),
  HIGH(3),
  NORMAL(2),
  LOW(1);

  private static final List<Priority> DESCENDING = List.of(URGENT, HIGH, NORMAL, LOW);

  private final int level;

  Priority(int level) {
    this.level = level;
  }

  public int level() {
    return level;
  }

  /**
   * Returns the next lower class, or {@link #LOW} if this is already the lowest.
   *
   * @return the demoted priority
   */
  public Priority demote() {
    return switch (this) {
      case URGENT -> HIGH;
      case HIGH -> NORMAL;
      case NORMAL, LOW -> LOW;
    };
  }

  /**
   * All classes from highest to lowest, the order in which workers and the
   * rebalancer walk a target's heaps.
   *
   * @return immutable list, {@code URGENT} first
   */
  public static List<Priority> descending() {
    return DESCENDING;
  }
}
