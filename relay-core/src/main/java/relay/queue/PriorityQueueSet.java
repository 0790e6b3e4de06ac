package relay.queue;

import relay.model.Priority;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * One target's queues: an independent heap per {@link Priority} class.
 *
 * <p>Not thread-safe. Every call must be made while holding the owning target's lock.
 */
public final class PriorityQueueSet {
  private final Map<Priority, ItemHeap> heaps = new EnumMap<>(Priority.class);

  public PriorityQueueSet() {
    for (Priority priority : Priority.values()) {
      heaps.put(priority, new ItemHeap(QueuedItem.ORDER));
    }
  }

  /**
   * Pushes an item onto the heap of its current priority and records the target
   * that now owns it.
   *
   * @param targetId id of the target owning this set
   * @param item     the item to push
   */
  public void push(String targetId, QueuedItem item) {
    item.assignTo(targetId);
    heaps.get(item.priority()).push(item);
  }

  public QueuedItem peek(Priority priority) {
    return heaps.get(priority).peek();
  }

  public QueuedItem poll(Priority priority) {
    return heaps.get(priority).poll();
  }

  /**
   * Puts back an item that was polled but could not be dispatched, without touching its
   * ownership or sequence.
   */
  public void restore(QueuedItem item) {
    heaps.get(item.priority()).push(item);
  }

  public int size(Priority priority) {
    return heaps.get(priority).size();
  }

  public int size() {
    int total = 0;
    for (ItemHeap heap : heaps.values()) {
      total += heap.size();
    }
    return total;
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  /**
   * Removes matching items from every heap.
   *
   * @return number of items removed
   */
  public int removeIf(Predicate<QueuedItem> filter) {
    int removed = 0;
    for (ItemHeap heap : heaps.values()) {
      removed += heap.removeIf(filter);
    }
    return removed;
  }

  /**
   * Empties every heap.
   *
   * @return number of items dropped
   */
  public int clear() {
    int dropped = size();
    heaps.values().forEach(ItemHeap::clear);
    return dropped;
  }
}
