package relay.queue;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Array-backed binary min-heap of {@link QueuedItem}s.
 *
 * <p>Push and poll are {@code O(log n)}. Bulk removal ({@link #removeIf}) compacts the
 * backing array in one pass and rebuilds the heap bottom-up in {@code O(n)}; it is meant
 * for background maintenance, never for the dequeue path.
 *
 * <p>Not thread-safe. Callers hold the owning target's lock.
 */
final class ItemHeap {
  private static final int INITIAL_CAPACITY = 16;

  private final Comparator<QueuedItem> order;
  private QueuedItem[] items = new QueuedItem[INITIAL_CAPACITY];
  private int size;

  ItemHeap(Comparator<QueuedItem> order) {
    this.order = Objects.requireNonNull(order, "order");
  }

  int size() {
    return size;
  }

  boolean isEmpty() {
    return size == 0;
  }

  void push(QueuedItem item) {
    Objects.requireNonNull(item, "item");
    if (size == items.length) {
      items = Arrays.copyOf(items, size * 2);
    }
    items[size] = item;
    siftUp(size++);
  }

  QueuedItem peek() {
    return size == 0 ? null : items[0];
  }

  QueuedItem poll() {
    if (size == 0) {
      return null;
    }
    QueuedItem head = items[0];
    size--;
    items[0] = items[size];
    items[size] = null;
    if (size > 0) {
      siftDown(0);
    }
    return head;
  }

  /**
   * Removes every item matching {@code filter} and restores the heap invariant.
   *
   * @return number of items removed
   */
  int removeIf(Predicate<QueuedItem> filter) {
    int kept = 0;
    for (int i = 0; i < size; i++) {
      if (!filter.test(items[i])) {
        items[kept++] = items[i];
      }
    }
    int removed = size - kept;
    if (removed == 0) {
      return 0;
    }
    Arrays.fill(items, kept, size, null);
    size = kept;
    for (int i = (size >>> 1) - 1; i >= 0; i--) {
      siftDown(i);
    }
    return removed;
  }

  void clear() {
    Arrays.fill(items, 0, size, null);
    size = 0;
  }

  private void siftUp(int index) {
    QueuedItem item = items[index];
    while (index > 0) {
      int parent = (index - 1) >>> 1;
      if (order.compare(item, items[parent]) >= 0) {
        break;
      }
      items[index] = items[parent];
      index = parent;
    }
    items[index] = item;
  }

  private void siftDown(int index) {
    QueuedItem item = items[index];
    int half = size >>> 1;
    while (index < half) {
      int child = (index << 1) + 1;
      int right = child + 1;
      if (right < size && order.compare(items[right], items[child]) < 0) {
        child = right;
      }
      if (order.compare(item, items[child]) <= 0) {
        break;
      }
      items[index] = items[child];
      index = child;
    }
    items[index] = item;
  }
}
