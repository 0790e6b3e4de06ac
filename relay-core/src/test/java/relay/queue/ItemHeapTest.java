package relay.queue;

import org.junit.jupiter.api.Test;
import relay.RelayMessage;
import relay.model.Priority;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ItemHeapTest {

  @Test
  void pollReturnsOldestFirst() {
    ItemHeap heap = new ItemHeap(QueuedItem.ORDER);
    heap.push(item("c", 300));
    heap.push(item("a", 100));
    heap.push(item("b", 200));

    assertEquals("a", heap.poll().id());
    assertEquals("b", heap.poll().id());
    assertEquals("c", heap.poll().id());
    assertNull(heap.poll());
  }

  @Test
  void growsPastInitialCapacity() {
    ItemHeap heap = new ItemHeap(QueuedItem.ORDER);
    for (int i = 99; i >= 0; i--) {
      heap.push(item("m" + i, i));
    }

    assertEquals(100, heap.size());
    long previous = -1;
    while (!heap.isEmpty()) {
      long ts = heap.poll().timestampMillis();
      assertTrue(ts >= previous);
      previous = ts;
    }
  }

  @Test
  void removeIfKeepsHeapOrder() {
    ItemHeap heap = new ItemHeap(QueuedItem.ORDER);
    for (int i = 0; i < 20; i++) {
      heap.push(item("m" + i, 1000 - i));
    }

    int removed = heap.removeIf(item -> item.timestampMillis() % 2 == 0);

    assertEquals(10, removed);
    assertEquals(10, heap.size());
    List<Long> drained = new ArrayList<>();
    while (!heap.isEmpty()) {
      drained.add(heap.poll().timestampMillis());
    }
    for (int i = 1; i < drained.size(); i++) {
      assertTrue(drained.get(i - 1) < drained.get(i));
      assertEquals(1, drained.get(i) % 2);
    }
  }

  @Test
  void clearEmptiesHeap() {
    ItemHeap heap = new ItemHeap(QueuedItem.ORDER);
    heap.push(item("a", 1));
    heap.push(item("b", 2));

    heap.clear();

    assertTrue(heap.isEmpty());
    assertNull(heap.peek());
  }

  private static QueuedItem item(String id, long timestamp) {
    RelayMessage message = RelayMessage.builder("payload").messageId(id).build();
    return new QueuedItem(message, Priority.NORMAL, timestamp, 3, 1.0);
  }
}
