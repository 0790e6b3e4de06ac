package relay.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class PriorityTest {

  @Test
  void demoteWalksDownOneLevel() {
    assertEquals(Priority.HIGH, Priority.URGENT.demote());
    assertEquals(Priority.NORMAL, Priority.HIGH.demote());
    assertEquals(Priority.LOW, Priority.NORMAL.demote());
    assertEquals(Priority.LOW, Priority.LOW.demote());
  }

  @Test
  void descendingStartsWithUrgent() {
    assertEquals(List.of(Priority.URGENT, Priority.HIGH, Priority.NORMAL, Priority.LOW),
        Priority.descending());
  }

  @Test
  void levelsAreOrdered() {
    assertEquals(4, Priority.URGENT.level());
    assertEquals(1, Priority.LOW.level());
  }
}
