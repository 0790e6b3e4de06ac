package relay.reaper;

import org.junit.jupiter.api.Test;
import relay.RelayMessage;
import relay.dispatch.Engine;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QueueReaperTest {

  @Test
  void visitsOneTargetPerCycle() {
    Engine engine = Engine.builder("a", "b").build();
    engine.queue.submit(RelayMessage.ofText("1"), "a");
    engine.queue.submit(RelayMessage.ofText("2"), "b");
    engine.clock.advance(Duration.ofSeconds(301));
    QueueReaper reaper = new QueueReaper(engine.queue, Duration.ofSeconds(300), Duration.ofSeconds(60));

    assertEquals(1, reaper.runOnce());
    assertEquals(0, engine.target("a").queueSize());
    assertEquals(1, engine.target("b").queueSize());

    assertEquals(1, reaper.runOnce());
    assertEquals(0, reaper.runOnce());
    assertEquals(0, engine.queue.pending());
    assertEquals(2, engine.queue.evictedCount());
  }

  @Test
  void youngItemsSurvive() {
    Engine engine = Engine.builder("a").build();
    engine.queue.submit(RelayMessage.ofText("1"), null);
    engine.clock.advance(Duration.ofSeconds(100));
    QueueReaper reaper = new QueueReaper(engine.queue, Duration.ofSeconds(300), Duration.ofSeconds(60));

    assertEquals(0, reaper.runOnce());
    assertEquals(1, engine.queue.pending());
  }

  @Test
  void closedReaperDoesNothing() {
    Engine engine = Engine.builder("a").build();
    engine.queue.submit(RelayMessage.ofText("1"), null);
    engine.clock.advance(Duration.ofSeconds(301));
    QueueReaper reaper = new QueueReaper(engine.queue, Duration.ofSeconds(300), Duration.ofSeconds(60));
    reaper.start();

    reaper.close();

    assertEquals(0, reaper.runOnce());
    assertThrows(IllegalStateException.class, reaper::start);
  }

  @Test
  void rejectsZeroInterval() {
    Engine engine = Engine.builder("a").build();

    assertThrows(IllegalArgumentException.class, () ->
        new QueueReaper(engine.queue, Duration.ofSeconds(300), Duration.ZERO));
  }
}
