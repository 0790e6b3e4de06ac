package relay.dispatch;

import org.junit.jupiter.api.Test;
import relay.RelayConfig;
import relay.RelayMessage;
import relay.StubSender;
import relay.model.WorkerState;
import relay.resilience.ExponentialBackoffRetryPolicy;
import relay.resilience.ResilientSender;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayDispatcherTest {
  private final Engine engine = Engine.builder("a", "b").build();
  private final StubSender sender = new StubSender();
  private final RelayConfig config = RelayConfig.builder()
      .clock(engine.clock)
      .dequeueTimeout(Duration.ofMillis(50))
      .drainTimeout(Duration.ofSeconds(2))
      .build();

  @Test
  void createsOneWorkerPerTarget() {
    try (RelayDispatcher dispatcher = newDispatcher()) {
      Map<String, WorkerState> states = dispatcher.workerStates();

      assertEquals(List.of("a", "b"), List.copyOf(states.keySet()));
      assertEquals(2, dispatcher.workers().size());
    }
  }

  @Test
  void workersDeliverQueuedItems() throws Exception {
    CountDownLatch delivered = new CountDownLatch(3);
    sender.countDownOn(delivered);
    try (RelayDispatcher dispatcher = newDispatcher()) {
      dispatcher.start();
      dispatcher.start();

      engine.queue.submit(RelayMessage.ofText("1"), "a");
      engine.queue.submit(RelayMessage.ofText("2"), "b");
      engine.queue.submit(RelayMessage.ofText("3"), "a");

      assertTrue(delivered.await(5, TimeUnit.SECONDS));
    }
    assertTrue(sender.targets().containsAll(List.of("a", "b")));
  }

  @Test
  void pauseHoldsDeliveriesUntilResume() throws Exception {
    try (RelayDispatcher dispatcher = newDispatcher()) {
      dispatcher.pause();
      assertTrue(dispatcher.isPaused());
      dispatcher.start();
      engine.queue.submit(RelayMessage.ofText("1"), "a");

      Thread.sleep(300);
      assertEquals(0, sender.calls());

      CountDownLatch delivered = new CountDownLatch(1);
      sender.countDownOn(delivered);
      dispatcher.resume();
      assertFalse(dispatcher.isPaused());
      assertTrue(delivered.await(5, TimeUnit.SECONDS));
    }
  }

  @Test
  void closeStopsWorkers() {
    RelayDispatcher dispatcher = newDispatcher();
    dispatcher.start();

    dispatcher.close();
    dispatcher.close();

    dispatcher.workerStates().values().forEach(state -> assertEquals(WorkerState.STOPPED, state));
    assertThrows(IllegalStateException.class, dispatcher::start);
  }

  private RelayDispatcher newDispatcher() {
    return new RelayDispatcher(engine.registry, engine.queue,
        executor -> new ResilientSender(sender, engine.circuitBreaker,
            new ExponentialBackoffRetryPolicy(0, 0, 0), 1, 0, Duration.ofSeconds(5), executor, engine.clock),
        List.of(), engine.metrics, config);
  }
}
