package relay.dispatch;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import relay.FailingMetrics;
import relay.RelayMessage;
import relay.StubSender;
import relay.model.WorkerState;
import relay.queue.QueuedItem;
import relay.resilience.DeliveryOutcome;
import relay.resilience.ErrorKind;
import relay.resilience.ExponentialBackoffRetryPolicy;
import relay.resilience.ResilientSender;
import relay.spi.MetricsExporter;
import relay.target.TargetState;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TargetWorkerTest {
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final Engine engine = Engine.builder("a", "b").build();
  private final StubSender sender = new StubSender();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  // ── Processing ─────────────────────────────────────────────────

  @Test
  void deliveredItemIsAcked() throws Exception {
    TargetWorker worker = worker("a", List.of(), 5);
    QueuedItem item = submitAndDequeue("a");

    worker.process(item);

    assertEquals(1, engine.queue.processedCount());
    assertEquals(0, engine.queue.pending());
    assertEquals(0, worker.consecutiveErrors());
    assertEquals(List.of("a"), sender.targets());
  }

  @Test
  void failedItemIsRequeuedElsewhere() throws Exception {
    sender.thenFail(1);
    TargetWorker worker = worker("a", List.of(), 5);
    QueuedItem item = submitAndDequeue("a");

    worker.process(item);

    assertEquals(1, item.retryCount());
    assertEquals("b", item.targetId());
    assertEquals(1, engine.target("a").consecutiveFailures());
    assertEquals(1, worker.consecutiveErrors());
    assertEquals(1, engine.queue.pending());
  }

  @Test
  void repeatedFailuresRestartWorker() throws Exception {
    sender.thenFail(2);
    TargetWorker worker = worker("a", List.of(), 2);

    worker.process(submitAndDequeue("a"));
    worker.process(submitAndDequeue("a"));

    assertEquals(1, worker.restarts());
    assertEquals(0, worker.consecutiveErrors());
    assertEquals(1, engine.metrics.count("workerRestarts.a"));
    assertEquals(WorkerState.IDLE, worker.state());
  }

  @Test
  void openCircuitSkipsAndRequeues() throws Exception {
    TargetState a = engine.target("a");
    QueuedItem item = submitAndDequeue("a");
    a.lock().lock();
    try {
      a.openCircuit(engine.clock.millis());
    } finally {
      a.lock().unlock();
    }
    TargetWorker worker = worker("a", List.of(), 5);

    worker.process(item);

    assertEquals(0, sender.calls());
    assertEquals("b", item.targetId());
    assertEquals(0, a.snapshot(engine.clock.millis()).currentLoad());
    assertEquals(0, worker.consecutiveErrors());
  }

  @Test
  void failingMetricsDoNotStrandDeliveredItem() throws Exception {
    FailingMetrics exporter = new FailingMetrics();
    TargetWorker worker = worker("a", List.of(), 5, new AtomicBoolean(false), exporter);
    QueuedItem item = submitAndDequeue("a");

    worker.process(item);

    assertEquals(1, sender.calls());
    assertEquals(1, exporter.calls());
    assertEquals(1, engine.queue.processedCount());
    assertEquals(0, engine.queue.pending());
    assertEquals(0, engine.target("a").snapshot(engine.clock.millis()).currentLoad());
  }

  @Test
  void failingMetricsDoNotStrandFailedItem() throws Exception {
    Engine failing = Engine.builder("a", "b").exporter(new FailingMetrics()).build();
    sender.thenFail(1);
    TargetWorker worker = worker(failing, "a", new FailingMetrics());
    failing.queue.submit(RelayMessage.ofText("hi"), "a");
    QueuedItem item = failing.queue.dequeue(failing.target("a"), 0);

    worker.process(item);

    assertEquals("b", item.targetId());
    assertEquals(1, failing.target("b").queueSize());
    assertEquals(1, failing.queue.pending());
    assertEquals(0, failing.target("a").snapshot(failing.clock.millis()).currentLoad());
  }

  @Test
  void errorBeforeSendingPutsItemBack() throws Exception {
    TargetWorker worker = worker("a", List.of(DeliveryInterceptor.before((targetId, item) -> {
      throw new AssertionError("broken interceptor");
    })), 5);
    QueuedItem item = submitAndDequeue("a");

    assertThrows(AssertionError.class, () -> worker.process(item));

    assertEquals(0, sender.calls());
    assertEquals(1, engine.queue.pending());
    assertEquals(1, engine.target("a").queueSize());
    assertEquals(0, engine.target("a").snapshot(engine.clock.millis()).currentLoad());
  }

  // ── Interceptors ───────────────────────────────────────────────

  @Test
  void interceptorsWrapDeliveryInOrder() throws Exception {
    List<String> calls = new CopyOnWriteArrayList<>();
    List<DeliveryInterceptor> interceptors = List.of(
        recording("first", calls), recording("second", calls));
    TargetWorker worker = worker("a", interceptors, 5);

    worker.process(submitAndDequeue("a"));

    assertEquals(List.of("before:first", "before:second", "after:second", "after:first"), calls);
  }

  @Test
  void beforeSendFailureFailsDeliveryWithoutSending() throws Exception {
    List<String> calls = new CopyOnWriteArrayList<>();
    AtomicReference<DeliveryOutcome> seen = new AtomicReference<>();
    List<DeliveryInterceptor> interceptors = List.of(
        DeliveryInterceptor.after((targetId, item, outcome) -> seen.set(outcome)),
        DeliveryInterceptor.before((targetId, item) -> {
          throw new IllegalStateException("blocked");
        }),
        recording("never", calls));
    TargetWorker worker = worker("a", interceptors, 5);
    QueuedItem item = submitAndDequeue("a");

    worker.process(item);

    assertEquals(0, sender.calls());
    assertTrue(calls.isEmpty());
    assertEquals(ErrorKind.REJECTED, seen.get().kind());
    assertEquals(1, item.retryCount());
  }

  @Test
  void afterSendFailureIsSwallowed() throws Exception {
    TargetWorker worker = worker("a", List.of(DeliveryInterceptor.after((targetId, item, outcome) -> {
      throw new IllegalStateException("boom");
    })), 5);

    worker.process(submitAndDequeue("a"));

    assertEquals(1, engine.queue.processedCount());
  }

  // ── Supervision ────────────────────────────────────────────────

  @Test
  void inactiveWorkerRestartsOnHealthCheck() throws Exception {
    TargetWorker worker = worker("a", List.of(), 5);

    worker.checkHealth();
    assertEquals(0, worker.restarts());

    engine.clock.advance(Duration.ofSeconds(10));
    worker.checkHealth();

    assertEquals(1, worker.restarts());
  }

  @Test
  void healthCheckRunsOncePerInterval() throws Exception {
    TargetWorker worker = worker("a", List.of(), 5);
    engine.clock.advance(Duration.ofSeconds(10));
    worker.checkHealth();

    engine.clock.advance(Duration.ofMillis(500));
    worker.checkHealth();

    assertEquals(1, worker.restarts());
  }

  @Test
  void loopDeliversUntilStopped() throws Exception {
    CountDownLatch delivered = new CountDownLatch(2);
    sender.countDownOn(delivered);
    TargetWorker worker = worker("a", List.of(), 5);
    Thread thread = new Thread(worker, "test-worker");
    thread.start();

    engine.queue.submit(RelayMessage.ofText("1"), "a");
    engine.queue.submit(RelayMessage.ofText("2"), "a");

    assertTrue(delivered.await(5, TimeUnit.SECONDS));
    worker.stop();
    thread.join(5_000);

    assertFalse(thread.isAlive());
    assertEquals(WorkerState.STOPPED, worker.state());
  }

  @Test
  void pausedWorkerDoesNotDequeue() throws Exception {
    AtomicBoolean paused = new AtomicBoolean(true);
    TargetWorker worker = worker("a", List.of(), 5, paused);
    Thread thread = new Thread(worker, "test-worker");
    thread.start();
    engine.queue.submit(RelayMessage.ofText("1"), "a");

    Thread.sleep(300);
    assertEquals(0, sender.calls());

    CountDownLatch delivered = new CountDownLatch(1);
    sender.countDownOn(delivered);
    paused.set(false);
    assertTrue(delivered.await(5, TimeUnit.SECONDS));

    worker.stop();
    thread.join(5_000);
  }

  private TargetWorker worker(String targetId, List<DeliveryInterceptor> interceptors, int errorThreshold) {
    return worker(targetId, interceptors, errorThreshold, new AtomicBoolean(false));
  }

  private TargetWorker worker(String targetId, List<DeliveryInterceptor> interceptors, int errorThreshold,
      AtomicBoolean paused) {
    return worker(targetId, interceptors, errorThreshold, paused, engine.metrics);
  }

  private TargetWorker worker(String targetId, List<DeliveryInterceptor> interceptors, int errorThreshold,
      AtomicBoolean paused, MetricsExporter metrics) {
    return worker(engine, targetId, interceptors, errorThreshold, paused, metrics);
  }

  private TargetWorker worker(Engine engine, String targetId, MetricsExporter metrics) {
    return worker(engine, targetId, List.of(), 5, new AtomicBoolean(false), metrics);
  }

  private TargetWorker worker(Engine engine, String targetId, List<DeliveryInterceptor> interceptors,
      int errorThreshold, AtomicBoolean paused, MetricsExporter metrics) {
    ResilientSender resilient = new ResilientSender(sender, engine.circuitBreaker,
        new ExponentialBackoffRetryPolicy(0, 0, 0), 1, 0, Duration.ofSeconds(5), executor, engine.clock);
    return new TargetWorker(engine.target(targetId), engine.queue, resilient, interceptors, metrics,
        engine.clock, paused::get, Duration.ofMillis(50), Duration.ofSeconds(5), Duration.ofSeconds(1),
        errorThreshold, Duration.ZERO);
  }

  private QueuedItem submitAndDequeue(String targetId) throws InterruptedException {
    engine.queue.submit(RelayMessage.ofText("hi"), targetId);
    return engine.queue.dequeue(engine.target(targetId), 0);
  }

  private static DeliveryInterceptor recording(String name, List<String> calls) {
    return new DeliveryInterceptor() {
      @Override
      public void beforeSend(String targetId, QueuedItem item) {
        calls.add("before:" + name);
      }

      @Override
      public void afterSend(String targetId, QueuedItem item, DeliveryOutcome outcome) {
        calls.add("after:" + name);
      }
    };
  }
}
