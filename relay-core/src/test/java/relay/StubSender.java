package relay;

import relay.resilience.ErrorKind;
import relay.spi.Sender;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;

/**
 * Scriptable sender. Each call consumes the next scripted response: a
 * {@link SendResult} is returned, an {@link Exception} is thrown. Once the script runs
 * out, every call delivers.
 */
public final class StubSender implements Sender {
  private final Deque<Object> script = new ArrayDeque<>();
  private final List<String> targets = new CopyOnWriteArrayList<>();
  private final List<RelayMessage> messages = new CopyOnWriteArrayList<>();
  private volatile CountDownLatch latch;

  public synchronized StubSender thenReturn(SendResult result) {
    script.add(result);
    return this;
  }

  public synchronized StubSender thenThrow(Exception error) {
    script.add(error);
    return this;
  }

  public synchronized StubSender thenFail(int times) {
    for (int i = 0; i < times; i++) {
      script.add(SendResult.failed(ErrorKind.NETWORK, "scripted failure"));
    }
    return this;
  }

  /** Counts down once per call. */
  public StubSender countDownOn(CountDownLatch latch) {
    this.latch = latch;
    return this;
  }

  @Override
  public SendResult send(String targetId, RelayMessage message) throws Exception {
    targets.add(targetId);
    messages.add(message);
    Object next;
    synchronized (this) {
      next = script.poll();
    }
    CountDownLatch current = latch;
    if (current != null) {
      current.countDown();
    }
    if (next instanceof Exception e) {
      throw e;
    }
    return next == null ? SendResult.delivered() : (SendResult) next;
  }

  public int calls() {
    return targets.size();
  }

  public List<String> targets() {
    return targets;
  }

  public List<RelayMessage> messages() {
    return messages;
  }
}
