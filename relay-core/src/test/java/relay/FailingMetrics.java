package relay;

import relay.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics exporter whose every call throws, standing in for a broken backend.
 */
public final class FailingMetrics implements MetricsExporter {
  private final AtomicInteger calls = new AtomicInteger();

  public int calls() {
    return calls.get();
  }

  private void fail() {
    calls.incrementAndGet();
    throw new IllegalStateException("metrics backend down");
  }

  @Override
  public void incrementSubmitted() {
    fail();
  }

  @Override
  public void incrementRejected() {
    fail();
  }

  @Override
  public void incrementDelivered(String targetId) {
    fail();
  }

  @Override
  public void incrementRequeued(String targetId) {
    fail();
  }

  @Override
  public void incrementPermanentFailure(String targetId) {
    fail();
  }

  @Override
  public void incrementDeferred(String targetId) {
    fail();
  }

  @Override
  public void recordPending(int pending) {
    fail();
  }

  @Override
  public void recordQueueDepth(String targetId, int depth) {
    fail();
  }

  @Override
  public void recordSendDurationMs(String targetId, long durationMs) {
    fail();
  }
}
