package relay.resilience;

import relay.RelayMessage;
import relay.RetryAfterException;
import relay.SendResult;
import relay.queue.QueuedItem;
import relay.spi.Sender;
import relay.target.TargetState;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Wraps the external {@link Sender} for one delivery: circuit check, bounded attempts
 * with exponential backoff and jitter, retry-after waits and a per-send timeout.
 *
 * <p>This is the only place sends are retried in-process. It does not touch target
 * health metrics; the caller reports the outcome once through the queue's ack.
 */
public final class ResilientSender {
  private static final Logger logger = Logger.getLogger(ResilientSender.class.getName());

  private final Sender sender;
  private final CircuitBreaker circuitBreaker;
  private final RetryPolicy backoff;
  private final int maxAttempts;
  private final int maxRetryAfterWaits;
  private final long sendTimeoutMs;
  private final ExecutorService sendExecutor;
  private final Clock clock;

  public ResilientSender(Sender sender, CircuitBreaker circuitBreaker, RetryPolicy backoff,
      int maxAttempts, int maxRetryAfterWaits, Duration sendTimeout,
      ExecutorService sendExecutor, Clock clock) {
    this.sender = Objects.requireNonNull(sender, "sender");
    this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
    }
    if (maxRetryAfterWaits < 0) {
      throw new IllegalArgumentException("maxRetryAfterWaits must be >= 0, got: " + maxRetryAfterWaits);
    }
    Objects.requireNonNull(sendTimeout, "sendTimeout");
    if (sendTimeout.isZero() || sendTimeout.isNegative()) {
      throw new IllegalArgumentException("sendTimeout must be > 0");
    }
    this.maxAttempts = maxAttempts;
    this.maxRetryAfterWaits = maxRetryAfterWaits;
    this.sendTimeoutMs = sendTimeout.toMillis();
    this.sendExecutor = Objects.requireNonNull(sendExecutor, "sendExecutor");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Delivers an item through its target.
   *
   * @param target the target that dequeued the item
   * @param item   the item to deliver
   * @return the outcome; never {@code null}
   * @throws InterruptedException if the worker is interrupted while sending or waiting
   */
  public DeliveryOutcome deliver(TargetState target, QueuedItem item) throws InterruptedException {
    if (!circuitBreaker.allowRequest(target, clock.millis())) {
      logger.log(Level.FINE, "Circuit open for target {0}; skipping {1}",
          new Object[]{target.id(), item.id()});
      return DeliveryOutcome.skipped();
    }

    int attempts = 0;
    int waits = 0;
    ErrorKind lastKind = ErrorKind.REJECTED;
    Throwable lastError = null;
    while (attempts < maxAttempts) {
      Attempt attempt = sendOnce(target.id(), item.message());
      SendResult result = attempt.result();

      if (result instanceof SendResult.Delivered) {
        attempts++;
        if (attempts > 1) {
          logger.log(Level.FINE, "Delivered {0} via {1} on attempt {2}",
              new Object[]{item.id(), target.id(), attempts});
        }
        return DeliveryOutcome.delivered(attempts);
      }

      if (result instanceof SendResult.RetryAfter retryAfter) {
        lastKind = ErrorKind.RATE_LIMITED;
        lastError = attempt.error();
        if (waits >= maxRetryAfterWaits) {
          logger.log(Level.WARNING, "Target {0} still throttling after {1} retry-after waits; giving up on {2}",
              new Object[]{target.id(), waits, item.id()});
          break;
        }
        waits++;
        Duration delay = retryAfter.delay();
        target.deferUntil(clock.millis() + delay.toMillis());
        logger.log(Level.INFO, "Target {0} asked to retry after {1}", new Object[]{target.id(), delay});
        TimeUnit.MILLISECONDS.sleep(delay.toMillis());
        continue;
      }

      SendResult.Failed failed = (SendResult.Failed) result;
      attempts++;
      lastKind = failed.kind();
      lastError = attempt.error();
      logger.log(Level.WARNING, "Send of {0} via {1} failed on attempt {2}/{3}: {4} - {5}",
          new Object[]{item.id(), target.id(), attempts, maxAttempts, failed.kind(), failed.reason()});
      if (attempts < maxAttempts) {
        TimeUnit.MILLISECONDS.sleep(backoff.computeDelayMs(attempts));
      }
    }
    return DeliveryOutcome.failed(lastKind, attempts, lastError);
  }

  private Attempt sendOnce(String targetId, RelayMessage message) throws InterruptedException {
    Future<SendResult> future = sendExecutor.submit(() -> sender.send(targetId, message));
    try {
      SendResult result = future.get(sendTimeoutMs, TimeUnit.MILLISECONDS);
      return new Attempt(result == null ? SendResult.delivered() : result, null);
    } catch (TimeoutException e) {
      future.cancel(true);
      return new Attempt(SendResult.failed(ErrorKind.TIMEOUT, "no response within " + sendTimeoutMs + " ms"), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      if (cause instanceof RetryAfterException retryAfter) {
        return new Attempt(SendResult.retryAfter(retryAfter.retryAfter()), cause);
      }
      return new Attempt(SendResult.failed(ErrorClassifier.classify(cause), String.valueOf(cause)), cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      throw e;
    }
  }

  private record Attempt(SendResult result, Throwable error) {
  }
}
