package relay.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import relay.select.SelectionStrategy;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RelayPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(RelayProperties.class);
      assertTrue(props.getTargets().isEmpty());
      assertTrue(props.isAutoStart());
      assertEquals(50_000, props.getQueue().getMaxSize());
      assertEquals(Duration.ofSeconds(300), props.getQueue().getMaxItemAge());
      assertEquals(Duration.ofSeconds(1), props.getQueue().getDequeueTimeout());
      assertEquals(Duration.ofSeconds(5), props.getQueue().getDrainTimeout());
      assertEquals(3, props.getRetry().getMaxRetries());
      assertEquals(3, props.getRetry().getSendAttempts());
      assertEquals(Duration.ofSeconds(1), props.getRetry().getSendBaseDelay());
      assertEquals(Duration.ofSeconds(1), props.getRetry().getSendMaxJitter());
      assertEquals(5, props.getRetry().getMaxRetryAfterWaits());
      assertEquals(Duration.ofSeconds(60), props.getRetry().getSendTimeout());
      assertEquals(Duration.ofSeconds(1), props.getRetry().getRequeueBackoffUnit());
      assertEquals(2.0, props.getRetry().getRequeueBackoffFactor());
      assertEquals(Duration.ofSeconds(30), props.getRetry().getRequeueMaxBackoff());
      assertEquals(5, props.getCircuit().getThreshold());
      assertEquals(Duration.ofSeconds(60), props.getCircuit().getTimeout());
      assertEquals(3, props.getCircuit().getUnhealthyThreshold());
      assertEquals(Duration.ofSeconds(180), props.getWorker().getStuckThreshold());
      assertEquals(Duration.ofSeconds(60), props.getWorker().getHealthCheckInterval());
      assertEquals(5, props.getWorker().getErrorThreshold());
      assertEquals(Duration.ofSeconds(1), props.getWorker().getRestartPause());
      assertEquals(SelectionStrategy.SMART, props.getSelection().getStrategy());
      assertTrue(props.getSelection().isAdaptive());
      assertEquals(Duration.ofSeconds(10), props.getRebalance().getInterval());
      assertEquals(10, props.getRebalance().getMinGap());
      assertEquals(20, props.getRebalance().getMaxMoves());
      assertEquals(Duration.ofSeconds(60), props.getReaper().getInterval());
      assertEquals(Duration.ofSeconds(300), props.getReaper().getRetention());
      assertEquals(Duration.ofSeconds(10), props.getMonitor().getInterval());
      assertEquals(Duration.ofSeconds(60), props.getMonitor().getRateWindow());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("relay", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "relay.auto-start=false",
        "relay.targets[0].id=bot-1",
        "relay.targets[0].messages-per-second=10",
        "relay.targets[0].burst-limit=25",
        "relay.targets[0].recovery-time=PT8S",
        "relay.targets[0].adaptive=false",
        "relay.targets[1].id=bot-2",
        "relay.queue.max-size=1000",
        "relay.queue.max-item-age=PT2M",
        "relay.queue.dequeue-timeout=PT0.5S",
        "relay.queue.drain-timeout=PT10S",
        "relay.retry.max-retries=5",
        "relay.retry.send-attempts=2",
        "relay.retry.send-base-delay=PT0.2S",
        "relay.retry.send-max-jitter=PT0.1S",
        "relay.retry.max-retry-after-waits=3",
        "relay.retry.send-timeout=PT30S",
        "relay.retry.requeue-backoff-unit=PT2S",
        "relay.retry.requeue-backoff-factor=3.0",
        "relay.retry.requeue-max-backoff=PT1M",
        "relay.circuit.threshold=10",
        "relay.circuit.timeout=PT2M",
        "relay.circuit.unhealthy-threshold=4",
        "relay.worker.stuck-threshold=PT5M",
        "relay.worker.health-check-interval=PT30S",
        "relay.worker.error-threshold=8",
        "relay.worker.restart-pause=PT2S",
        "relay.selection.strategy=LEAST_LOADED",
        "relay.selection.adaptive=false",
        "relay.rebalance.interval=PT20S",
        "relay.rebalance.min-gap=5",
        "relay.rebalance.max-moves=50",
        "relay.reaper.interval=PT30S",
        "relay.reaper.retention=PT10M",
        "relay.monitor.interval=PT5S",
        "relay.monitor.rate-window=PT30S",
        "relay.metrics.enabled=false",
        "relay.metrics.name-prefix=news.relay"
    ).run(ctx -> {
      var props = ctx.getBean(RelayProperties.class);
      assertFalse(props.isAutoStart());
      assertEquals(2, props.getTargets().size());
      var first = props.getTargets().get(0);
      assertEquals("bot-1", first.getId());
      assertEquals(10.0, first.getMessagesPerSecond());
      assertEquals(25, first.getBurstLimit());
      assertEquals(Duration.ofSeconds(8), first.getRecoveryTime());
      assertFalse(first.isAdaptive());
      var second = props.getTargets().get(1);
      assertEquals("bot-2", second.getId());
      assertEquals(40, second.getBurstLimit());
      assertTrue(second.isAdaptive());
      assertEquals(1000, props.getQueue().getMaxSize());
      assertEquals(Duration.ofMinutes(2), props.getQueue().getMaxItemAge());
      assertEquals(Duration.ofMillis(500), props.getQueue().getDequeueTimeout());
      assertEquals(Duration.ofSeconds(10), props.getQueue().getDrainTimeout());
      assertEquals(5, props.getRetry().getMaxRetries());
      assertEquals(2, props.getRetry().getSendAttempts());
      assertEquals(Duration.ofMillis(200), props.getRetry().getSendBaseDelay());
      assertEquals(Duration.ofMillis(100), props.getRetry().getSendMaxJitter());
      assertEquals(3, props.getRetry().getMaxRetryAfterWaits());
      assertEquals(Duration.ofSeconds(30), props.getRetry().getSendTimeout());
      assertEquals(Duration.ofSeconds(2), props.getRetry().getRequeueBackoffUnit());
      assertEquals(3.0, props.getRetry().getRequeueBackoffFactor());
      assertEquals(Duration.ofMinutes(1), props.getRetry().getRequeueMaxBackoff());
      assertEquals(10, props.getCircuit().getThreshold());
      assertEquals(Duration.ofMinutes(2), props.getCircuit().getTimeout());
      assertEquals(4, props.getCircuit().getUnhealthyThreshold());
      assertEquals(Duration.ofMinutes(5), props.getWorker().getStuckThreshold());
      assertEquals(Duration.ofSeconds(30), props.getWorker().getHealthCheckInterval());
      assertEquals(8, props.getWorker().getErrorThreshold());
      assertEquals(Duration.ofSeconds(2), props.getWorker().getRestartPause());
      assertEquals(SelectionStrategy.LEAST_LOADED, props.getSelection().getStrategy());
      assertFalse(props.getSelection().isAdaptive());
      assertEquals(Duration.ofSeconds(20), props.getRebalance().getInterval());
      assertEquals(5, props.getRebalance().getMinGap());
      assertEquals(50, props.getRebalance().getMaxMoves());
      assertEquals(Duration.ofSeconds(30), props.getReaper().getInterval());
      assertEquals(Duration.ofMinutes(10), props.getReaper().getRetention());
      assertEquals(Duration.ofSeconds(5), props.getMonitor().getInterval());
      assertEquals(Duration.ofSeconds(30), props.getMonitor().getRateWindow());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("news.relay", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(RelayProperties.class)
  static class PropsConfig {
  }
}
