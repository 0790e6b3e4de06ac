package relay.spring.boot;

import relay.Relay;
import relay.RelayConfig;
import relay.dispatch.DeliveryInterceptor;
import relay.ratelimit.RateLimit;
import relay.spi.MetricsExporter;
import relay.spi.PriorityClassifier;
import relay.spi.Sender;
import relay.target.TargetDefinition;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Auto-configuration for the relay dispatch engine.
 *
 * <p>Wires up a {@link Relay} from the application's {@link Sender} bean and
 * {@link RelayProperties}. Optional {@link MetricsExporter}, {@link PriorityClassifier}
 * and {@link DeliveryInterceptor} beans are picked up when present; interceptors are
 * applied in {@code @Order} order.
 *
 * @see RelayProperties
 * @see RelayMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Relay.class)
@ConditionalOnBean(Sender.class)
@EnableConfigurationProperties(RelayProperties.class)
public class RelayAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public RelayConfig relayConfig(RelayProperties props) {
    var queue = props.getQueue();
    var retry = props.getRetry();
    var circuit = props.getCircuit();
    var worker = props.getWorker();
    return RelayConfig.builder()
        .maxQueueSize(queue.getMaxSize())
        .maxItemAge(queue.getMaxItemAge())
        .dequeueTimeout(queue.getDequeueTimeout())
        .drainTimeout(queue.getDrainTimeout())
        .maxRetries(retry.getMaxRetries())
        .sendAttempts(retry.getSendAttempts())
        .sendBackoff(retry.getSendBaseDelay(), retry.getSendMaxJitter())
        .maxRetryAfterWaits(retry.getMaxRetryAfterWaits())
        .sendTimeout(retry.getSendTimeout())
        .requeueBackoff(retry.getRequeueBackoffUnit(), retry.getRequeueBackoffFactor(),
            retry.getRequeueMaxBackoff())
        .circuit(circuit.getThreshold(), circuit.getTimeout())
        .unhealthyThreshold(circuit.getUnhealthyThreshold())
        .workerSupervision(worker.getStuckThreshold(), worker.getHealthCheckInterval(),
            worker.getErrorThreshold(), worker.getRestartPause())
        .selectionStrategy(props.getSelection().getStrategy())
        .adaptiveEnabled(props.getSelection().isAdaptive())
        .rebalance(props.getRebalance().getInterval(), props.getRebalance().getMinGap(),
            props.getRebalance().getMaxMoves())
        .reaperInterval(props.getReaper().getInterval())
        .retention(props.getReaper().getRetention())
        .monitorInterval(props.getMonitor().getInterval())
        .rateWindow(props.getMonitor().getRateWindow())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Relay relay(RelayProperties props,
      RelayConfig relayConfig,
      Sender sender,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<PriorityClassifier> classifierProvider,
      ObjectProvider<DeliveryInterceptor> interceptorProvider) {

    var builder = Relay.builder()
        .sender(sender)
        .targets(targetDefinitions(props.getTargets()))
        .config(relayConfig)
        .interceptors(interceptorProvider.orderedStream().toList());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    PriorityClassifier classifier = classifierProvider.getIfAvailable();
    if (classifier != null) {
      builder.classifier(classifier);
    }

    Relay relay = builder.build();
    if (props.isAutoStart()) {
      relay.start();
    }
    return relay;
  }

  static List<TargetDefinition> targetDefinitions(List<RelayProperties.Target> targets) {
    if (targets.isEmpty()) {
      throw new IllegalStateException("relay.targets must list at least one target");
    }
    return targets.stream()
        .map(t -> new TargetDefinition(t.getId(), new RateLimit(
            t.getMessagesPerSecond(), t.getBurstLimit(), t.getRecoveryTime(), t.isAdaptive())))
        .toList();
  }
}
