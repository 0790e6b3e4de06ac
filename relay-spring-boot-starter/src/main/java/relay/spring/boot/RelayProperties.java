package relay.spring.boot;

import relay.select.SelectionStrategy;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the relay dispatch engine.
 *
 * @see RelayAutoConfiguration
 */
@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

  /**
   * Output channels, in registration order. At least one is required.
   */
  private List<Target> targets = new ArrayList<>();

  /**
   * Whether the relay bean is started once created.
   */
  private boolean autoStart = true;

  private final Queue queue = new Queue();
  private final Retry retry = new Retry();
  private final Circuit circuit = new Circuit();
  private final Worker worker = new Worker();
  private final Selection selection = new Selection();
  private final Rebalance rebalance = new Rebalance();
  private final Reaper reaper = new Reaper();
  private final Monitor monitor = new Monitor();
  private final Metrics metrics = new Metrics();

  public List<Target> getTargets() {
    return targets;
  }

  public void setTargets(List<Target> targets) {
    this.targets = targets;
  }

  public boolean isAutoStart() {
    return autoStart;
  }

  public void setAutoStart(boolean autoStart) {
    this.autoStart = autoStart;
  }

  public Queue getQueue() {
    return queue;
  }

  public Retry getRetry() {
    return retry;
  }

  public Circuit getCircuit() {
    return circuit;
  }

  public Worker getWorker() {
    return worker;
  }

  public Selection getSelection() {
    return selection;
  }

  public Rebalance getRebalance() {
    return rebalance;
  }

  public Reaper getReaper() {
    return reaper;
  }

  public Monitor getMonitor() {
    return monitor;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Target {
    private String id;
    private double messagesPerSecond = 20;
    private int burstLimit = 40;
    private Duration recoveryTime = Duration.ofSeconds(5);
    private boolean adaptive = true;

    public String getId() {
      return id;
    }

    public void setId(String id) {
      this.id = id;
    }

    public double getMessagesPerSecond() {
      return messagesPerSecond;
    }

    public void setMessagesPerSecond(double messagesPerSecond) {
      this.messagesPerSecond = messagesPerSecond;
    }

    public int getBurstLimit() {
      return burstLimit;
    }

    public void setBurstLimit(int burstLimit) {
      this.burstLimit = burstLimit;
    }

    public Duration getRecoveryTime() {
      return recoveryTime;
    }

    public void setRecoveryTime(Duration recoveryTime) {
      this.recoveryTime = recoveryTime;
    }

    public boolean isAdaptive() {
      return adaptive;
    }

    public void setAdaptive(boolean adaptive) {
      this.adaptive = adaptive;
    }
  }

  public static class Queue {
    private int maxSize = 50_000;
    private Duration maxItemAge = Duration.ofSeconds(300);
    private Duration dequeueTimeout = Duration.ofSeconds(1);
    private Duration drainTimeout = Duration.ofSeconds(5);

    public int getMaxSize() {
      return maxSize;
    }

    public void setMaxSize(int maxSize) {
      this.maxSize = maxSize;
    }

    public Duration getMaxItemAge() {
      return maxItemAge;
    }

    public void setMaxItemAge(Duration maxItemAge) {
      this.maxItemAge = maxItemAge;
    }

    public Duration getDequeueTimeout() {
      return dequeueTimeout;
    }

    public void setDequeueTimeout(Duration dequeueTimeout) {
      this.dequeueTimeout = dequeueTimeout;
    }

    public Duration getDrainTimeout() {
      return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
    }
  }

  public static class Retry {
    /**
     * Requeues allowed per item before it is dropped.
     */
    private int maxRetries = 3;
    /**
     * Attempts per delivery inside the resilience layer.
     */
    private int sendAttempts = 3;
    private Duration sendBaseDelay = Duration.ofSeconds(1);
    private Duration sendMaxJitter = Duration.ofSeconds(1);
    private int maxRetryAfterWaits = 5;
    private Duration sendTimeout = Duration.ofSeconds(60);
    private Duration requeueBackoffUnit = Duration.ofSeconds(1);
    private double requeueBackoffFactor = 2.0;
    private Duration requeueMaxBackoff = Duration.ofSeconds(30);

    public int getMaxRetries() {
      return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
    }

    public int getSendAttempts() {
      return sendAttempts;
    }

    public void setSendAttempts(int sendAttempts) {
      this.sendAttempts = sendAttempts;
    }

    public Duration getSendBaseDelay() {
      return sendBaseDelay;
    }

    public void setSendBaseDelay(Duration sendBaseDelay) {
      this.sendBaseDelay = sendBaseDelay;
    }

    public Duration getSendMaxJitter() {
      return sendMaxJitter;
    }

    public void setSendMaxJitter(Duration sendMaxJitter) {
      this.sendMaxJitter = sendMaxJitter;
    }

    public int getMaxRetryAfterWaits() {
      return maxRetryAfterWaits;
    }

    public void setMaxRetryAfterWaits(int maxRetryAfterWaits) {
      this.maxRetryAfterWaits = maxRetryAfterWaits;
    }

    public Duration getSendTimeout() {
      return sendTimeout;
    }

    public void setSendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
    }

    public Duration getRequeueBackoffUnit() {
      return requeueBackoffUnit;
    }

    public void setRequeueBackoffUnit(Duration requeueBackoffUnit) {
      this.requeueBackoffUnit = requeueBackoffUnit;
    }

    public double getRequeueBackoffFactor() {
      return requeueBackoffFactor;
    }

    public void setRequeueBackoffFactor(double requeueBackoffFactor) {
      this.requeueBackoffFactor = requeueBackoffFactor;
    }

    public Duration getRequeueMaxBackoff() {
      return requeueMaxBackoff;
    }

    public void setRequeueMaxBackoff(Duration requeueMaxBackoff) {
      this.requeueMaxBackoff = requeueMaxBackoff;
    }
  }

  public static class Circuit {
    private int threshold = 5;
    private Duration timeout = Duration.ofSeconds(60);
    /**
     * Consecutive failures that exclude a target from selection and rebalancing.
     */
    private int unhealthyThreshold = 3;

    public int getThreshold() {
      return threshold;
    }

    public void setThreshold(int threshold) {
      this.threshold = threshold;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }

    public int getUnhealthyThreshold() {
      return unhealthyThreshold;
    }

    public void setUnhealthyThreshold(int unhealthyThreshold) {
      this.unhealthyThreshold = unhealthyThreshold;
    }
  }

  public static class Worker {
    private Duration stuckThreshold = Duration.ofSeconds(180);
    private Duration healthCheckInterval = Duration.ofSeconds(60);
    private int errorThreshold = 5;
    private Duration restartPause = Duration.ofSeconds(1);

    public Duration getStuckThreshold() {
      return stuckThreshold;
    }

    public void setStuckThreshold(Duration stuckThreshold) {
      this.stuckThreshold = stuckThreshold;
    }

    public Duration getHealthCheckInterval() {
      return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
      this.healthCheckInterval = healthCheckInterval;
    }

    public int getErrorThreshold() {
      return errorThreshold;
    }

    public void setErrorThreshold(int errorThreshold) {
      this.errorThreshold = errorThreshold;
    }

    public Duration getRestartPause() {
      return restartPause;
    }

    public void setRestartPause(Duration restartPause) {
      this.restartPause = restartPause;
    }
  }

  public static class Selection {
    private SelectionStrategy strategy = SelectionStrategy.SMART;
    /**
     * Enables adaptive rate limits and the periodic rebalancer.
     */
    private boolean adaptive = true;

    public SelectionStrategy getStrategy() {
      return strategy;
    }

    public void setStrategy(SelectionStrategy strategy) {
      this.strategy = strategy;
    }

    public boolean isAdaptive() {
      return adaptive;
    }

    public void setAdaptive(boolean adaptive) {
      this.adaptive = adaptive;
    }
  }

  public static class Rebalance {
    private Duration interval = Duration.ofSeconds(10);
    private int minGap = 10;
    private int maxMoves = 20;

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public int getMinGap() {
      return minGap;
    }

    public void setMinGap(int minGap) {
      this.minGap = minGap;
    }

    public int getMaxMoves() {
      return maxMoves;
    }

    public void setMaxMoves(int maxMoves) {
      this.maxMoves = maxMoves;
    }
  }

  public static class Reaper {
    private Duration interval = Duration.ofSeconds(60);
    private Duration retention = Duration.ofSeconds(300);

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Duration getRetention() {
      return retention;
    }

    public void setRetention(Duration retention) {
      this.retention = retention;
    }
  }

  public static class Monitor {
    private Duration interval = Duration.ofSeconds(10);
    /**
     * Length of the sliding window used for per-target rate tracking.
     */
    private Duration rateWindow = Duration.ofSeconds(60);

    public Duration getInterval() {
      return interval;
    }

    public void setInterval(Duration interval) {
      this.interval = interval;
    }

    public Duration getRateWindow() {
      return rateWindow;
    }

    public void setRateWindow(Duration rateWindow) {
      this.rateWindow = rateWindow;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "relay";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
