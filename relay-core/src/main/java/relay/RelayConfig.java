package relay;

import relay.select.SelectionStrategy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable, validated tuning for a {@link Relay}.
 *
 * <p>Every field has a default; {@code RelayConfig.defaults()} is a working
 * configuration. Validation happens once, in {@link Builder#build()}.
 */
public final class RelayConfig {
  private final int maxQueueSize;
  private final int maxRetries;
  private final Duration maxItemAge;
  private final Duration retention;
  private final Duration requeueBackoffUnit;
  private final double requeueBackoffFactor;
  private final Duration requeueMaxBackoff;
  private final int sendAttempts;
  private final Duration sendBaseDelay;
  private final Duration sendMaxJitter;
  private final int maxRetryAfterWaits;
  private final Duration sendTimeout;
  private final int circuitThreshold;
  private final Duration circuitTimeout;
  private final int unhealthyThreshold;
  private final Duration rateWindow;
  private final Duration dequeueTimeout;
  private final Duration stuckThreshold;
  private final Duration healthCheckInterval;
  private final int workerErrorThreshold;
  private final Duration restartPause;
  private final Duration monitorInterval;
  private final Duration rebalanceInterval;
  private final Duration reaperInterval;
  private final int rebalanceMinGap;
  private final int rebalanceMaxMoves;
  private final SelectionStrategy selectionStrategy;
  private final boolean adaptiveEnabled;
  private final Duration drainTimeout;
  private final Clock clock;

  private RelayConfig(Builder b) {
    this.maxQueueSize = positive("maxQueueSize", b.maxQueueSize);
    this.maxRetries = positive("maxRetries", b.maxRetries);
    this.maxItemAge = positive("maxItemAge", b.maxItemAge);
    this.retention = nonNegative("retention", b.retention);
    if (retention.compareTo(maxItemAge) < 0) {
      throw new IllegalArgumentException("retention must be >= maxItemAge (" + maxItemAge + "), got: " + retention);
    }
    this.requeueBackoffUnit = nonNegative("requeueBackoffUnit", b.requeueBackoffUnit);
    if (!(b.requeueBackoffFactor >= 1.0)) {
      throw new IllegalArgumentException("requeueBackoffFactor must be >= 1, got: " + b.requeueBackoffFactor);
    }
    this.requeueBackoffFactor = b.requeueBackoffFactor;
    this.requeueMaxBackoff = nonNegative("requeueMaxBackoff", b.requeueMaxBackoff);
    this.sendAttempts = positive("sendAttempts", b.sendAttempts);
    this.sendBaseDelay = nonNegative("sendBaseDelay", b.sendBaseDelay);
    this.sendMaxJitter = nonNegative("sendMaxJitter", b.sendMaxJitter);
    if (b.maxRetryAfterWaits < 0) {
      throw new IllegalArgumentException("maxRetryAfterWaits must be >= 0, got: " + b.maxRetryAfterWaits);
    }
    this.maxRetryAfterWaits = b.maxRetryAfterWaits;
    this.sendTimeout = positive("sendTimeout", b.sendTimeout);
    this.circuitThreshold = positive("circuitThreshold", b.circuitThreshold);
    this.circuitTimeout = nonNegative("circuitTimeout", b.circuitTimeout);
    this.unhealthyThreshold = positive("unhealthyThreshold", b.unhealthyThreshold);
    this.rateWindow = positive("rateWindow", b.rateWindow);
    this.dequeueTimeout = positive("dequeueTimeout", b.dequeueTimeout);
    this.stuckThreshold = positive("stuckThreshold", b.stuckThreshold);
    this.healthCheckInterval = positive("healthCheckInterval", b.healthCheckInterval);
    this.workerErrorThreshold = positive("workerErrorThreshold", b.workerErrorThreshold);
    this.restartPause = nonNegative("restartPause", b.restartPause);
    this.monitorInterval = positive("monitorInterval", b.monitorInterval);
    this.rebalanceInterval = positive("rebalanceInterval", b.rebalanceInterval);
    this.reaperInterval = positive("reaperInterval", b.reaperInterval);
    this.rebalanceMinGap = positive("rebalanceMinGap", b.rebalanceMinGap);
    this.rebalanceMaxMoves = positive("rebalanceMaxMoves", b.rebalanceMaxMoves);
    this.selectionStrategy = Objects.requireNonNull(b.selectionStrategy, "selectionStrategy");
    this.adaptiveEnabled = b.adaptiveEnabled;
    this.drainTimeout = nonNegative("drainTimeout", b.drainTimeout);
    this.clock = Objects.requireNonNull(b.clock, "clock");
  }

  public static Builder builder() {
    return new Builder();
  }

  public static RelayConfig defaults() {
    return builder().build();
  }

  /** Aggregate cap on queued plus in-flight items. */
  public int maxQueueSize() {
    return maxQueueSize;
  }

  /** Requeues allowed per item before it is dropped as a permanent failure. */
  public int maxRetries() {
    return maxRetries;
  }

  /** Items older than this are discarded at dequeue. */
  public Duration maxItemAge() {
    return maxItemAge;
  }

  /** Reaper retention window. Never shorter than {@link #maxItemAge()}. */
  public Duration retention() {
    return retention;
  }

  public Duration requeueBackoffUnit() {
    return requeueBackoffUnit;
  }

  public double requeueBackoffFactor() {
    return requeueBackoffFactor;
  }

  public Duration requeueMaxBackoff() {
    return requeueMaxBackoff;
  }

  /** Send attempts per delivery inside the resilience layer. */
  public int sendAttempts() {
    return sendAttempts;
  }

  public Duration sendBaseDelay() {
    return sendBaseDelay;
  }

  public Duration sendMaxJitter() {
    return sendMaxJitter;
  }

  public int maxRetryAfterWaits() {
    return maxRetryAfterWaits;
  }

  public Duration sendTimeout() {
    return sendTimeout;
  }

  public int circuitThreshold() {
    return circuitThreshold;
  }

  public Duration circuitTimeout() {
    return circuitTimeout;
  }

  /** Consecutive failures that make a target ineligible for selection and rebalancing. */
  public int unhealthyThreshold() {
    return unhealthyThreshold;
  }

  public Duration rateWindow() {
    return rateWindow;
  }

  public Duration dequeueTimeout() {
    return dequeueTimeout;
  }

  public Duration stuckThreshold() {
    return stuckThreshold;
  }

  public Duration healthCheckInterval() {
    return healthCheckInterval;
  }

  public int workerErrorThreshold() {
    return workerErrorThreshold;
  }

  public Duration restartPause() {
    return restartPause;
  }

  public Duration monitorInterval() {
    return monitorInterval;
  }

  public Duration rebalanceInterval() {
    return rebalanceInterval;
  }

  public Duration reaperInterval() {
    return reaperInterval;
  }

  public int rebalanceMinGap() {
    return rebalanceMinGap;
  }

  public int rebalanceMaxMoves() {
    return rebalanceMaxMoves;
  }

  public SelectionStrategy selectionStrategy() {
    return selectionStrategy;
  }

  public boolean adaptiveEnabled() {
    return adaptiveEnabled;
  }

  public Duration drainTimeout() {
    return drainTimeout;
  }

  public Clock clock() {
    return clock;
  }

  private static int positive(String name, int value) {
    if (value <= 0) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
    return value;
  }

  private static Duration positive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be > 0, got: " + value);
    }
    return value;
  }

  private static Duration nonNegative(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative()) {
      throw new IllegalArgumentException(name + " must be >= 0, got: " + value);
    }
    return value;
  }

  /** Builder for {@link RelayConfig}. */
  public static final class Builder {
    private int maxQueueSize = 50_000;
    private int maxRetries = 3;
    private Duration maxItemAge = Duration.ofSeconds(300);
    private Duration retention = Duration.ofSeconds(300);
    private Duration requeueBackoffUnit = Duration.ofSeconds(1);
    private double requeueBackoffFactor = 2.0;
    private Duration requeueMaxBackoff = Duration.ofSeconds(30);
    private int sendAttempts = 3;
    private Duration sendBaseDelay = Duration.ofSeconds(1);
    private Duration sendMaxJitter = Duration.ofSeconds(1);
    private int maxRetryAfterWaits = 5;
    private Duration sendTimeout = Duration.ofSeconds(60);
    private int circuitThreshold = 5;
    private Duration circuitTimeout = Duration.ofSeconds(60);
    private int unhealthyThreshold = 3;
    private Duration rateWindow = Duration.ofSeconds(60);
    private Duration dequeueTimeout = Duration.ofSeconds(1);
    private Duration stuckThreshold = Duration.ofSeconds(180);
    private Duration healthCheckInterval = Duration.ofSeconds(60);
    private int workerErrorThreshold = 5;
    private Duration restartPause = Duration.ofSeconds(1);
    private Duration monitorInterval = Duration.ofSeconds(10);
    private Duration rebalanceInterval = Duration.ofSeconds(10);
    private Duration reaperInterval = Duration.ofSeconds(60);
    private int rebalanceMinGap = 10;
    private int rebalanceMaxMoves = 20;
    private SelectionStrategy selectionStrategy = SelectionStrategy.SMART;
    private boolean adaptiveEnabled = true;
    private Duration drainTimeout = Duration.ofSeconds(5);
    private Clock clock = Clock.systemUTC();

    private Builder() {}

    /**
     * Sets the aggregate cap on queued plus in-flight items; submissions beyond it are
     * rejected.
     *
     * <p>Optional. Defaults to {@code 50000}. Must be &gt; 0.
     *
     * @param maxQueueSize the cap
     * @return this builder
     */
    public Builder maxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    /**
     * Sets how many times an item may be requeued after failed deliveries.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &gt; 0.
     *
     * @param maxRetries the per-item retry budget
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the age past which queued items are discarded at dequeue.
     *
     * <p>Optional. Defaults to {@code 300s}.
     */
    public Builder maxItemAge(Duration maxItemAge) {
      this.maxItemAge = maxItemAge;
      return this;
    }

    /**
     * Sets how long items are kept before the reaper evicts them. Must be at least
     * the maximum item age.
     *
     * <p>Optional. Defaults to {@code 300s}.
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the requeue delay curve {@code min(max, unit * factor^(retry-1))}.
     *
     * <p>Optional. Defaults to {@code 1s}, {@code 2}, {@code 30s}.
     *
     * @param unit   delay of the first requeue
     * @param factor growth factor, &ge; 1
     * @param max    delay cap
     * @return this builder
     */
    public Builder requeueBackoff(Duration unit, double factor, Duration max) {
      this.requeueBackoffUnit = unit;
      this.requeueBackoffFactor = factor;
      this.requeueMaxBackoff = max;
      return this;
    }

    /**
     * Sets the number of send attempts per delivery.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder sendAttempts(int sendAttempts) {
      this.sendAttempts = sendAttempts;
      return this;
    }

    /**
     * Sets the backoff between send attempts: {@code base * 2^(attempt-1)} plus up to
     * {@code maxJitter} of random jitter.
     *
     * <p>Optional. Defaults to {@code 1s} and {@code 1s}.
     */
    public Builder sendBackoff(Duration base, Duration maxJitter) {
      this.sendBaseDelay = base;
      this.sendMaxJitter = maxJitter;
      return this;
    }

    /**
     * Sets how many retry-after signals one delivery honors before giving up.
     *
     * <p>Optional. Defaults to {@code 5}.
     */
    public Builder maxRetryAfterWaits(int maxRetryAfterWaits) {
      this.maxRetryAfterWaits = maxRetryAfterWaits;
      return this;
    }

    /**
     * Sets the per-send timeout guard.
     *
     * <p>Optional. Defaults to {@code 60s}.
     */
    public Builder sendTimeout(Duration sendTimeout) {
      this.sendTimeout = sendTimeout;
      return this;
    }

    /**
     * Sets the consecutive failures that open a target's circuit and how long it stays
     * open.
     *
     * <p>Optional. Defaults to {@code 5} and {@code 60s}.
     */
    public Builder circuit(int threshold, Duration timeout) {
      this.circuitThreshold = threshold;
      this.circuitTimeout = timeout;
      return this;
    }

    /**
     * Sets the consecutive failures at which a target stops receiving new work from the
     * selection engine and the rebalancer.
     *
     * <p>Optional. Defaults to {@code 3}.
     */
    public Builder unhealthyThreshold(int unhealthyThreshold) {
      this.unhealthyThreshold = unhealthyThreshold;
      return this;
    }

    /**
     * Sets the length of each target's sliding send window.
     *
     * <p>Optional. Defaults to {@code 60s}.
     */
    public Builder rateWindow(Duration rateWindow) {
      this.rateWindow = rateWindow;
      return this;
    }

    /**
     * Sets how long an idle worker blocks waiting for items before re-checking state.
     *
     * <p>Optional. Defaults to {@code 1s}.
     */
    public Builder dequeueTimeout(Duration dequeueTimeout) {
      this.dequeueTimeout = dequeueTimeout;
      return this;
    }

    /**
     * Sets worker supervision: inactivity that counts as stuck, how often workers check
     * themselves, consecutive errors that force a restart, and the pause a restart takes.
     *
     * <p>Optional. Defaults to {@code 180s}, {@code 60s}, {@code 5}, {@code 1s}.
     */
    public Builder workerSupervision(Duration stuckThreshold, Duration healthCheckInterval,
        int workerErrorThreshold, Duration restartPause) {
      this.stuckThreshold = stuckThreshold;
      this.healthCheckInterval = healthCheckInterval;
      this.workerErrorThreshold = workerErrorThreshold;
      this.restartPause = restartPause;
      return this;
    }

    /**
     * Sets the health monitor interval.
     *
     * <p>Optional. Defaults to {@code 10s}.
     */
    public Builder monitorInterval(Duration monitorInterval) {
      this.monitorInterval = monitorInterval;
      return this;
    }

    /**
     * Sets the rebalancer interval and its move limits.
     *
     * <p>Optional. Defaults to {@code 10s}, minimum gap {@code 10}, at most {@code 20}
     * moves per pass.
     */
    public Builder rebalance(Duration interval, int minGap, int maxMoves) {
      this.rebalanceInterval = interval;
      this.rebalanceMinGap = minGap;
      this.rebalanceMaxMoves = maxMoves;
      return this;
    }

    /**
     * Sets the reaper interval.
     *
     * <p>Optional. Defaults to {@code 60s}.
     */
    public Builder reaperInterval(Duration reaperInterval) {
      this.reaperInterval = reaperInterval;
      return this;
    }

    /**
     * Sets the initial selection strategy. Can be changed at runtime.
     *
     * <p>Optional. Defaults to {@link SelectionStrategy#SMART}.
     */
    public Builder selectionStrategy(SelectionStrategy selectionStrategy) {
      this.selectionStrategy = selectionStrategy;
      return this;
    }

    /**
     * Enables adaptive rate tuning and rebalancing. Can be changed at runtime.
     *
     * <p>Optional. Defaults to {@code true}.
     */
    public Builder adaptiveEnabled(boolean adaptiveEnabled) {
      this.adaptiveEnabled = adaptiveEnabled;
      return this;
    }

    /**
     * Sets how long {@code close()} waits for in-flight sends.
     *
     * <p>Optional. Defaults to {@code 5s}.
     */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    /**
     * Sets the time source for item timestamps, cooldowns and circuit timing.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration
     * @throws NullPointerException     if a duration, the strategy or the clock is null
     * @throws IllegalArgumentException if a value is out of range
     */
    public RelayConfig build() {
      return new RelayConfig(this);
    }
  }
}
