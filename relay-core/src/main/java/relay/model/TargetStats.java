package relay.model;

/**
 * Per-target part of {@link RelayStats}.
 *
 * @param queueSize           items waiting on this target
 * @param currentLoad         items being delivered by this target
 * @param processed           acknowledged deliveries, successful or not
 * @param successRate         in [0, 1]
 * @param avgProcessingTime   seconds
 * @param consecutiveFailures current failure streak
 * @param rateLimited         whether the target is cooling down
 * @param circuitOpen         whether sends to the target are short-circuited
 * @param messagesPerSecond   current nominal rate
 * @param burstLimit          current burst limit
 * @param workerState         state of the target's worker
 */
public record TargetStats(
    int queueSize,
    int currentLoad,
    long processed,
    double successRate,
    double avgProcessingTime,
    int consecutiveFailures,
    boolean rateLimited,
    boolean circuitOpen,
    double messagesPerSecond,
    int burstLimit,
    WorkerState workerState) {
}
