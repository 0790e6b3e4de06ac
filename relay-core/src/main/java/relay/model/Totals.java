package relay.model;

/**
 * Engine-wide part of {@link RelayStats}.
 *
 * @param enqueued       submissions accepted
 * @param processed      items delivered
 * @param failed         items dropped after exhausting retries
 * @param expired        items discarded at dequeue for exceeding the maximum age
 * @param evicted        stale items removed by the reaper
 * @param rejected       submissions refused because the queue was full
 * @param pending        items queued or in flight
 * @param processingRate deliveries per second since creation
 * @param successRate    {@code processed / enqueued}, in [0, 1]
 */
public record Totals(
    long enqueued,
    long processed,
    long failed,
    long expired,
    long evicted,
    long rejected,
    int pending,
    double processingRate,
    double successRate) {
}
