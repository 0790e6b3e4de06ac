/**
 * The queue manager and worker pool.
 *
 * <p>{@link relay.dispatch.DispatchQueue} owns admission, dequeue, acknowledgement and
 * requeue; {@link relay.dispatch.RelayDispatcher} runs one
 * {@link relay.dispatch.TargetWorker} per target on top of it.
 */
package relay.dispatch;
