/**
 * Per-target priority heaps and the {@link relay.queue.QueuedItem} they hold.
 */
package relay.queue;
