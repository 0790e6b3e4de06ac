package relay.model;

/**
 * Lifecycle of one target worker.
 */
public enum WorkerState {
  /** Not started yet, paused, or between items. */
  IDLE,
  /** Waiting on the target's heaps. */
  DEQUEUING,
  /** Delivering an item. */
  PROCESSING,
  /** Soft restart in progress after repeated errors or inactivity. */
  RESTARTING,
  STOPPED
}
