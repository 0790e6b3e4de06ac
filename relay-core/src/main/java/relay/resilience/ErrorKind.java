package relay.resilience;

/**
 * Failure classes surfaced in logs, metrics and statistics. The class never changes
 * how a failure is retried; only an explicit retry-after signal does.
 */
public enum ErrorKind {
  /** Connection, I/O or transport failure. */
  NETWORK(true),
  /** The send ran past its timeout. */
  TIMEOUT(true),
  /** The destination throttled the sender. */
  RATE_LIMITED(true),
  /** The target's circuit was open; nothing was sent. */
  CIRCUIT_OPEN(false),
  /** Any other failure. */
  REJECTED(false);

  private final boolean transientFailure;

  ErrorKind(boolean transientFailure) {
    this.transientFailure = transientFailure;
  }

  /** Whether this class of failure usually clears up on its own. */
  public boolean isTransient() {
    return transientFailure;
  }
}
