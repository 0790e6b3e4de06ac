package relay.resilience;

/**
 * What happened to one delivery after the resilience layer is done with it.
 *
 * @param status   terminal status of the delivery
 * @param kind     failure class; {@code null} when delivered
 * @param attempts sends actually made, retry-after waits excluded
 * @param error    last failure, may be {@code null}
 */
public record DeliveryOutcome(Status status, ErrorKind kind, int attempts, Throwable error) {

  public enum Status {
    DELIVERED,
    FAILED,
    /** Not attempted because the target's circuit was open. */
    SKIPPED
  }

  public static DeliveryOutcome delivered(int attempts) {
    return new DeliveryOutcome(Status.DELIVERED, null, attempts, null);
  }

  public static DeliveryOutcome failed(ErrorKind kind, int attempts, Throwable error) {
    return new DeliveryOutcome(Status.FAILED, kind, attempts, error);
  }

  public static DeliveryOutcome skipped() {
    return new DeliveryOutcome(Status.SKIPPED, ErrorKind.CIRCUIT_OPEN, 0, null);
  }

  public boolean isDelivered() {
    return status == Status.DELIVERED;
  }
}
