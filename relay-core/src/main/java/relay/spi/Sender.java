package relay.spi;

import relay.RelayMessage;
import relay.SendResult;

/**
 * The external send function: delivers one message through one target.
 *
 * <p>The dispatch engine never builds protocol messages itself. Text transformation,
 * deduplication and destination routing are expected to be done upstream of
 * {@code submit}; recording source-to-destination id mappings belongs in a
 * {@link relay.dispatch.DeliveryInterceptor}.
 *
 * <p>Implementations must be thread-safe: each target's worker calls {@code send}
 * concurrently with the others. A call that runs past the configured send timeout is
 * interrupted and counted as a {@link relay.resilience.ErrorKind#TIMEOUT} failure.
 */
@FunctionalInterface
public interface Sender {

  /**
   * Sends a message.
   *
   * @param targetId id of the output channel to use
   * @param message  the message to deliver
   * @return the outcome; {@code null} is treated as delivered
   * @throws Exception on failure, classified by {@link relay.resilience.ErrorClassifier}
   */
  SendResult send(String targetId, RelayMessage message) throws Exception;
}
