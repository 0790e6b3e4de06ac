package relay.dispatch;

import relay.queue.QueuedItem;
import relay.resilience.DeliveryOutcome;

/**
 * Cross-cutting hook around each delivery.
 *
 * <p>Interceptors run around the resilience layer:
 * <ol>
 *   <li>{@link #beforeSend} in registration order</li>
 *   <li>Delivery, including in-layer retries</li>
 *   <li>{@link #afterSend} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeSend} throws, the delivery fails without sending and goes through
 * the normal requeue path. {@code afterSend} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * Relay.builder()
 *     .interceptor(DeliveryInterceptor.after((targetId, item, outcome) -> {
 *         if (outcome.isDelivered()) mappings.record(item.message(), targetId);
 *     }))
 *     .build();
 * }</pre>
 */
public interface DeliveryInterceptor {

  /**
   * Called before the item is handed to the sender.
   *
   * @param targetId target about to send
   * @param item     the item
   * @throws Exception to fail the delivery
   */
  default void beforeSend(String targetId, QueuedItem item) throws Exception {
  }

  /**
   * Called once the delivery has an outcome, or after a {@code beforeSend} failure.
   *
   * @param targetId target that handled the item
   * @param item     the item
   * @param outcome  what happened
   */
  default void afterSend(String targetId, QueuedItem item, DeliveryOutcome outcome) {
  }

  /**
   * Creates an interceptor with only a beforeSend hook.
   */
  static DeliveryInterceptor before(BeforeHook hook) {
    return new DeliveryInterceptor() {
      @Override
      public void beforeSend(String targetId, QueuedItem item) throws Exception {
        hook.accept(targetId, item);
      }
    };
  }

  /**
   * Creates an interceptor with only an afterSend hook.
   */
  static DeliveryInterceptor after(AfterHook hook) {
    return new DeliveryInterceptor() {
      @Override
      public void afterSend(String targetId, QueuedItem item, DeliveryOutcome outcome) {
        hook.accept(targetId, item, outcome);
      }
    };
  }

  @FunctionalInterface
  interface BeforeHook {
    void accept(String targetId, QueuedItem item) throws Exception;
  }

  @FunctionalInterface
  interface AfterHook {
    void accept(String targetId, QueuedItem item, DeliveryOutcome outcome);
  }
}
