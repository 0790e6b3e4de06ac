package relay.spi;

import relay.RelayMessage;
import relay.model.Priority;

/**
 * Derives an item's priority class and estimated processing cost from content hints,
 * once, at submission time.
 *
 * @see relay.dispatch.ContentPriorityClassifier
 */
public interface PriorityClassifier {

  /**
   * Classifies a message. Called only when the message carries no explicit priority.
   *
   * @param message the submitted message
   * @return its priority class, never {@code null}
   */
  Priority classify(RelayMessage message);

  /**
   * Estimates how long delivering the message will take.
   *
   * @param message the submitted message
   * @return estimated seconds
   */
  default double estimateCostSeconds(RelayMessage message) {
    return 1.0;
  }
}
