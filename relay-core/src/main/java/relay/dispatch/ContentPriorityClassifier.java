package relay.dispatch;

import relay.RelayMessage;
import relay.model.Priority;
import relay.spi.PriorityClassifier;

/**
 * Default classifier working from the message's content hints.
 *
 * <p>Replies and media are {@link Priority#HIGH}; text longer than
 * {@value #LONG_TEXT_CHARS} characters is {@link Priority#LOW}; everything else is
 * {@link Priority#NORMAL}. Cost is {@code 0.5s + length/10000 + 2s for media + 0.5s for
 * replies}, capped at {@value #MAX_COST_SECONDS} seconds.
 */
public final class ContentPriorityClassifier implements PriorityClassifier {
  static final int LONG_TEXT_CHARS = 1000;
  static final double MAX_COST_SECONDS = 10.0;

  @Override
  public Priority classify(RelayMessage message) {
    if (message.isReply() || message.hasMedia()) {
      return Priority.HIGH;
    }
    String text = message.text();
    if (text != null && text.length() > LONG_TEXT_CHARS) {
      return Priority.LOW;
    }
    return Priority.NORMAL;
  }

  @Override
  public double estimateCostSeconds(RelayMessage message) {
    double cost = 0.5;
    if (message.text() != null) {
      cost += message.text().length() / 10_000.0;
    }
    if (message.hasMedia()) {
      cost += 2.0;
    }
    if (message.isReply()) {
      cost += 0.5;
    }
    return Math.min(cost, MAX_COST_SECONDS);
  }
}
