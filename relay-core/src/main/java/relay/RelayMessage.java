package relay;

import com.github.f4b6a3.ulid.UlidCreator;
import relay.model.Priority;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable envelope for one message relayed from a source feed to a destination.
 *
 * <p>The {@code payload} is opaque to the dispatch engine and is handed unchanged to
 * the {@link relay.spi.Sender}. The remaining fields are content hints used once, at
 * submission time, to derive the item's {@link Priority} and estimated processing cost.
 * Each message is assigned a ULID-based {@code messageId} by default.
 *
 * @see relay.spi.PriorityClassifier
 */
public final class RelayMessage {
  private final String messageId;
  private final Object payload;
  private final String text;
  private final boolean reply;
  private final boolean media;
  private final Priority priority;
  private final Instant occurredAt;
  private final Map<String, String> headers;

  private RelayMessage(Builder builder) {
    this.messageId = builder.messageId == null ? newMessageId() : builder.messageId;
    if (this.messageId.isEmpty()) {
      throw new IllegalArgumentException("messageId cannot be empty");
    }
    this.payload = Objects.requireNonNull(builder.payload, "payload");
    this.text = builder.text;
    this.reply = builder.reply;
    this.media = builder.media;
    this.priority = builder.priority;
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;

    Map<String, String> headerCopy = builder.headers == null
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    if (headerCopy.containsKey(null)) {
      throw new IllegalArgumentException("headers cannot contain null keys");
    }
    if (headerCopy.containsValue(null)) {
      throw new IllegalArgumentException("headers cannot contain null values");
    }
    this.headers = headerCopy;
  }

  /**
   * Creates a builder around an opaque payload.
   *
   * @param payload the payload handed to the sender, never {@code null}
   * @return a new builder
   */
  public static Builder builder(Object payload) {
    return new Builder(payload);
  }

  /**
   * Creates a plain text message with no other hints.
   *
   * @param text the message text, used both as payload and as length hint
   * @return a new message
   */
  public static RelayMessage ofText(String text) {
    return builder(text).text(text).build();
  }

  public String messageId() {
    return messageId;
  }

  public Object payload() {
    return payload;
  }

  /**
   * Returns the message text used for the length hint, or {@code null} if the
   * message carries no text.
   *
   * @return the text, or {@code null}
   */
  public String text() {
    return text;
  }

  public boolean isReply() {
    return reply;
  }

  public boolean hasMedia() {
    return media;
  }

  /**
   * Returns the caller-assigned priority, or {@code null} when the priority should be
   * derived from content hints.
   *
   * @return the explicit priority, or {@code null}
   */
  public Priority priority() {
    return priority;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  public Map<String, String> headers() {
    return headers;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("RelayMessage{messageId=").append(messageId);
    if (reply) {
      sb.append(", reply");
    }
    if (media) {
      sb.append(", media");
    }
    if (text != null) {
      sb.append(", textLength=").append(text.length());
    }
    if (priority != null) {
      sb.append(", priority=").append(priority);
    }
    return sb.append('}').toString();
  }

  /**
   * Builder for {@link RelayMessage}.
   */
  public static final class Builder {
    private final Object payload;
    private String messageId;
    private String text;
    private boolean reply;
    private boolean media;
    private Priority priority;
    private Instant occurredAt;
    private Map<String, String> headers;

    private Builder(Object payload) {
      this.payload = payload;
    }

    /**
     * Sets a custom message identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param messageId the message identifier
     * @return this builder
     */
    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    /**
     * Sets the message text used as the length hint.
     *
     * @param text the text, may be {@code null}
     * @return this builder
     */
    public Builder text(String text) {
      this.text = text;
      return this;
    }

    /**
     * Marks the message as a reply to an earlier message.
     *
     * @param reply whether the message is a reply
     * @return this builder
     */
    public Builder reply(boolean reply) {
      this.reply = reply;
      return this;
    }

    /**
     * Marks the message as carrying media (photo, video, document...).
     *
     * @param media whether the message carries media
     * @return this builder
     */
    public Builder media(boolean media) {
      this.media = media;
      return this;
    }

    /**
     * Assigns an explicit priority, bypassing content classification.
     *
     * @param priority the priority, or {@code null} to classify by content
     * @return this builder
     */
    public Builder priority(Priority priority) {
      this.priority = priority;
      return this;
    }

    /**
     * Sets the time the message was observed on the source feed.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param occurredAt the source timestamp
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Sets free-form headers carried to the sender (source chat, source message id...).
     *
     * @param headers header map; copied on build
     * @return this builder
     */
    public Builder headers(Map<String, String> headers) {
      this.headers = headers;
      return this;
    }

    public RelayMessage build() {
      return new RelayMessage(this);
    }
  }

  private static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
