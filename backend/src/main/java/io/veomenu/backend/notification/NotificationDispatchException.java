package io.veomenu.backend.notification;

/**
 * Raised by a channel when a message could not be handed to its transport. Never surfaces to an
 * HTTP client; the dispatcher records it as a failed channel.
 */
public class NotificationDispatchException extends RuntimeException {

  private final String channelId;

  public NotificationDispatchException(String channelId, String message) {
    super(message);
    this.channelId = channelId;
  }

  public NotificationDispatchException(String channelId, String message, Throwable cause) {
    super(message, cause);
    this.channelId = channelId;
  }

  public String getChannelId() {
    return channelId;
  }
}
