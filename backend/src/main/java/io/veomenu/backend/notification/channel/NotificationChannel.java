package io.veomenu.backend.notification.channel;

import io.veomenu.backend.notification.AuthNotification;
import io.veomenu.backend.notification.NotificationDispatchException;

/**
 * Abstraction for notification delivery channels. Each channel handles one delivery mechanism
 * (email, SMS).
 */
public interface NotificationChannel {

  /** Unique identifier for this channel (e.g., "email", "sms"). */
  String channelId();

  /**
   * Delivers a notification via this channel.
   *
   * @throws NotificationDispatchException if the transport rejected the message or the recipient
   *     has no address for this channel
   */
  void deliver(AuthNotification notification);
}
