package io.veomenu.backend.notification.channel;

import io.veomenu.backend.notification.AuthNotification;
import io.veomenu.backend.notification.NotificationDispatchException;
import io.veomenu.backend.notification.NotificationMessages;
import io.veomenu.backend.notification.integration.sms.SmsMessage;
import io.veomenu.backend.notification.integration.sms.SmsProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Sends one-time codes by text message through the configured {@link SmsProvider}. */
@Component
public class SmsNotificationChannel implements NotificationChannel {

  public static final String CHANNEL_ID = "sms";

  private static final Logger log = LoggerFactory.getLogger(SmsNotificationChannel.class);

  private final SmsProvider smsProvider;

  public SmsNotificationChannel(SmsProvider smsProvider) {
    this.smsProvider = smsProvider;
  }

  @Override
  public String channelId() {
    return CHANNEL_ID;
  }

  @Override
  public void deliver(AuthNotification notification) {
    String to = notification.recipientPhone();
    if (to == null || to.isBlank()) {
      throw new NotificationDispatchException(CHANNEL_ID, "No recipient phone");
    }

    var message = new SmsMessage(to, NotificationMessages.smsBody(notification));
    var result = smsProvider.sendSms(message);
    if (!result.success()) {
      throw new NotificationDispatchException(
          CHANNEL_ID, "SMS provider " + smsProvider.providerId() + ": " + result.errorMessage());
    }
    log.debug("Sent {} text via {}", notification.type(), smsProvider.providerId());
  }
}
