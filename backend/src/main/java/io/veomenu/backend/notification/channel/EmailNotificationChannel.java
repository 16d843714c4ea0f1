package io.veomenu.backend.notification.channel;

import io.veomenu.backend.notification.AuthNotification;
import io.veomenu.backend.notification.NotificationDispatchException;
import io.veomenu.backend.notification.NotificationMessages;
import io.veomenu.backend.notification.integration.email.EmailMessage;
import io.veomenu.backend.notification.integration.email.EmailProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Sends plain-text authentication emails through the configured {@link EmailProvider}. */
@Component
public class EmailNotificationChannel implements NotificationChannel {

  public static final String CHANNEL_ID = "email";

  private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

  private final EmailProvider emailProvider;

  public EmailNotificationChannel(EmailProvider emailProvider) {
    this.emailProvider = emailProvider;
  }

  @Override
  public String channelId() {
    return CHANNEL_ID;
  }

  @Override
  public void deliver(AuthNotification notification) {
    String to = notification.recipientEmail();
    if (to == null || to.isBlank()) {
      throw new NotificationDispatchException(CHANNEL_ID, "No recipient email");
    }

    var message =
        new EmailMessage(
            to,
            NotificationMessages.emailSubject(notification),
            NotificationMessages.emailBody(notification));
    var result = emailProvider.sendEmail(message);
    if (!result.success()) {
      throw new NotificationDispatchException(
          CHANNEL_ID,
          "Email provider " + emailProvider.providerId() + ": " + result.errorMessage());
    }
    log.debug(
        "Sent {} email via {} (messageId={})",
        notification.type(),
        emailProvider.providerId(),
        result.providerMessageId());
  }
}
