package io.veomenu.backend.notification.integration.sms;

import io.veomenu.backend.notification.integration.SendResult;

/** Port for sending text messages via an external SMS gateway. */
public interface SmsProvider {

  String providerId();

  SendResult sendSms(SmsMessage message);
}
