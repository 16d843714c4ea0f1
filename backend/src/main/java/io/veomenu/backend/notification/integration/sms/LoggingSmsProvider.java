package io.veomenu.backend.notification.integration.sms;

import io.veomenu.backend.notification.integration.SendResult;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Default SMS provider until a gateway is configured. Logs the recipient only. */
public class LoggingSmsProvider implements SmsProvider {

  private static final Logger log = LoggerFactory.getLogger(LoggingSmsProvider.class);

  @Override
  public String providerId() {
    return "log";
  }

  @Override
  public SendResult sendSms(SmsMessage message) {
    log.info("Logging SMS provider: would send text to {}", message.to());
    return new SendResult(true, "LOG-" + UUID.randomUUID(), null);
  }
}
