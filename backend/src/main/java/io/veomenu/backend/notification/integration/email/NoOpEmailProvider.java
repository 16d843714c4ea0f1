package io.veomenu.backend.notification.integration.email;

import io.veomenu.backend.notification.integration.SendResult;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback used when no SMTP configuration is present. Logs the envelope instead of sending; the
 * body is not logged because it carries codes and links.
 */
public class NoOpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(NoOpEmailProvider.class);

  @Override
  public String providerId() {
    return "noop";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    log.info("NoOp email: would send to {} with subject '{}'", message.to(), message.subject());
    return new SendResult(true, "NOOP-" + UUID.randomUUID(), null);
  }
}
