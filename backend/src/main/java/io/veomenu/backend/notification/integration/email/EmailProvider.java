package io.veomenu.backend.notification.integration.email;

import io.veomenu.backend.notification.integration.SendResult;

/** Port for sending emails via an external provider. */
public interface EmailProvider {

  /** Provider identifier (e.g., "smtp", "noop"). */
  String providerId();

  SendResult sendEmail(EmailMessage message);
}
