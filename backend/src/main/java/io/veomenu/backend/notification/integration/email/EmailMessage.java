package io.veomenu.backend.notification.integration.email;

import java.util.Objects;

/** Provider-agnostic plain-text email payload. */
public record EmailMessage(String to, String subject, String plainTextBody) {

  public EmailMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(subject, "subject");
    Objects.requireNonNull(plainTextBody, "plainTextBody");
  }
}
