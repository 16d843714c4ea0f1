package io.veomenu.backend.notification.integration.sms;

import java.util.Objects;

/** Text message addressed to an E.164 phone number. */
public record SmsMessage(String to, String body) {

  public SmsMessage {
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(body, "body");
  }
}
