package io.veomenu.backend.testutil;

import io.veomenu.backend.notification.integration.SendResult;
import io.veomenu.backend.notification.integration.email.EmailMessage;
import io.veomenu.backend.notification.integration.email.EmailProvider;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Captures outgoing emails so tests can read codes and links that are only stored hashed. Lookups
 * poll for a few seconds because some emails are delivered off the request thread.
 */
public class RecordingEmailProvider implements EmailProvider {

  private static final Pattern CODE = Pattern.compile("code is: (\\d{6})");
  private static final Pattern TOKEN = Pattern.compile("token=([A-Za-z0-9_-]+)");

  private static final Duration AWAIT_TIMEOUT = Duration.ofSeconds(5);

  private final List<EmailMessage> sent = new CopyOnWriteArrayList<>();
  private volatile Duration latency = Duration.ZERO;

  @Override
  public String providerId() {
    return "recording";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    if (!latency.isZero()) {
      try {
        Thread.sleep(latency.toMillis());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return new SendResult(false, null, "interrupted");
      }
    }
    sent.add(message);
    return new SendResult(true, "REC-" + UUID.randomUUID(), null);
  }

  /** Simulates a slow mail transport; {@link Duration#ZERO} restores immediate sends. */
  public void setLatency(Duration latency) {
    this.latency = latency;
  }

  public List<EmailMessage> sentTo(String email) {
    return sent.stream().filter(m -> m.to().equalsIgnoreCase(email)).toList();
  }

  /** The code in the most recent verification email to {@code email}. */
  public String lastCodeFor(String email) {
    return lastMatch(email, CODE);
  }

  /** The raw token in the most recent magic-link email to {@code email}. */
  public String lastMagicLinkTokenFor(String email) {
    return lastMatch(email, TOKEN);
  }

  private String lastMatch(String email, Pattern pattern) {
    long deadline = System.nanoTime() + AWAIT_TIMEOUT.toNanos();
    do {
      var messages = sentTo(email);
      for (int i = messages.size() - 1; i >= 0; i--) {
        Matcher matcher = pattern.matcher(messages.get(i).plainTextBody());
        if (matcher.find()) {
          return matcher.group(1);
        }
      }
      pause();
    } while (System.nanoTime() < deadline);
    throw new AssertionError("No matching email sent to " + email);
  }

  private static void pause() {
    try {
      Thread.sleep(25);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AssertionError("Interrupted while waiting for an email", e);
    }
  }
}
