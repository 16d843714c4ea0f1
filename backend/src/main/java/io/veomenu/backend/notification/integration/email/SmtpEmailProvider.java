package io.veomenu.backend.notification.integration.email;

import io.veomenu.backend.notification.integration.SendResult;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

/**
 * SMTP-based email provider that sends emails via {@link JavaMailSender}. Registered by {@code
 * NotificationConfig} only when {@code spring.mail.host} is configured.
 */
public class SmtpEmailProvider implements EmailProvider {

  private static final Logger log = LoggerFactory.getLogger(SmtpEmailProvider.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpEmailProvider(JavaMailSender mailSender, String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public String providerId() {
    return "smtp";
  }

  @Override
  public SendResult sendEmail(EmailMessage message) {
    try {
      MimeMessage mimeMessage = mailSender.createMimeMessage();
      MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, false, "UTF-8");
      helper.setFrom(senderAddress);
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      helper.setText(message.plainTextBody(), false);
      mailSender.send(mimeMessage);
      String messageId = mimeMessage.getMessageID();
      log.debug("SMTP email sent to {} with Message-ID: {}", message.to(), messageId);
      return new SendResult(true, messageId, null);
    } catch (MailException | MessagingException e) {
      log.error("Failed to send SMTP email to {}: {}", message.to(), e.getMessage());
      return new SendResult(false, null, e.getMessage());
    }
  }
}
