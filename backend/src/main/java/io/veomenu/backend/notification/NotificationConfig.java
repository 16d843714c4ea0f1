package io.veomenu.backend.notification;

import io.veomenu.backend.config.NotificationProperties;
import io.veomenu.backend.notification.integration.email.EmailProvider;
import io.veomenu.backend.notification.integration.email.NoOpEmailProvider;
import io.veomenu.backend.notification.integration.email.SmtpEmailProvider;
import io.veomenu.backend.notification.integration.sms.LoggingSmsProvider;
import io.veomenu.backend.notification.integration.sms.SmsProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

/** Selects the transport behind each channel from the environment. */
@Configuration
public class NotificationConfig {

  @Bean
  @ConditionalOnProperty(name = "spring.mail.host")
  EmailProvider smtpEmailProvider(JavaMailSender mailSender, NotificationProperties properties) {
    return new SmtpEmailProvider(mailSender, properties.senderAddress());
  }

  @Bean
  @ConditionalOnMissingBean(EmailProvider.class)
  EmailProvider noOpEmailProvider() {
    return new NoOpEmailProvider();
  }

  @Bean
  @ConditionalOnMissingBean(SmsProvider.class)
  SmsProvider loggingSmsProvider() {
    return new LoggingSmsProvider();
  }
}
