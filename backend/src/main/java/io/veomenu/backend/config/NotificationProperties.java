package io.veomenu.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Notification dispatch settings.
 *
 * @param timeout upper bound for a single channel delivery
 * @param poolSize worker threads available for channel deliveries
 * @param senderAddress from-address used by the SMTP provider
 */
@ConfigurationProperties(prefix = "veomenu.notification")
public record NotificationProperties(
    @DefaultValue("5s") Duration timeout,
    @DefaultValue("4") int poolSize,
    @DefaultValue("noreply@veomenu.com") String senderAddress) {}
