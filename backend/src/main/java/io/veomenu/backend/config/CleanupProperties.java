package io.veomenu.backend.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Retention of expired credentials before they are garbage collected.
 *
 * @param retention how long expired links, challenges and sessions are kept for audit
 * @param enabled whether the scheduled cleanup runs
 */
@ConfigurationProperties(prefix = "veomenu.cleanup")
public record CleanupProperties(
    @DefaultValue("24h") Duration retention, @DefaultValue("true") boolean enabled) {}
