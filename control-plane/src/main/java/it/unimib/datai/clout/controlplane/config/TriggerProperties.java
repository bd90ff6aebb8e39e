package it.unimib.datai.clout.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning for queue-triggered workers: poll timeout, retry policy and drain deadline.
 */
@ConfigurationProperties(prefix = "clout.triggers")
public record TriggerProperties(
        Duration pollTimeout,
        Integer maxAttempts,
        Duration initialBackoff,
        Duration maxBackoff,
        Double jitterFactor,
        Duration errorDelay,
        Duration drainTimeout,
        Boolean restoreOnStartup
) {
    public TriggerProperties {
        if (pollTimeout == null || pollTimeout.isNegative()) {
            pollTimeout = Duration.ofSeconds(1);
        }
        if (maxAttempts == null || maxAttempts < 1) {
            maxAttempts = 3;
        }
        if (initialBackoff == null || initialBackoff.isZero() || initialBackoff.isNegative()) {
            initialBackoff = Duration.ofMillis(500);
        }
        if (maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff.compareTo(Duration.ofSeconds(10)) > 0 ? initialBackoff : Duration.ofSeconds(10);
        }
        if (jitterFactor == null || jitterFactor < 0.0 || jitterFactor > 1.0) {
            jitterFactor = 0.1;
        }
        if (errorDelay == null || errorDelay.isNegative()) {
            errorDelay = Duration.ofSeconds(1);
        }
        if (drainTimeout == null || drainTimeout.isNegative()) {
            drainTimeout = Duration.ofSeconds(30);
        }
        if (restoreOnStartup == null) {
            restoreOnStartup = true;
        }
    }

    public static TriggerProperties defaults() {
        return new TriggerProperties(null, null, null, null, null, null, null, null);
    }
}
