package it.unimib.datai.clout.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "clout.cleanup")
public record TempFileCleanupProperties(
        Boolean enabled,
        Duration interval,
        Duration fileAgeThreshold
) {
    public TempFileCleanupProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            interval = Duration.ofMinutes(5);
        }
        if (fileAgeThreshold == null || fileAgeThreshold.isNegative()) {
            fileAgeThreshold = Duration.ofMinutes(10);
        }
    }
}
