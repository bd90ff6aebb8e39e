package it.unimib.datai.clout.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

@ConfigurationProperties(prefix = "clout.schedule")
public record ScheduleProperties(
        Integer poolSize,
        String zone,
        Boolean restoreOnStartup
) {
    public ScheduleProperties {
        if (poolSize == null || poolSize < 1) {
            poolSize = 4;
        }
        if (zone == null || zone.isBlank()) {
            zone = ZoneId.systemDefault().getId();
        }
        if (restoreOnStartup == null) {
            restoreOnStartup = true;
        }
    }

    public static ScheduleProperties defaults() {
        return new ScheduleProperties(null, null, null);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
