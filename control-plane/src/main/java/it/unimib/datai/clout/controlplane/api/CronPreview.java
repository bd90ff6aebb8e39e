package it.unimib.datai.clout.controlplane.api;

import java.time.ZonedDateTime;
import java.util.List;

public record CronPreview(String expression, String normalized, List<ZonedDateTime> nextFireTimes) {
}
