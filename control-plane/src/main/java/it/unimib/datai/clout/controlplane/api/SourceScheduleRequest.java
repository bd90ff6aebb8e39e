package it.unimib.datai.clout.controlplane.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Selects every function registered from {@code sourceId}. {@code cron} is ignored when unscheduling.
 */
public record SourceScheduleRequest(
        @NotBlank(message = "sourceId is required") String sourceId,
        String cron
) {
}
