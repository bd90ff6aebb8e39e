package it.unimib.datai.clout.controlplane.api;

import jakarta.validation.constraints.NotBlank;

public record ScheduleRequest(
        @NotBlank(message = "cron is required") String cron
) {
}
