package it.unimib.datai.clout.controlplane.api;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record RegisterManyRequest(
        String runtime,
        @NotEmpty(message = "entrypoints is required") List<String> entrypoints,
        String declaringType,
        String cron
) {
}
