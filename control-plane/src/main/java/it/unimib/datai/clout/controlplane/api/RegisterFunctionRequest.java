package it.unimib.datai.clout.controlplane.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterFunctionRequest(
        @NotBlank(message = "blobId is required") String blobId,
        @NotBlank(message = "name is required") @Size(max = 256) String name,
        @NotBlank(message = "runtime is required") String runtime,
        String entrypoint,
        String declaringType,
        String cron,
        String queue
) {
}
