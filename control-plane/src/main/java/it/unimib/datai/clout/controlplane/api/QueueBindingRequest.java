package it.unimib.datai.clout.controlplane.api;

import jakarta.validation.constraints.NotBlank;

public record QueueBindingRequest(
        @NotBlank(message = "queue is required") String queue
) {
}
