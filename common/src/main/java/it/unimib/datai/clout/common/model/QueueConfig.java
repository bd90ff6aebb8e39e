package it.unimib.datai.clout.common.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record QueueConfig(
        @NotNull @Valid QueueQuota quota,
        @NotNull OverflowPolicy overflow
) {
    public QueueConfig {
        if (quota == null) {
            throw new IllegalArgumentException("quota is required");
        }
        if (overflow == null) {
            overflow = OverflowPolicy.REJECT;
        }
    }
}
