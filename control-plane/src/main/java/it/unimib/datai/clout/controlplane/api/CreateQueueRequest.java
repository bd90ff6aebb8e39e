package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.model.OverflowPolicy;
import jakarta.validation.constraints.Positive;

/**
 * Optional body of a queue creation; missing limits mean unlimited.
 */
public record CreateQueueRequest(
        @Positive Long maxBytes,
        @Positive Integer maxMessages,
        OverflowPolicy overflow
) {
}
