package it.unimib.datai.clout.controlplane.registry;

import java.util.List;

/**
 * Input of {@link FunctionService#registerMany(BatchRegistrationRequest)}: one function per
 * entrypoint of the same source blob, each named after its entrypoint. A blank runtime means
 * {@code java}; the optional cron expression is shared by all of them.
 */
public record BatchRegistrationRequest(
        String blobId,
        String runtime,
        List<String> entrypoints,
        String declaringType,
        String cronExpression
) {
    public BatchRegistrationRequest {
        entrypoints = entrypoints == null ? List.of() : List.copyOf(entrypoints);
    }
}
