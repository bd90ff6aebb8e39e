package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.common.model.ExecutionOutcome;
import it.unimib.datai.clout.common.model.ExecutionResult;

public record InvocationResponse(
        String functionId,
        ExecutionOutcome outcome,
        String output,
        String error,
        String message,
        long durationMs
) {
    public static InvocationResponse from(ExecutionResult result) {
        return new InvocationResponse(
                result.functionId(),
                result.outcome(),
                result.output(),
                result.error() != null ? result.error().code() : null,
                result.error() != null ? result.error().getMessage() : null,
                result.duration() != null ? result.duration().toMillis() : 0);
    }
}
