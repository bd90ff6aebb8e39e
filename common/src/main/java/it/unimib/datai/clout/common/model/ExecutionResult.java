package it.unimib.datai.clout.common.model;

import it.unimib.datai.clout.common.CloutException;

import java.time.Duration;

public record ExecutionResult(
        String functionId,
        ExecutionOutcome outcome,
        String output,
        CloutException error,
        Duration duration
) {
    public static ExecutionResult succeeded(String functionId, String output, Duration duration) {
        return new ExecutionResult(functionId, ExecutionOutcome.SUCCEEDED, output, null, duration);
    }

    public static ExecutionResult failed(String functionId, CloutException error, Duration duration) {
        return new ExecutionResult(functionId, ExecutionOutcome.FAILED, null, error, duration);
    }

    public static ExecutionResult cancelled(String functionId, Duration duration) {
        return new ExecutionResult(functionId, ExecutionOutcome.CANCELLED, null, null, duration);
    }

    public boolean isSuccess() {
        return outcome == ExecutionOutcome.SUCCEEDED;
    }
}
