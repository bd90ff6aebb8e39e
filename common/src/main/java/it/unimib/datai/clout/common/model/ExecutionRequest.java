package it.unimib.datai.clout.common.model;

import java.time.Duration;

/**
 * Ephemeral request to run a function once. A {@code null} timeout means the configured default.
 */
public record ExecutionRequest(
        String functionId,
        byte[] input,
        Duration timeout
) {
    public ExecutionRequest {
        input = input == null ? new byte[0] : input.clone();
    }

    public static ExecutionRequest of(String functionId, byte[] input) {
        return new ExecutionRequest(functionId, input, null);
    }

    @Override
    public byte[] input() {
        return input.clone();
    }
}
