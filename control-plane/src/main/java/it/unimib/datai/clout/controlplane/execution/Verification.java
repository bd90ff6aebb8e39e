package it.unimib.datai.clout.controlplane.execution;

/**
 * Outcome of resolving a function's entrypoint against its code.
 */
public record Verification(
        boolean resolved,
        String declaringType,
        String reason
) {
    public static Verification ok(String declaringType) {
        return new Verification(true, declaringType, null);
    }

    public static Verification failed(String reason) {
        return new Verification(false, null, reason);
    }
}
