package it.unimib.datai.clout.controlplane.registry;

/**
 * Input of {@link FunctionService#register(RegistrationRequest)}. At most one of
 * {@code cronExpression} and {@code queueName} may be set.
 */
public record RegistrationRequest(
        String blobId,
        String name,
        String runtime,
        String entrypoint,
        String declaringType,
        String cronExpression,
        String queueName
) {
    public static RegistrationRequest of(String blobId, String name, String runtime,
                                         String entrypoint, String declaringType) {
        return new RegistrationRequest(blobId, name, runtime, entrypoint, declaringType, null, null);
    }
}
