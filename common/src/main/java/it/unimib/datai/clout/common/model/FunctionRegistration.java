package it.unimib.datai.clout.common.model;

import java.time.Instant;

/**
 * A registered function. {@code id} is the identifier of the blob holding the registration
 * metadata; {@code sourceBlobId} points at the blob holding the code.
 */
public record FunctionRegistration(
        String id,
        String name,
        RuntimeKind runtime,
        String entrypoint,
        String declaringType,
        boolean verified,
        String sourceBlobId,
        TriggerBinding trigger,
        Instant registeredAt
) {
    public FunctionRegistration withTrigger(TriggerBinding newTrigger) {
        return new FunctionRegistration(id, name, runtime, entrypoint, declaringType,
                verified, sourceBlobId, newTrigger, registeredAt);
    }

    /**
     * Cron expression of the timer trigger, or {@code null} when the function has none.
     */
    public String cronExpression() {
        return trigger != null && trigger.type() == TriggerType.TIMER ? trigger.value() : null;
    }

    /**
     * Name of the bound queue, or {@code null} when the function has no queue trigger.
     */
    public String queueName() {
        return trigger != null && trigger.type() == TriggerType.QUEUE ? trigger.value() : null;
    }
}
