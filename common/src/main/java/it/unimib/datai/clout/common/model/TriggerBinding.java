package it.unimib.datai.clout.common.model;

/**
 * A function's single trigger: a cron expression for {@link TriggerType#TIMER},
 * a queue name for {@link TriggerType#QUEUE}.
 */
public record TriggerBinding(
        TriggerType type,
        String value
) {
    public TriggerBinding {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value is required");
        }
    }

    public static TriggerBinding timer(String cronExpression) {
        return new TriggerBinding(TriggerType.TIMER, cronExpression);
    }

    public static TriggerBinding queue(String queueName) {
        return new TriggerBinding(TriggerType.QUEUE, queueName);
    }
}
