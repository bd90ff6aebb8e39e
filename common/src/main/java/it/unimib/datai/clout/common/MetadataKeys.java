package it.unimib.datai.clout.common;

/**
 * Blob metadata keys under which function registrations and trigger bindings are persisted.
 */
public final class MetadataKeys {
    public static final String FUNCTION_NAME = "function.name";
    public static final String FUNCTION_RUNTIME = "function.runtime";
    public static final String FUNCTION_ENTRYPOINT = "function.entrypoint";
    public static final String FUNCTION_DECLARING_TYPE = "function.declaringType";
    public static final String FUNCTION_VERIFIED = "function.verified";
    public static final String FUNCTION_SOURCE_ID = "function.sourceId";
    public static final String TIMER_TRIGGER = "TimerTrigger";
    public static final String QUEUE_TRIGGER = "QueueTrigger";

    private MetadataKeys() {
    }
}
