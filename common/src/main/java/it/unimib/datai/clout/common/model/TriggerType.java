package it.unimib.datai.clout.common.model;

import it.unimib.datai.clout.common.MetadataKeys;

public enum TriggerType {
    TIMER(MetadataKeys.TIMER_TRIGGER),
    QUEUE(MetadataKeys.QUEUE_TRIGGER);

    private final String metadataKey;

    TriggerType(String metadataKey) {
        this.metadataKey = metadataKey;
    }

    public String metadataKey() {
        return metadataKey;
    }
}
