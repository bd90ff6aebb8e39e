package it.unimib.datai.clout.common.model;

/**
 * What a queue does when an enqueue would exceed its quota.
 */
public enum OverflowPolicy {
    /** Refuse the new message and leave the queue unchanged. */
    REJECT,
    /** Evict messages from the head until the new message fits. */
    DROP_OLDEST
}
