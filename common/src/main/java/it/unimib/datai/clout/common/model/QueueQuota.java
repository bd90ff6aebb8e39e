package it.unimib.datai.clout.common.model;

import jakarta.validation.constraints.Positive;

public record QueueQuota(
        @Positive long maxBytes,
        @Positive int maxMessages
) {
    public QueueQuota {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (maxMessages <= 0) {
            throw new IllegalArgumentException("maxMessages must be positive");
        }
    }

    public static QueueQuota unlimited() {
        return new QueueQuota(Long.MAX_VALUE, Integer.MAX_VALUE);
    }

    public boolean admits(int messageCount, long totalBytes) {
        return messageCount <= maxMessages && totalBytes <= maxBytes;
    }
}
