package it.unimib.datai.clout.common.model;

public record QueueStats(
        String name,
        int messageCount,
        long totalBytes
) {
}
