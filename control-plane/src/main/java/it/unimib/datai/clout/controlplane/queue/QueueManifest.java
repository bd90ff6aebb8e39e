package it.unimib.datai.clout.controlplane.queue;

import it.unimib.datai.clout.common.model.QueueConfig;

import java.time.Instant;
import java.util.List;

/**
 * On-disk index of a queue: its configuration and the ordered list of message files.
 */
public record QueueManifest(
        int version,
        String name,
        QueueConfig config,
        List<Entry> messages
) {
    public static final int CURRENT_VERSION = 1;
    public static final String FILE_NAME = "manifest.json";

    public QueueManifest {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    public record Entry(
            String id,
            String file,
            String contentType,
            long size,
            Instant enqueuedAt
    ) {
    }
}
