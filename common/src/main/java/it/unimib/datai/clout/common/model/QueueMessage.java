package it.unimib.datai.clout.common.model;

import java.time.Instant;

/**
 * A message removed from a queue. The payload array is copied on the way in and out.
 */
public record QueueMessage(
        String id,
        byte[] payload,
        String contentType,
        long sizeBytes,
        Instant enqueuedAt
) {
    public QueueMessage {
        payload = payload == null ? new byte[0] : payload.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
