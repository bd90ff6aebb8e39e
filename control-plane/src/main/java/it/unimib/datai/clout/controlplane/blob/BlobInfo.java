package it.unimib.datai.clout.controlplane.blob;

import java.time.Instant;
import java.util.List;

public record BlobInfo(
        String id,
        String fileName,
        long size,
        Instant createdAt,
        String contentType,
        List<BlobMetadata> metadata
) {
    public BlobInfo {
        metadata = metadata == null ? List.of() : List.copyOf(metadata);
    }

    public BlobInfo withMetadata(List<BlobMetadata> newMetadata) {
        return new BlobInfo(id, fileName, size, createdAt, contentType, newMetadata);
    }

    /**
     * Value of the first metadata entry with the given name, or {@code null}.
     */
    public String metadataValue(String name) {
        for (BlobMetadata entry : metadata) {
            if (entry.name().equals(name)) {
                return entry.value();
            }
        }
        return null;
    }
}
