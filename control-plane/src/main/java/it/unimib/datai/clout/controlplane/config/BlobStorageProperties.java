package it.unimib.datai.clout.controlplane.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@ConfigurationProperties(prefix = "clout.blob")
@Validated
public record BlobStorageProperties(
        String rootPath,
        @Positive Long maxBlobBytes,
        Boolean enableCompression
) {
    public static final long DEFAULT_MAX_BLOB_BYTES = 100L * 1024 * 1024;

    public BlobStorageProperties {
        if (rootPath == null || rootPath.isBlank()) {
            rootPath = "data/blobs";
        }
        if (maxBlobBytes == null) {
            maxBlobBytes = DEFAULT_MAX_BLOB_BYTES;
        }
        if (enableCompression == null) {
            enableCompression = false;
        }
    }

    public static BlobStorageProperties at(Path rootPath) {
        return new BlobStorageProperties(rootPath.toString(), null, null);
    }

    public Path rootPathAsPath() {
        return Path.of(rootPath);
    }
}
