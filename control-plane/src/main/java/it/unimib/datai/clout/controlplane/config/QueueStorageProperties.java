package it.unimib.datai.clout.controlplane.config;

import it.unimib.datai.clout.common.model.OverflowPolicy;
import it.unimib.datai.clout.common.model.QueueConfig;
import it.unimib.datai.clout.common.model.QueueQuota;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Storage location and default limits for disk-backed queues. The limits apply to queues
 * created without an explicit configuration; existing queues keep the configuration they
 * were created with.
 */
@ConfigurationProperties(prefix = "clout.queue")
@Validated
public record QueueStorageProperties(
        String basePath,
        @Positive Long maxQueueBytes,
        @Positive Integer maxQueueMessages,
        @Positive Integer maxMessageBytes,
        OverflowPolicy overflow,
        Boolean cleanupOrphansOnLoad,
        @Positive Long saturationBudgetBytes
) {
    public static final long DEFAULT_SATURATION_BUDGET_BYTES = 1024L * 1024 * 1024;

    public QueueStorageProperties {
        if (basePath == null || basePath.isBlank()) {
            basePath = "data/queues";
        }
        if (overflow == null) {
            overflow = OverflowPolicy.REJECT;
        }
        if (cleanupOrphansOnLoad == null) {
            cleanupOrphansOnLoad = true;
        }
        if (saturationBudgetBytes == null) {
            saturationBudgetBytes = DEFAULT_SATURATION_BUDGET_BYTES;
        }
    }

    public static QueueStorageProperties at(Path basePath) {
        return new QueueStorageProperties(basePath.toString(), null, null, null, null, null, null);
    }

    public Path basePathAsPath() {
        return Path.of(basePath);
    }

    public QueueConfig defaultQueueConfig() {
        QueueQuota quota = new QueueQuota(
                maxQueueBytes != null ? maxQueueBytes : Long.MAX_VALUE,
                maxQueueMessages != null ? maxQueueMessages : Integer.MAX_VALUE);
        return new QueueConfig(quota, overflow);
    }

    /**
     * Ceiling for a single payload, or {@link Long#MAX_VALUE} when unbounded.
     */
    public long maxMessageBytesOrUnbounded() {
        return maxMessageBytes != null ? maxMessageBytes : Long.MAX_VALUE;
    }
}
