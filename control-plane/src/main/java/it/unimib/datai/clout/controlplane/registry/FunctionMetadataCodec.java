package it.unimib.datai.clout.controlplane.registry;

import it.unimib.datai.clout.common.MetadataKeys;
import it.unimib.datai.clout.common.model.FunctionRegistration;
import it.unimib.datai.clout.common.model.RuntimeKind;
import it.unimib.datai.clout.common.model.TriggerBinding;
import it.unimib.datai.clout.common.model.TriggerType;
import it.unimib.datai.clout.controlplane.blob.BlobInfo;
import it.unimib.datai.clout.controlplane.blob.BlobMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps registrations to and from the metadata of their registration blob.
 */
final class FunctionMetadataCodec {

    private FunctionMetadataCodec() {
    }

    static List<BlobMetadata> toMetadata(FunctionRegistration registration) {
        List<BlobMetadata> metadata = new ArrayList<>();
        metadata.add(BlobMetadata.text(MetadataKeys.FUNCTION_NAME, registration.name()));
        metadata.add(BlobMetadata.text(MetadataKeys.FUNCTION_RUNTIME, registration.runtime().tag()));
        if (registration.entrypoint() != null) {
            metadata.add(BlobMetadata.text(MetadataKeys.FUNCTION_ENTRYPOINT, registration.entrypoint()));
        }
        if (registration.declaringType() != null) {
            metadata.add(BlobMetadata.text(MetadataKeys.FUNCTION_DECLARING_TYPE, registration.declaringType()));
        }
        metadata.add(BlobMetadata.text(MetadataKeys.FUNCTION_VERIFIED, Boolean.toString(registration.verified())));
        metadata.add(BlobMetadata.text(MetadataKeys.FUNCTION_SOURCE_ID, registration.sourceBlobId()));
        if (registration.trigger() != null) {
            metadata.add(BlobMetadata.text(registration.trigger().type().metadataKey(), registration.trigger().value()));
        }
        return metadata;
    }

    /**
     * Rebuilds a registration from its blob; empty when the blob is not a registration.
     */
    static Optional<FunctionRegistration> fromBlob(BlobInfo info) {
        String name = info.metadataValue(MetadataKeys.FUNCTION_NAME);
        String sourceId = info.metadataValue(MetadataKeys.FUNCTION_SOURCE_ID);
        Optional<RuntimeKind> runtime = RuntimeKind.fromTag(info.metadataValue(MetadataKeys.FUNCTION_RUNTIME));
        if (name == null || sourceId == null || runtime.isEmpty()) {
            return Optional.empty();
        }
        TriggerBinding trigger = null;
        String cron = info.metadataValue(TriggerType.TIMER.metadataKey());
        String queue = info.metadataValue(TriggerType.QUEUE.metadataKey());
        if (queue != null && !queue.isBlank()) {
            trigger = TriggerBinding.queue(queue);
        } else if (cron != null && !cron.isBlank()) {
            trigger = TriggerBinding.timer(cron);
        }
        return Optional.of(new FunctionRegistration(
                info.id(),
                name,
                runtime.get(),
                info.metadataValue(MetadataKeys.FUNCTION_ENTRYPOINT),
                info.metadataValue(MetadataKeys.FUNCTION_DECLARING_TYPE),
                Boolean.parseBoolean(info.metadataValue(MetadataKeys.FUNCTION_VERIFIED)),
                sourceId,
                trigger,
                info.createdAt()));
    }
}
