package it.unimib.datai.clout.controlplane.blob;

import java.util.List;
import java.util.Optional;

/**
 * Content store for function code and registration metadata. Failures surface as
 * {@link it.unimib.datai.clout.common.CloutException} with kind {@code BLOB_NOT_FOUND}
 * or {@code BLOB_OPERATION_FAILED}.
 */
public interface BlobStore {

    BlobInfo put(String fileName, byte[] content, String contentType, List<BlobMetadata> metadata);

    StoredBlob get(String id);

    /**
     * Replaces the content of an existing blob, keeping its id, creation time and metadata.
     * A {@code null} file name or content type keeps the current one.
     */
    BlobInfo replace(String id, byte[] content, String contentType, String fileName);

    Optional<BlobInfo> info(String id);

    BlobInfo setMetadata(String id, List<BlobMetadata> metadata);

    boolean delete(String id);

    List<BlobInfo> list();
}
