package it.unimib.datai.clout.controlplane.api;

import it.unimib.datai.clout.controlplane.blob.BlobInfo;
import it.unimib.datai.clout.controlplane.blob.BlobMetadata;
import it.unimib.datai.clout.controlplane.blob.BlobStore;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.List;

/**
 * Raw blob access. Uploads take the content as the request body and the file name from
 * {@value #FILE_NAME_HEADER}.
 */
@RestController
@RequestMapping("/api/blobs")
@Validated
public class BlobController {
    static final String FILE_NAME_HEADER = "X-File-Name";

    private final BlobStore blobStore;

    public BlobController(BlobStore blobStore) {
        this.blobStore = blobStore;
    }

    @GetMapping
    public List<BlobInfo> list() {
        return blobStore.list();
    }

    @PostMapping
    public Mono<ResponseEntity<BlobInfo>> upload(
            @RequestBody @NotEmpty(message = "content is required") byte[] content,
            @RequestHeader(value = FILE_NAME_HEADER, required = false) String fileName,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        return Blocking.call(() -> blobStore.put(fileName == null || fileName.isBlank() ? "blob.bin" : fileName,
                content, contentType, List.of()))
                .map(info -> ResponseEntity.created(URI.create("/api/blobs/" + info.id())).body(info));
    }

    /**
     * Replaces the content of an existing blob. Functions registered from it pick up the new
     * code on their next execution.
     */
    @PutMapping("/{id}")
    public Mono<BlobInfo> replace(
            @PathVariable String id,
            @RequestBody @NotEmpty(message = "content is required") byte[] content,
            @RequestHeader(value = FILE_NAME_HEADER, required = false) String fileName,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType) {
        return Blocking.call(() -> blobStore.replace(id, content, contentType, fileName));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<byte[]>> download(@PathVariable String id) {
        return Blocking.call(() -> blobStore.get(id))
                .map(blob -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(blob.info().contentType()))
                        .header(HttpHeaders.CONTENT_DISPOSITION,
                                ContentDisposition.attachment().filename(blob.info().fileName()).build().toString())
                        .body(blob.content()));
    }

    @GetMapping("/{id}/info")
    public ResponseEntity<BlobInfo> info(@PathVariable String id) {
        return blobStore.info(id)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{id}/metadata")
    public Mono<BlobInfo> setMetadata(@PathVariable String id, @RequestBody List<BlobMetadata> metadata) {
        return Blocking.call(() -> blobStore.setMetadata(id, metadata));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> delete(@PathVariable String id) {
        return Blocking.call(() -> blobStore.delete(id)
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }
}
