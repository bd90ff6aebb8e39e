package it.unimib.datai.clout.controlplane.blob;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.ErrorKind;
import it.unimib.datai.clout.controlplane.config.BlobStorageProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileBlobStoreTest {

    @TempDir
    Path root;

    private final ObjectMapper objectMapper = JsonMapper.builder().findAndAddModules().build();

    @Test
    void putThenGet_returnsContentAndInfo() {
        FileBlobStore store = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);

        BlobInfo info = store.put("hello.sh", "echo hi".getBytes(StandardCharsets.UTF_8), "text/x-shellscript",
                List.of(BlobMetadata.text("owner", "ops")));
        StoredBlob blob = store.get(info.id());

        assertThat(info.id()).matches("[a-f0-9]{32}");
        assertThat(new String(blob.content(), StandardCharsets.UTF_8)).isEqualTo("echo hi");
        assertThat(blob.info().fileName()).isEqualTo("hello.sh");
        assertThat(blob.info().size()).isEqualTo(7);
        assertThat(blob.info().metadataValue("owner")).isEqualTo("ops");
    }

    @Test
    void compressedBlobs_roundTripTransparently() throws Exception {
        FileBlobStore store = new FileBlobStore(new BlobStorageProperties(root.toString(), null, true), objectMapper);
        byte[] content = "a".repeat(4096).getBytes(StandardCharsets.UTF_8);

        BlobInfo info = store.put("big.txt", content, null, List.of());

        assertThat(Files.size(root.resolve(info.id() + ".bin"))).isLessThan(content.length);
        assertThat(store.get(info.id()).content()).isEqualTo(content);
        assertThat(info.contentType()).isEqualTo("application/octet-stream");
    }

    @Test
    void replace_swapsContent_keepingIdentityAndMetadata() {
        FileBlobStore store = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);
        BlobInfo original = store.put("test.txt", "Original".getBytes(StandardCharsets.UTF_8), "text/plain",
                List.of(BlobMetadata.text("owner", "ops")));

        BlobInfo replaced = store.replace(original.id(), "Updated content".getBytes(StandardCharsets.UTF_8),
                null, "renamed.txt");

        assertThat(replaced.id()).isEqualTo(original.id());
        assertThat(replaced.size()).isEqualTo(15);
        assertThat(replaced.fileName()).isEqualTo("renamed.txt");
        assertThat(replaced.contentType()).isEqualTo("text/plain");
        assertThat(replaced.createdAt()).isEqualTo(original.createdAt());
        assertThat(replaced.metadataValue("owner")).isEqualTo("ops");
        assertThat(new String(store.get(original.id()).content(), StandardCharsets.UTF_8))
                .isEqualTo("Updated content");
        assertThat(store.list()).hasSize(1);
    }

    @Test
    void replace_missingBlob_throwsNotFound() {
        FileBlobStore store = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);

        assertThatThrownBy(() -> store.replace("0123456789abcdef0123456789abcdef", new byte[1], null, null))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.BLOB_NOT_FOUND));
    }

    @Test
    void get_missingBlob_throwsNotFound() {
        FileBlobStore store = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);

        assertThatThrownBy(() -> store.get("0123456789abcdef0123456789abcdef"))
                .isInstanceOfSatisfying(CloutException.class, e -> {
                    assertThat(e.kind()).isEqualTo(ErrorKind.BLOB_NOT_FOUND);
                    assertThat(e.blobId()).isEqualTo("0123456789abcdef0123456789abcdef");
                });
        assertThatThrownBy(() -> store.get("../etc/passwd"))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.BLOB_NOT_FOUND));
    }

    @Test
    void put_overLimit_fails() {
        FileBlobStore store = new FileBlobStore(new BlobStorageProperties(root.toString(), 4L, false), objectMapper);

        assertThatThrownBy(() -> store.put("x", new byte[5], null, List.of()))
                .isInstanceOfSatisfying(CloutException.class,
                        e -> assertThat(e.kind()).isEqualTo(ErrorKind.BLOB_OPERATION_FAILED));
        assertThat(store.list()).isEmpty();
    }

    @Test
    void setMetadata_replacesEntries_andSurvivesReopen() {
        FileBlobStore store = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);
        BlobInfo info = store.put("f", new byte[]{1}, null, List.of(BlobMetadata.text("a", "1")));

        store.setMetadata(info.id(), List.of(BlobMetadata.text("b", "2")));

        FileBlobStore reopened = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);
        BlobInfo reloaded = reopened.info(info.id()).orElseThrow();
        assertThat(reloaded.metadataValue("a")).isNull();
        assertThat(reloaded.metadataValue("b")).isEqualTo("2");
        assertThatThrownBy(() -> store.setMetadata("ffffffffffffffffffffffffffffffff", List.of()))
                .isInstanceOf(CloutException.class);
    }

    @Test
    void delete_andList() {
        FileBlobStore store = new FileBlobStore(BlobStorageProperties.at(root), objectMapper);
        BlobInfo first = store.put("one", new byte[]{1}, null, List.of());
        BlobInfo second = store.put("two", new byte[]{2}, null, List.of());

        assertThat(store.list()).extracting(BlobInfo::id).containsExactlyInAnyOrder(first.id(), second.id());
        assertThat(store.delete(first.id())).isTrue();
        assertThat(store.delete(first.id())).isFalse();
        assertThat(store.delete("not-an-id")).isFalse();
        assertThat(store.list()).extracting(BlobInfo::id).containsExactly(second.id());
        assertThat(store.info(first.id())).isEmpty();
    }
}
