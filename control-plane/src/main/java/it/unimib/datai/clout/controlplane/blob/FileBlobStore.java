package it.unimib.datai.clout.controlplane.blob;

import com.fasterxml.jackson.databind.ObjectMapper;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.controlplane.config.BlobStorageProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Blob store keeping each blob as {@code <id>.bin} with a JSON sidecar {@code <id>.json}
 * describing it.
 */
public class FileBlobStore implements BlobStore {
    private static final Logger log = LoggerFactory.getLogger(FileBlobStore.class);
    private static final Pattern BLOB_ID = Pattern.compile("^[a-f0-9]{32}$");

    private final Path root;
    private final long maxBlobBytes;
    private final boolean compress;
    private final ObjectMapper objectMapper;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public FileBlobStore(BlobStorageProperties properties, ObjectMapper objectMapper) {
        this.root = properties.rootPathAsPath();
        this.maxBlobBytes = properties.maxBlobBytes();
        this.compress = properties.enableCompression();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(null, "Cannot create blob root " + root, e);
        }
    }

    @Override
    public BlobInfo put(String fileName, byte[] content, String contentType, List<BlobMetadata> metadata) {
        byte[] data = content == null ? new byte[0] : content;
        if (data.length > maxBlobBytes) {
            throw CloutException.blobOperationFailed(null,
                    "Blob of " + data.length + " bytes exceeds the limit of " + maxBlobBytes + " bytes", null);
        }
        String id = UUID.randomUUID().toString().replace("-", "");
        BlobInfo info = new BlobInfo(id, fileName, data.length, Instant.now(),
                contentType == null ? "application/octet-stream" : contentType, metadata);
        lock.writeLock().lock();
        try {
            writeAtomically(contentPath(id), compress ? gzip(data) : data);
            writeRecord(new BlobRecord(info, compress));
        } catch (IOException e) {
            deleteQuietly(contentPath(id));
            throw CloutException.blobOperationFailed(id, "Failed to store blob " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Stored blob {} ({} bytes)", id, data.length);
        return info;
    }

    @Override
    public BlobInfo replace(String id, byte[] content, String contentType, String fileName) {
        byte[] data = content == null ? new byte[0] : content;
        if (data.length > maxBlobBytes) {
            throw CloutException.blobOperationFailed(id,
                    "Blob of " + data.length + " bytes exceeds the limit of " + maxBlobBytes + " bytes", null);
        }
        lock.writeLock().lock();
        try {
            BlobInfo current = readRecord(id).map(BlobRecord::info).orElseThrow(() -> CloutException.blobNotFound(id));
            BlobInfo replaced = new BlobInfo(id,
                    fileName == null || fileName.isBlank() ? current.fileName() : fileName,
                    data.length,
                    current.createdAt(),
                    contentType == null || contentType.isBlank() ? current.contentType() : contentType,
                    current.metadata());
            writeAtomically(contentPath(id), compress ? gzip(data) : data);
            writeRecord(new BlobRecord(replaced, compress));
            log.debug("Replaced content of blob {} ({} bytes)", id, data.length);
            return replaced;
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(id, "Failed to replace blob " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public StoredBlob get(String id) {
        lock.readLock().lock();
        try {
            BlobRecord record = readRecord(id).orElseThrow(() -> CloutException.blobNotFound(id));
            byte[] raw = Files.readAllBytes(contentPath(id));
            return new StoredBlob(record.info(), record.compressed() ? gunzip(raw) : raw);
        } catch (NoSuchFileException e) {
            throw CloutException.blobNotFound(id);
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(id, "Failed to read blob " + id, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<BlobInfo> info(String id) {
        lock.readLock().lock();
        try {
            return readRecord(id).map(BlobRecord::info);
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(id, "Failed to read blob info " + id, e);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public BlobInfo setMetadata(String id, List<BlobMetadata> metadata) {
        lock.writeLock().lock();
        try {
            BlobRecord record = readRecord(id).orElseThrow(() -> CloutException.blobNotFound(id));
            BlobInfo updated = record.info().withMetadata(metadata);
            writeRecord(new BlobRecord(updated, record.compressed()));
            return updated;
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(id, "Failed to update metadata of blob " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(String id) {
        if (!isBlobId(id)) {
            return false;
        }
        lock.writeLock().lock();
        try {
            boolean existed = Files.deleteIfExists(recordPath(id));
            Files.deleteIfExists(contentPath(id));
            return existed;
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(id, "Failed to delete blob " + id, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<BlobInfo> list() {
        lock.readLock().lock();
        try (Stream<Path> files = Files.list(root)) {
            List<BlobInfo> result = new ArrayList<>();
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).toList()) {
                String name = file.getFileName().toString();
                String id = name.substring(0, name.length() - ".json".length());
                try {
                    readRecord(id).map(BlobRecord::info).ifPresent(result::add);
                } catch (IOException e) {
                    log.warn("Skipping unreadable blob record {}: {}", file, e.getMessage());
                }
            }
            result.sort(Comparator.comparing(BlobInfo::createdAt).thenComparing(BlobInfo::id));
            return result;
        } catch (IOException e) {
            throw CloutException.blobOperationFailed(null, "Failed to list blobs", e);
        } finally {
            lock.readLock().unlock();
        }
    }

    private Optional<BlobRecord> readRecord(String id) throws IOException {
        if (!isBlobId(id)) {
            return Optional.empty();
        }
        Path path = recordPath(id);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.readValue(path.toFile(), BlobRecord.class));
    }

    private void writeRecord(BlobRecord record) throws IOException {
        writeAtomically(recordPath(record.info().id()), objectMapper.writeValueAsBytes(record));
    }

    private void writeAtomically(Path target, byte[] data) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.write(tmp, data);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private Path contentPath(String id) {
        return root.resolve(id + ".bin");
    }

    private Path recordPath(String id) {
        return root.resolve(id + ".json");
    }

    private static boolean isBlobId(String id) {
        return id != null && BLOB_ID.matcher(id).matches();
    }

    private static byte[] gzip(byte[] data) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (GZIPOutputStream gzip = new GZIPOutputStream(out)) {
            gzip.write(data);
        }
        return out.toByteArray();
    }

    private static byte[] gunzip(byte[] data) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", path, e.getMessage());
        }
    }

    public record BlobRecord(BlobInfo info, boolean compressed) {
    }
}
