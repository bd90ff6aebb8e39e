package it.unimib.datai.clout.controlplane.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.CloutException;
import it.unimib.datai.clout.common.Names;
import it.unimib.datai.clout.common.model.OverflowPolicy;
import it.unimib.datai.clout.common.model.QueueConfig;
import it.unimib.datai.clout.common.model.QueueMessage;
import it.unimib.datai.clout.common.model.QueueQuota;
import it.unimib.datai.clout.common.model.QueueStats;
import it.unimib.datai.clout.controlplane.config.QueueStorageProperties;
import it.unimib.datai.clout.controlplane.service.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * {@link QueueServer} keeping one directory per queue under the configured base path.
 *
 * <p>Each message lives in its own {@code <millis>_<uuid>.msg} file; {@code manifest.json}
 * records the queue configuration and the FIFO order. A mutation is acknowledged only after
 * the payload file and the rewritten manifest have been forced to disk, so an acknowledged
 * message survives a crash and an unacknowledged one leaves at most an orphan file, which is
 * removed on the next load.</p>
 */
public class DiskQueueServer implements QueueServer {
    private static final Logger log = LoggerFactory.getLogger(DiskQueueServer.class);
    private static final String MESSAGE_SUFFIX = ".msg";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final Path basePath;
    private final QueueConfig defaultConfig;
    private final long maxMessageBytes;
    private final boolean cleanupOrphansOnLoad;
    private final ObjectMapper objectMapper;
    private final Metrics metrics;
    private final Map<String, QueueState> queues = new ConcurrentHashMap<>();
    private final Map<String, List<Meter.Id>> meterIds = new ConcurrentHashMap<>();

    public DiskQueueServer(QueueStorageProperties properties, ObjectMapper objectMapper, Metrics metrics) {
        this.basePath = properties.basePathAsPath();
        this.defaultConfig = properties.defaultQueueConfig();
        this.maxMessageBytes = properties.maxMessageBytesOrUnbounded();
        this.cleanupOrphansOnLoad = properties.cleanupOrphansOnLoad();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        loadExisting();
    }

    @Override
    public void createQueue(String name) {
        Names.requireQueueName(name);
        obtain(name, null);
    }

    @Override
    public void createQueue(String name, QueueConfig config) {
        Names.requireQueueName(name);
        Objects.requireNonNull(config, "config");
        QueueState state = obtain(name, config);
        if (!state.config().equals(config)) {
            throw CloutException.queueOperationFailed(name,
                    "Queue '" + name + "' already exists with a different configuration");
        }
    }

    @Override
    public boolean deleteQueue(String name) {
        Names.requireQueueName(name);
        boolean[] removed = {false};
        queues.computeIfPresent(name, (key, state) -> {
            state.lock().lock();
            try {
                deleteRecursively(state.directory());
                state.markDeleted();
                state.clear();
                state.publish();
                state.notEmpty().signalAll();
            } finally {
                state.lock().unlock();
            }
            removeMeters(key);
            removed[0] = true;
            return null;
        });
        if (removed[0]) {
            log.info("Deleted queue {}", name);
        }
        return removed[0];
    }

    @Override
    public String enqueue(String name, byte[] payload, String contentType) {
        Names.requireQueueName(name);
        byte[] data = payload == null ? new byte[0] : payload;
        if (data.length > maxMessageBytes) {
            metrics.rejected(name);
            throw CloutException.queueQuotaExceeded(name, maxMessageBytes,
                    "Message of " + data.length + " bytes exceeds the per-message limit of "
                            + maxMessageBytes + " bytes");
        }
        while (true) {
            QueueState state = obtain(name, null);
            state.lock().lock();
            try {
                if (state.isDeleted()) {
                    continue;
                }
                return append(state, data, contentType == null ? DEFAULT_CONTENT_TYPE : contentType);
            } finally {
                state.lock().unlock();
            }
        }
    }

    @Override
    public Optional<QueueMessage> dequeue(String name, Duration timeout, CancellationSignal cancellation)
            throws InterruptedException {
        Names.requireQueueName(name);
        CancellationSignal signal = cancellation == null ? CancellationSignal.none() : cancellation;
        long waitNanos = timeout == null || timeout.isNegative() ? 0 : timeout.toNanos();
        long deadline = System.nanoTime() + waitNanos;
        QueueState state = obtain(name, null);

        try (CancellationSignal.Registration ignored = signal.onCancel(() -> wake(state))) {
            state.lock().lockInterruptibly();
            try {
                while (true) {
                    if (signal.isCancelled() || state.isDeleted()) {
                        return Optional.empty();
                    }
                    if (!state.entries().isEmpty()) {
                        return Optional.of(takeHead(state));
                    }
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        return Optional.empty();
                    }
                    state.notEmpty().awaitNanos(remaining);
                }
            } finally {
                state.lock().unlock();
            }
        }
    }

    @Override
    public int purge(String name) {
        Names.requireQueueName(name);
        QueueState state = queues.get(name);
        if (state == null) {
            return 0;
        }
        state.lock().lock();
        try {
            if (state.isDeleted()) {
                return 0;
            }
            List<QueueManifest.Entry> removed = state.entriesCopy();
            if (removed.isEmpty()) {
                return 0;
            }
            writeManifestOrFail(state, List.of());
            state.clear();
            state.publish();
            removed.forEach(entry -> deleteQuietly(state.directory().resolve(entry.file())));
            log.info("Purged {} messages from queue {}", removed.size(), name);
            return removed.size();
        } finally {
            state.lock().unlock();
        }
    }

    @Override
    public List<QueueStats> stats() {
        return queues.values().stream()
                .map(QueueState::snapshot)
                .sorted(Comparator.comparing(QueueStats::name))
                .toList();
    }

    @Override
    public List<String> queueNames() {
        return queues.keySet().stream().sorted().toList();
    }

    @Override
    public Optional<QueueConfig> config(String name) {
        QueueState state = queues.get(name);
        return state == null ? Optional.empty() : Optional.of(state.config());
    }

    private String append(QueueState state, byte[] data, String contentType) {
        QueueQuota quota = state.config().quota();
        long size = data.length;
        if (size > quota.maxBytes()) {
            metrics.rejected(state.name());
            throw CloutException.queueQuotaExceeded(state.name(), quota.maxBytes(),
                    "Message of " + size + " bytes can never fit in queue '" + state.name()
                            + "' (limit " + quota.maxBytes() + " bytes)");
        }

        int evictCount = 0;
        long evictedBytes = 0;
        Iterator<QueueManifest.Entry> head = state.entries().iterator();
        while (!quota.admits(state.entries().size() - evictCount + 1, state.totalBytes() - evictedBytes + size)) {
            if (state.config().overflow() == OverflowPolicy.REJECT) {
                metrics.rejected(state.name());
                throw CloutException.queueQuotaExceeded(state.name(), quota.maxBytes(),
                        "Queue '" + state.name() + "' is full (" + state.entries().size() + " messages, "
                                + state.totalBytes() + " bytes)");
            }
            evictedBytes += head.next().size();
            evictCount++;
        }

        Instant now = Instant.now();
        String id = UUID.randomUUID().toString();
        String fileName = now.toEpochMilli() + "_" + id + MESSAGE_SUFFIX;
        Path file = state.directory().resolve(fileName);
        QueueManifest.Entry entry = new QueueManifest.Entry(id, fileName, contentType, size, now);

        try {
            writeDurably(file, data);
        } catch (IOException e) {
            deleteQuietly(file);
            throw CloutException.queueOperationFailed(state.name(),
                    "Failed to persist message for queue '" + state.name() + "'", e);
        }

        List<QueueManifest.Entry> all = state.entriesCopy();
        List<QueueManifest.Entry> evicted = new ArrayList<>(all.subList(0, evictCount));
        List<QueueManifest.Entry> next = new ArrayList<>(all.subList(evictCount, all.size()));
        next.add(entry);
        try {
            writeManifest(state, next);
        } catch (IOException e) {
            deleteQuietly(file);
            throw CloutException.queueOperationFailed(state.name(),
                    "Failed to update manifest of queue '" + state.name() + "'", e);
        }

        for (int i = 0; i < evictCount; i++) {
            state.removeHead();
        }
        state.append(entry);
        state.publish();
        evicted.forEach(old -> deleteQuietly(state.directory().resolve(old.file())));
        state.notEmpty().signalAll();

        metrics.enqueued(state.name());
        if (evictCount > 0) {
            metrics.evicted(state.name(), evictCount);
            log.debug("Queue {} evicted {} oldest messages to admit {}", state.name(), evictCount, id);
        }
        return id;
    }

    private QueueMessage takeHead(QueueState state) {
        QueueManifest.Entry head = state.entries().peekFirst();
        Path file = state.directory().resolve(head.file());
        byte[] data;
        try {
            data = Files.readAllBytes(file);
        } catch (IOException e) {
            log.error("Message {} of queue {} is unreadable, dropping it", head.id(), state.name(), e);
            commitHeadRemoval(state, head, file);
            throw CloutException.queueOperationFailed(state.name(),
                    "Message " + head.id() + " of queue '" + state.name() + "' could not be read", e);
        }
        commitHeadRemoval(state, head, file);
        metrics.dequeued(state.name());
        return new QueueMessage(head.id(), data, head.contentType(), head.size(), head.enqueuedAt());
    }

    private void commitHeadRemoval(QueueState state, QueueManifest.Entry head, Path file) {
        List<QueueManifest.Entry> remaining = state.entriesCopy();
        remaining.remove(0);
        writeManifestOrFail(state, remaining);
        state.removeHead();
        state.publish();
        deleteQuietly(file);
    }

    private void wake(QueueState state) {
        state.lock().lock();
        try {
            state.notEmpty().signalAll();
        } finally {
            state.lock().unlock();
        }
    }

    private QueueState obtain(String name, QueueConfig config) {
        QueueState existing = queues.get(name);
        if (existing != null) {
            return existing;
        }
        return queues.computeIfAbsent(name, key -> createState(key, config == null ? defaultConfig : config));
    }

    private QueueState createState(String name, QueueConfig config) {
        Path directory = basePath.resolve(name);
        QueueState state = new QueueState(name, directory, config);
        try {
            Files.createDirectories(directory);
            writeManifest(state, List.of());
        } catch (IOException e) {
            throw CloutException.queueOperationFailed(name, "Failed to create queue '" + name + "'", e);
        }
        registerMeters(state);
        log.info("Created queue {} (maxBytes={}, maxMessages={}, overflow={})", name,
                config.quota().maxBytes(), config.quota().maxMessages(), config.overflow());
        return state;
    }

    private void loadExisting() {
        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw CloutException.queueOperationFailed(null, "Cannot create queue base path " + basePath, e);
        }
        try (DirectoryStream<Path> directories = Files.newDirectoryStream(basePath, Files::isDirectory)) {
            for (Path directory : directories) {
                String name = directory.getFileName().toString();
                if (!Names.isValidQueueName(name)) {
                    log.warn("Ignoring directory {} with an invalid queue name", directory);
                    continue;
                }
                QueueState state = loadQueue(name, directory);
                queues.put(name, state);
                registerMeters(state);
                log.info("Loaded queue {} with {} messages ({} bytes)", name,
                        state.snapshot().messageCount(), state.snapshot().totalBytes());
            }
        } catch (IOException e) {
            throw CloutException.queueOperationFailed(null, "Failed to load queues from " + basePath, e);
        }
    }

    private QueueState loadQueue(String name, Path directory) throws IOException {
        Path manifestPath = directory.resolve(QueueManifest.FILE_NAME);
        QueueManifest manifest = null;
        boolean trusted = true;
        if (Files.exists(manifestPath)) {
            try {
                manifest = objectMapper.readValue(manifestPath.toFile(), QueueManifest.class);
            } catch (IOException e) {
                Path aside = directory.resolve(QueueManifest.FILE_NAME + ".corrupt-" + System.currentTimeMillis());
                Files.move(manifestPath, aside);
                trusted = false;
                log.warn("Manifest of queue {} is unreadable, moved to {}: {}", name, aside, e.getMessage());
            }
        }

        QueueConfig config = manifest != null && manifest.config() != null ? manifest.config() : defaultConfig;
        QueueState state = new QueueState(name, directory, config);
        Set<String> referenced = new HashSet<>();
        int missing = 0;
        if (manifest != null) {
            for (QueueManifest.Entry entry : manifest.messages()) {
                Path file = directory.resolve(entry.file());
                if (!Files.isRegularFile(file)) {
                    missing++;
                    continue;
                }
                long actual = Files.size(file);
                state.append(actual == entry.size() ? entry
                        : new QueueManifest.Entry(entry.id(), entry.file(), entry.contentType(), actual,
                        entry.enqueuedAt()));
                referenced.add(entry.file());
            }
        }
        if (missing > 0) {
            log.warn("Queue {} lost {} messages whose files are missing", name, missing);
        }
        if (cleanupOrphansOnLoad && trusted) {
            deleteOrphans(directory, referenced);
        }
        if (manifest == null || missing > 0) {
            writeManifest(state, state.entriesCopy());
        }
        state.publish();
        return state;
    }

    private void deleteOrphans(Path directory, Set<String> referenced) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            List<Path> orphans = files
                    .filter(Files::isRegularFile)
                    .filter(file -> {
                        String fileName = file.getFileName().toString();
                        return (fileName.endsWith(MESSAGE_SUFFIX) && !referenced.contains(fileName))
                                || fileName.endsWith(TEMP_SUFFIX);
                    })
                    .toList();
            orphans.forEach(DiskQueueServer::deleteQuietly);
            if (!orphans.isEmpty()) {
                log.info("Removed {} orphan files from {}", orphans.size(), directory);
            }
        }
    }

    private void writeManifestOrFail(QueueState state, List<QueueManifest.Entry> messages) {
        try {
            writeManifest(state, messages);
        } catch (IOException e) {
            throw CloutException.queueOperationFailed(state.name(),
                    "Failed to update manifest of queue '" + state.name() + "'", e);
        }
    }

    private void writeManifest(QueueState state, List<QueueManifest.Entry> messages) throws IOException {
        Path target = state.directory().resolve(QueueManifest.FILE_NAME);
        Path tmp = state.directory().resolve(QueueManifest.FILE_NAME + TEMP_SUFFIX);
        Files.deleteIfExists(tmp);
        writeDurably(tmp, objectMapper.writeValueAsBytes(state.manifest(messages)));
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        syncDirectory(state.directory());
    }

    private static void writeDurably(Path file, byte[] data) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(data);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void syncDirectory(Path directory) {
        try (FileChannel channel = FileChannel.open(directory, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", directory, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
        }
    }

    private static void deleteRecursively(Path directory) {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(DiskQueueServer::deleteQuietly);
        } catch (IOException e) {
            throw CloutException.queueOperationFailed(directory.getFileName().toString(),
                    "Failed to delete queue directory " + directory, e);
        }
    }

    private void registerMeters(QueueState state) {
        List<Meter.Id> ids = new ArrayList<>();
        ids.add(Gauge.builder("queue_messages", state, s -> s.snapshot().messageCount())
                .tag("queue", state.name())
                .register(metrics.registry()).getId());
        ids.add(Gauge.builder("queue_bytes", state, s -> s.snapshot().totalBytes())
                .tag("queue", state.name())
                .register(metrics.registry()).getId());
        meterIds.put(state.name(), ids);
    }

    private void removeMeters(String name) {
        List<Meter.Id> ids = meterIds.remove(name);
        if (ids != null) {
            ids.forEach(metrics.registry()::remove);
        }
    }
}
