package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.controlplane.config.ExecutionProperties;
import it.unimib.datai.clout.controlplane.config.TempFileCleanupProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Periodically removes workspace files left behind by executions that never got to clean up,
 * for example after a crash. Files of workspaces that are still open are never touched, however
 * old they are.
 */
@Component
public class TempFileCleanupService implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TempFileCleanupService.class);

    private final Path directory;
    private final TempFileCleanupProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService janitor;

    public TempFileCleanupService(ExecutionProperties executionProperties, TempFileCleanupProperties properties) {
        this.directory = executionProperties.tempDirectoryPath();
        this.properties = properties;
    }

    @Override
    public void start() {
        if (!properties.enabled()) {
            log.info("Temporary file cleanup disabled");
            return;
        }
        if (running.compareAndSet(false, true)) {
            janitor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "clout-temp-cleanup");
                t.setDaemon(true);
                return t;
            });
            long intervalMillis = properties.interval().toMillis();
            janitor.scheduleAtFixedRate(this::runCleanup, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
            log.info("Temporary file cleanup every {} for files older than {} in {}",
                    properties.interval(), properties.fileAgeThreshold(), directory);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            janitor.shutdownNow();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    /**
     * Deletes expired workspace files and returns how many were removed.
     */
    public int cleanupOnce() throws IOException {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(properties.fileAgeThreshold());
        List<Path> candidates;
        try (Stream<Path> files = Files.list(directory)) {
            candidates = files
                    .filter(file -> file.getFileName().toString().startsWith(FunctionWorkspace.PREFIX))
                    .filter(Files::isRegularFile)
                    .filter(file -> !FunctionWorkspace.isLive(file))
                    .toList();
        }
        int deleted = 0;
        for (Path file : candidates) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff) && Files.deleteIfExists(file)) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
            }
        }
        return deleted;
    }

    private void runCleanup() {
        try {
            int deleted = cleanupOnce();
            if (deleted > 0) {
                log.info("Removed {} expired temporary files from {}", deleted, directory);
            }
        } catch (IOException | RuntimeException e) {
            log.error("Temporary file cleanup failed", e);
        }
    }
}
