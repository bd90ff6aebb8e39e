package it.unimib.datai.clout.controlplane.execution;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Temporary files and child processes owned by one execution. Every file carries the
 * {@value #PREFIX} prefix so the cleanup service can find leftovers; {@link #close()} kills the
 * processes and deletes the files. Files of open workspaces are tracked process-wide so the
 * cleanup service never removes them.
 */
public final class FunctionWorkspace implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(FunctionWorkspace.class);
    private static final Set<Path> LIVE_FILES = ConcurrentHashMap.newKeySet();

    public static final String PREFIX = "clout_fn_";

    private final Path directory;
    private final String filePrefix;
    private final List<Path> files = new ArrayList<>();
    private final List<Process> processes = new ArrayList<>();
    private boolean closed;

    private FunctionWorkspace(Path directory, String functionName) {
        this.directory = directory;
        this.filePrefix = PREFIX + sanitize(functionName) + "_";
    }

    public static FunctionWorkspace open(Path directory, String functionName) throws IOException {
        Files.createDirectories(directory);
        return new FunctionWorkspace(directory, functionName);
    }

    /**
     * Whether the file belongs to a workspace that has not been closed yet.
     */
    public static boolean isLive(Path file) {
        return LIVE_FILES.contains(file.toAbsolutePath().normalize());
    }

    public Path directory() {
        return directory;
    }

    public synchronized Path write(byte[] content, String suffix) throws IOException {
        Path file = newFile(suffix);
        Files.write(file, content);
        return file;
    }

    public synchronized Path newFile(String suffix) throws IOException {
        if (closed) {
            throw new IOException("Workspace is closed");
        }
        Path file = Files.createTempFile(directory, filePrefix, suffix);
        files.add(file);
        LIVE_FILES.add(file.toAbsolutePath().normalize());
        return file;
    }

    /**
     * Ties a child process to this workspace; it is killed by {@link #destroyProcesses()} and on close.
     * A process attached after close is killed right away.
     */
    public void attach(Process process) {
        boolean alreadyClosed;
        synchronized (this) {
            alreadyClosed = closed;
            if (!alreadyClosed) {
                processes.add(process);
            }
        }
        if (alreadyClosed) {
            destroy(process);
        }
    }

    /**
     * Forcibly kills every attached process and its descendants.
     */
    public void destroyProcesses() {
        List<Process> attached;
        synchronized (this) {
            attached = List.copyOf(processes);
        }
        attached.forEach(FunctionWorkspace::destroy);
    }

    @Override
    public void close() {
        destroyProcesses();
        synchronized (this) {
            closed = true;
            processes.clear();
            for (Path file : files) {
                LIVE_FILES.remove(file.toAbsolutePath().normalize());
                try {
                    Files.deleteIfExists(file);
                } catch (IOException e) {
                    log.warn("Failed to delete workspace file {}: {}", file, e.getMessage());
                }
            }
            files.clear();
        }
    }

    private static void destroy(Process process) {
        if (process.isAlive()) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }
    }

    private static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "anonymous";
        }
        String safe = name.replaceAll("[^A-Za-z0-9_-]", "_");
        return safe.length() > 64 ? safe.substring(0, 64) : safe;
    }
}
