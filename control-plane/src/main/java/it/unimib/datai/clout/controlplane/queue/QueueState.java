package it.unimib.datai.clout.controlplane.queue;

import it.unimib.datai.clout.common.model.QueueConfig;
import it.unimib.datai.clout.common.model.QueueStats;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory index of one queue. Every field except {@link #snapshot()} is guarded by {@link #lock()}.
 */
final class QueueState {
    private final String name;
    private final Path directory;
    private final QueueConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<QueueManifest.Entry> entries = new ArrayDeque<>();
    private long totalBytes;
    private boolean deleted;
    private volatile QueueStats snapshot;

    QueueState(String name, Path directory, QueueConfig config) {
        this.name = name;
        this.directory = directory;
        this.config = config;
        this.snapshot = new QueueStats(name, 0, 0);
    }

    String name() {
        return name;
    }

    Path directory() {
        return directory;
    }

    QueueConfig config() {
        return config;
    }

    ReentrantLock lock() {
        return lock;
    }

    Condition notEmpty() {
        return notEmpty;
    }

    ArrayDeque<QueueManifest.Entry> entries() {
        return entries;
    }

    List<QueueManifest.Entry> entriesCopy() {
        return new ArrayList<>(entries);
    }

    long totalBytes() {
        return totalBytes;
    }

    void append(QueueManifest.Entry entry) {
        entries.addLast(entry);
        totalBytes += entry.size();
    }

    QueueManifest.Entry removeHead() {
        QueueManifest.Entry head = entries.pollFirst();
        if (head != null) {
            totalBytes -= head.size();
        }
        return head;
    }

    void clear() {
        entries.clear();
        totalBytes = 0;
    }

    boolean isDeleted() {
        return deleted;
    }

    void markDeleted() {
        deleted = true;
    }

    /**
     * Publishes the current counters; called under the lock after every committed mutation.
     */
    void publish() {
        snapshot = new QueueStats(name, entries.size(), totalBytes);
    }

    QueueStats snapshot() {
        return snapshot;
    }

    QueueManifest manifest(List<QueueManifest.Entry> messages) {
        return new QueueManifest(QueueManifest.CURRENT_VERSION, name, config, messages);
    }
}
