package it.unimib.datai.clout.controlplane.queue;

import it.unimib.datai.clout.common.CancellationSignal;
import it.unimib.datai.clout.common.model.QueueConfig;
import it.unimib.datai.clout.common.model.QueueMessage;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Named FIFO queues of opaque payloads that survive process restarts.
 *
 * <p>Operations on unknown queues create them with the default configuration.
 * All failures surface as {@link it.unimib.datai.clout.common.CloutException}.</p>
 */
public interface QueueServer extends QueueStatsSource {

    /**
     * Ensures the queue exists; a no-op when it already does, whatever its configuration.
     */
    void createQueue(String name);

    /**
     * Creates the queue with an explicit configuration. Repeating the call with an equal
     * configuration is a no-op; a different configuration for an existing queue is rejected.
     */
    void createQueue(String name, QueueConfig config);

    boolean deleteQueue(String name);

    /**
     * Appends a payload and returns the message id once it is durable.
     */
    String enqueue(String name, byte[] payload, String contentType);

    /**
     * Removes and returns the head message, waiting up to {@code timeout} for one to arrive.
     * Returns empty on timeout or cancellation; a cancelled wait never removes a message.
     */
    Optional<QueueMessage> dequeue(String name, Duration timeout, CancellationSignal cancellation)
            throws InterruptedException;

    /**
     * Removes every message and returns how many were removed.
     */
    int purge(String name);

    List<String> queueNames();

    Optional<QueueConfig> config(String name);
}
