package it.unimib.datai.clout.controlplane.queue;

import it.unimib.datai.clout.common.model.QueueStats;

import java.util.List;

/**
 * Read-only view of queue occupancy, for monitoring collaborators that must not mutate queues.
 */
public interface QueueStatsSource {

    /**
     * One snapshot per queue, ordered by queue name. Each snapshot is internally consistent.
     */
    List<QueueStats> stats();
}
