package it.unimib.datai.clout.controlplane.trigger;

public enum WorkerState {
    /** Waiting for a message. */
    IDLE,
    /** Executing a message. */
    RUNNING,
    /** Stop requested while executing; finishes the current message and exits. */
    DRAINING,
    STOPPED
}
