package it.unimib.datai.clout.controlplane.trigger;

import it.unimib.datai.clout.common.CancellationSignal;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * State of the worker bound to one function. Two signals control it: {@code stopSignal} ends
 * polling and retries but lets the current execution finish; {@code killSignal} cancels the
 * current execution as well.
 */
final class QueueWorker {
    private final String functionId;
    private final String queueName;
    private final CancellationSignal stopSignal = new CancellationSignal();
    private final CancellationSignal killSignal = new CancellationSignal();
    private final CountDownLatch stopped = new CountDownLatch(1);
    private WorkerState state = WorkerState.IDLE;
    private boolean stopRequested;

    QueueWorker(String functionId, String queueName) {
        this.functionId = functionId;
        this.queueName = queueName;
    }

    String functionId() {
        return functionId;
    }

    String queueName() {
        return queueName;
    }

    CancellationSignal stopSignal() {
        return stopSignal;
    }

    CancellationSignal killSignal() {
        return killSignal;
    }

    synchronized WorkerState state() {
        return state;
    }

    synchronized boolean isStopRequested() {
        return stopRequested;
    }

    synchronized void markIdle() {
        if (state != WorkerState.STOPPED && !stopRequested) {
            state = WorkerState.IDLE;
        }
    }

    synchronized void markRunning() {
        if (state != WorkerState.STOPPED) {
            state = stopRequested ? WorkerState.DRAINING : WorkerState.RUNNING;
        }
    }

    void requestStop() {
        synchronized (this) {
            stopRequested = true;
            if (state == WorkerState.RUNNING) {
                state = WorkerState.DRAINING;
            }
        }
        stopSignal.cancel();
    }

    void kill() {
        requestStop();
        killSignal.cancel();
    }

    void markStopped() {
        synchronized (this) {
            state = WorkerState.STOPPED;
        }
        stopped.countDown();
    }

    boolean awaitStopped(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
}
