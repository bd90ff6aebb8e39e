package it.unimib.datai.clout.controlplane.execution;

import it.unimib.datai.clout.common.CancellationSignal;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide cap on concurrently running executions. Waiters are served in arrival order.
 */
public class ExecutionGate {
    private static final long POLL_MILLIS = 50;

    private final Semaphore permits;
    private final int capacity;
    private final AtomicInteger inFlight = new AtomicInteger();

    public ExecutionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a slot is free. Returns {@code null} if the signal is cancelled first.
     */
    public Permit acquire(CancellationSignal cancellation) throws InterruptedException {
        while (!cancellation.isCancelled()) {
            if (permits.tryAcquire(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    permits.release();
                    return null;
                }
                inFlight.incrementAndGet();
                return new Permit();
            }
        }
        return null;
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public final class Permit implements AutoCloseable {
        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        /**
         * Returns the slot. Idempotent and safe to call from any thread.
         */
        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.decrementAndGet();
                permits.release();
            }
        }
    }
}
