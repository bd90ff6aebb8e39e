package it.unimib.datai.clout.common;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation token shared between the party requesting a stop and the
 * blocking operations that should observe it.
 *
 * <p>Cancellation is one-way: once cancelled a signal stays cancelled. Callbacks registered
 * through {@link #onCancel(Runnable)} run exactly once, either on the cancelling thread or
 * immediately on registration when the signal is already cancelled.</p>
 */
public final class CancellationSignal {
    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CountDownLatch latch = new CountDownLatch(1);
    private final List<Registration> callbacks = new CopyOnWriteArrayList<>();
    private final boolean cancellable;

    private CancellationSignal(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public CancellationSignal() {
        this(true);
    }

    /**
     * A shared signal that can never be cancelled.
     */
    public static CancellationSignal none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The shared non-cancellable signal cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        latch.countDown();
        List<RuntimeException> failures = new ArrayList<>();
        for (Registration registration : callbacks) {
            try {
                registration.fire();
            } catch (RuntimeException e) {
                failures.add(e);
            }
        }
        if (!failures.isEmpty()) {
            RuntimeException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Registers a callback to run on cancellation. Closing the returned registration
     * removes the callback if it has not run yet.
     */
    public Registration onCancel(Runnable callback) {
        Registration registration = new Registration(callback);
        if (!cancellable) {
            return registration;
        }
        callbacks.add(registration);
        if (cancelled.get()) {
            registration.fire();
        }
        return registration;
    }

    /**
     * Waits until the signal is cancelled or the timeout elapses.
     *
     * @return {@code true} if the signal was cancelled
     */
    public boolean await(Duration timeout) throws InterruptedException {
        if (cancelled.get()) {
            return true;
        }
        if (timeout.isZero() || timeout.isNegative()) {
            return false;
        }
        return latch.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    public final class Registration implements AutoCloseable {
        private final Runnable callback;
        private final AtomicBoolean done = new AtomicBoolean(false);

        private Registration(Runnable callback) {
            this.callback = callback;
        }

        private void fire() {
            if (done.compareAndSet(false, true)) {
                callbacks.remove(this);
                callback.run();
            }
        }

        @Override
        public void close() {
            if (done.compareAndSet(false, true)) {
                callbacks.remove(this);
            }
        }
    }
}
