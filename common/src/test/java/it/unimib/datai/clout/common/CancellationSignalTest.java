package it.unimib.datai.clout.common;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationSignalTest {

    @Test
    void cancel_runsRegisteredCallbacksOnce() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        signal.cancel();
        signal.cancel();

        assertThat(signal.isCancelled()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void onCancel_afterCancellation_runsImmediately() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        AtomicInteger calls = new AtomicInteger();

        signal.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void closedRegistration_isNotInvoked() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        CancellationSignal.Registration registration = signal.onCancel(calls::incrementAndGet);

        registration.close();
        signal.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void await_returnsFalseOnTimeout_andTrueWhenCancelled() throws Exception {
        CancellationSignal signal = new CancellationSignal();
        assertThat(signal.await(Duration.ofMillis(20))).isFalse();

        CountDownLatch waiting = new CountDownLatch(1);
        Thread canceller = new Thread(() -> {
            try {
                waiting.await(1, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            signal.cancel();
        });
        canceller.start();
        waiting.countDown();

        assertThat(signal.await(Duration.ofSeconds(5))).isTrue();
        canceller.join();
    }

    @Test
    void failingCallback_doesNotPreventOthers() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("boom");
        });
        signal.onCancel(calls::incrementAndGet);

        assertThatThrownBy(signal::cancel).isInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(1);
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    void none_cannotBeCancelled() throws Exception {
        CancellationSignal none = CancellationSignal.none();

        assertThatThrownBy(none::cancel).isInstanceOf(UnsupportedOperationException.class);
        assertThat(none.isCancelled()).isFalse();
        assertThat(none.await(Duration.ofMillis(5))).isFalse();
    }
}
