package it.unimib.datai.clout.controlplane.api;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Moves disk and lock-bound calls off the event loop.
 */
final class Blocking {

    private Blocking() {
    }

    static <T> Mono<T> call(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
