package com.snapshotclaim.api.controller;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Runs blocking store and chain-node calls off the event loop.
 */
final class BlockingCalls {

    private BlockingCalls() {
    }

    static <T> Mono<T> offload(Callable<T> work) {
        return Mono.fromCallable(work).subscribeOn(Schedulers.boundedElastic());
    }
}
