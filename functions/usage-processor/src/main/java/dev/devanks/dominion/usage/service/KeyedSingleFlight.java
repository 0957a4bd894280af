package dev.devanks.dominion.usage.service;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * At most one pending operation per key. Callers arriving while an operation for their key is in
 * flight share its result instead of starting another; the key is released once the operation
 * terminates, so the next caller starts fresh.
 *
 * @param <T> result type
 */
@Slf4j
public class KeyedSingleFlight<T> {

    private final ConcurrentMap<String, Mono<T>> inFlight = new ConcurrentHashMap<>();

    public Mono<T> execute(String key, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> inFlight.computeIfAbsent(key, k -> start(k, operation)));
    }

    private Mono<T> start(String key, Supplier<Mono<T>> operation) {
        log.debug("Starting operation for key {}", key);
        AtomicReference<Mono<T>> self = new AtomicReference<>();
        Mono<T> shared = Mono.defer(operation)
                .doFinally(signal -> {
                    inFlight.remove(key, self.get());
                    log.debug("Operation for key {} finished with {}", key, signal);
                })
                .cache();
        self.set(shared);
        return shared;
    }

    @VisibleForTesting
    boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }
}
