package dev.devanks.dominion.usage.service;

import com.google.common.annotations.VisibleForTesting;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Runs operations one after another per key. Each operation starts only once the previous one for
 * the same key has terminated, whatever its outcome; operations for different keys run
 * independently.
 *
 * @param <T> result type
 */
@Slf4j
public class KeyedSerialExecutor<T> {

    private final ConcurrentMap<String, Mono<T>> tails = new ConcurrentHashMap<>();

    public Mono<T> execute(String key, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> tails.compute(key, (k, previous) -> chain(k, previous, operation)));
    }

    private Mono<T> chain(String key, Mono<T> previous, Supplier<Mono<T>> operation) {
        Mono<T> predecessor = previous == null ? Mono.empty() : previous.onErrorResume(e -> Mono.empty());
        if (previous != null) {
            log.debug("Queueing operation for key {} behind the running one", key);
        }
        AtomicReference<Mono<T>> self = new AtomicReference<>();
        Mono<T> next = predecessor
                .then(Mono.defer(operation))
                .doFinally(signal -> {
                    tails.remove(key, self.get());
                    log.debug("Operation for key {} finished with {}", key, signal);
                })
                .cache();
        self.set(next);
        return next;
    }

    @VisibleForTesting
    boolean hasPending(String key) {
        return tails.containsKey(key);
    }
}
