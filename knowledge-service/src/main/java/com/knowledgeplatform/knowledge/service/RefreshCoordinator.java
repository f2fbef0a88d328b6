package com.knowledgeplatform.knowledge.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Runs sector refreshes detached from the requesting subscriber.
 *
 * <p>Once started, a refresh keeps running when the caller cancels: its store and
 * cache writes are shared with every other caller and must still commit.
 *
 * <p>With {@code singleFlight} off (the default) every request that finds a stale
 * sector triggers its own refresh and concurrent refreshes overwrite each other,
 * last writer wins. With it on, concurrent requests for one sector share a single
 * in-flight refresh.
 */
public class RefreshCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RefreshCoordinator.class);

    private final boolean singleFlight;
    private final Map<String, Mono<Void>> inFlight = new ConcurrentHashMap<>();

    public RefreshCoordinator(boolean singleFlight) {
        this.singleFlight = singleFlight;
    }

    public Mono<Void> run(String sector, Supplier<Mono<Void>> refresh) {
        if (!singleFlight) {
            return detached(refresh);
        }
        return Mono.defer(() -> inFlight.computeIfAbsent(sector, key -> {
            log.debug("Refresh started. sector={} singleFlight=true", key);
            return detached(refresh)
                .doFinally(signal -> inFlight.remove(key))
                .cache();
        }));
    }

    int inFlightCount() {
        return inFlight.size();
    }

    private static Mono<Void> detached(Supplier<Mono<Void>> refresh) {
        return Mono.defer(() -> Mono.fromFuture(refresh.get().toFuture(), true));
    }
}
