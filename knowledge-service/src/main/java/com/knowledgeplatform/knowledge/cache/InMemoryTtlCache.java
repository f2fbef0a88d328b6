package com.knowledgeplatform.knowledge.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TtlCache} backed by a {@link ConcurrentHashMap}.
 *
 * <p>Expired entries are evicted lazily on read. When the entry count exceeds
 * {@code maxEntries}, expired entries are purged before the write; if the map is
 * still full the new key is not stored and the next read is a miss. Overwrites of
 * keys already present always go through.
 *
 * <p>All operations are non-blocking map accesses wrapped in {@code Mono.fromCallable}
 * / {@code Mono.fromRunnable} so they stay lazy inside reactive chains.
 */
public class InMemoryTtlCache implements TtlCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTtlCache.class);

    private final ConcurrentHashMap<String, CachedValue> store = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public InMemoryTtlCache(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = Math.max(1, maxEntries);
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromCallable(() -> {
            CachedValue entry = store.get(key);
            if (entry == null) {
                log.debug("CACHE_MISS key={}", key);
                return null;
            }
            if (entry.isExpired(clock.instant())) {
                store.remove(key, entry);
                log.debug("CACHE_EXPIRED key={} expiresAt={}", key, entry.expiresAt());
                return null;
            }
            log.debug("CACHE_HIT key={}", key);
            return entry.value();
        });
    }

    @Override
    public Mono<Void> set(String key, String value, Duration ttl) {
        return Mono.fromRunnable(() -> {
            Instant now = clock.instant();
            if (store.size() >= maxEntries && !store.containsKey(key)) {
                evictExpired(now);
                if (store.size() >= maxEntries) {
                    log.warn("CACHE_FULL write skipped. size={} maxEntries={} key={}",
                             store.size(), maxEntries, key);
                    return;
                }
            }
            store.put(key, new CachedValue(value, now.plus(ttl)));
            log.info("CACHE_SET key={} ttlSeconds={}", key, ttl.toSeconds());
        });
    }

    int size() {
        return store.size();
    }

    private void evictExpired(Instant now) {
        store.entrySet().removeIf(e -> e.getValue().isExpired(now));
    }
}
