package com.knowledgeplatform.knowledge.cache;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Key/value cache with per-entry expiration. An expired entry reads as absent.
 *
 * <p>Only point reads and unconditional overwrites are offered; callers never need
 * read-modify-write atomicity.
 */
public interface TtlCache {

    /** Emits the cached value, or completes empty when absent or expired. */
    Mono<String> get(String key);

    /** Stores {@code value} under {@code key}, replacing any previous entry. */
    Mono<Void> set(String key, String value, Duration ttl);
}
