package com.knowledgeplatform.knowledge.cache;

import java.time.Instant;

/**
 * Serialized payload plus the instant after which it no longer counts as present.
 */
public record CachedValue(
    String value,
    Instant expiresAt
) {
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
