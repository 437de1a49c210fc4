package com.farearound.search.cache;

import java.time.Instant;

/**
 * A cached value and the instant after which it must no longer be served.
 */
public record CacheEntry<V>(V value, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
