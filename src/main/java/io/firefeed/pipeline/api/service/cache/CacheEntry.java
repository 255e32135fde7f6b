package io.firefeed.pipeline.api.service.cache;

import java.time.Instant;

public record CacheEntry<K, V>(K key, V value, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
