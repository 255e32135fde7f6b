package io.firefeed.pipeline.api.service.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * In-memory cache with per-entry expiry and a size bound.
 * <p>
 * Entries are kept in access order; inserting past {@code maxSize} evicts exactly the
 * least recently used entry. Expired entries are dropped on read and by {@link #sweepExpired()}.
 * All state is guarded by one internal lock.
 */
public class TtlCache<K, V> {

    private final String name;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, CacheEntry<K, V>> entries = new LinkedHashMap<>(16, 0.75f, true);

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public TtlCache(String name, int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
        }
        this.name = name;
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public Optional<V> get(K key) {
        lock.lock();
        try {
            CacheEntry<K, V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                expirations++;
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    public void put(K key, V value) {
        put(key, value, defaultTtl);
    }

    public void put(K key, V value, Duration ttl) {
        Instant expiresAt = clock.instant().plus(ttl);
        lock.lock();
        try {
            entries.put(key, new CacheEntry<>(key, value, expiresAt));
            while (entries.size() > maxSize) {
                Iterator<K> eldest = entries.keySet().iterator();
                eldest.next();
                eldest.remove();
                evictions++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value or computes, stores and returns a new one. The loader
     * runs outside the lock, so two callers may compute the same key concurrently.
     */
    public V getOrCompute(K key, Function<K, V> loader) {
        Optional<V> cached = get(key);
        if (cached.isPresent()) {
            return cached.get();
        }
        V value = loader.apply(key);
        if (value != null) {
            put(key, value);
        }
        return value;
    }

    public boolean invalidate(K key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        lock.lock();
        try {
            int removed = 0;
            Iterator<Map.Entry<K, CacheEntry<K, V>>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                if (it.next().getValue().isExpired(now)) {
                    it.remove();
                    removed++;
                }
            }
            expirations += removed;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(name, entries.size(), maxSize, hits, misses, evictions, expirations);
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    public record CacheStats(
            String name,
            int size,
            int maxSize,
            long hits,
            long misses,
            long evictions,
            long expirations
    ) {
        public double getHitRate() {
            long total = hits + misses;
            return total > 0 ? (double) hits / total : 0.0;
        }
    }
}
