package com.couchtv.core.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached value and the moment it was fetched. Entries are replaced wholesale on refresh.
 *
 * @param stale set by {@link CacheStore#markAllStale()}; a stale entry is never fresh
 */
public record CacheEntry<K, V>(K key, V value, Instant fetchedAt, boolean stale) {

    public CacheEntry(K key, V value, Instant fetchedAt) {
        this(key, value, fetchedAt, false);
    }

    /**
     * Fresh iff not marked stale and {@code now - fetchedAt < ttl}.
     */
    public boolean isFresh(Instant now, Duration ttl) {
        return !stale && Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }

    /**
     * Same value and fetch time, but due for refresh.
     */
    public CacheEntry<K, V> markedStale() {
        return new CacheEntry<>(key, value, fetchedAt, true);
    }
}
