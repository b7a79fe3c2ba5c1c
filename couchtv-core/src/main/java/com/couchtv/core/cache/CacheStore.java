package com.couchtv.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Keyed values with their fetch time. Stale entries are never evicted, only overwritten.
 * Not thread-safe; owned by the consumer thread.
 */
public class CacheStore<K, V> {

    private final Map<K, CacheEntry<K, V>> entries = new HashMap<>();
    private final Duration ttl;

    public CacheStore(Duration ttl) {
        this.ttl = ttl;
    }

    public void put(K key, V value, Instant fetchedAt) {
        entries.put(key, new CacheEntry<>(key, value, fetchedAt));
    }

    public Optional<V> get(K key) {
        CacheEntry<K, V> entry = entries.get(key);
        return entry != null ? Optional.of(entry.value()) : Optional.empty();
    }

    public Optional<CacheEntry<K, V>> entry(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public boolean contains(K key) {
        return entries.containsKey(key);
    }

    public boolean isFresh(K key, Instant now) {
        CacheEntry<K, V> entry = entries.get(key);
        return entry != null && entry.isFresh(now, ttl);
    }

    public void remove(K key) {
        entries.remove(key);
    }

    /**
     * Keep every value readable but make all of them due for refresh.
     */
    public void markAllStale() {
        entries.replaceAll((key, entry) -> entry.markedStale());
    }

    public void clear() {
        entries.clear();
    }

    public Set<K> keys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(entries.keySet()));
    }

    public int size() {
        return entries.size();
    }

    public Duration ttl() {
        return ttl;
    }
}
