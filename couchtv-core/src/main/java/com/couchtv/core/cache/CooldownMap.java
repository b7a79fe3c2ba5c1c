package com.couchtv.core.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Last failure time per key. A key is cooling down while {@code now - lastFailure < cooldown}.
 */
public class CooldownMap<K> {

    private final Map<K, Instant> lastFailures = new HashMap<>();
    private final Duration cooldown;

    public CooldownMap(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public void recordFailure(K key, Instant at) {
        lastFailures.put(key, at);
    }

    public boolean isCoolingDown(K key, Instant now) {
        Instant failedAt = lastFailures.get(key);
        return failedAt != null && Duration.between(failedAt, now).compareTo(cooldown) < 0;
    }

    public void remove(K key) {
        lastFailures.remove(key);
    }

    public void clear() {
        lastFailures.clear();
    }

    public Duration cooldown() {
        return cooldown;
    }
}
