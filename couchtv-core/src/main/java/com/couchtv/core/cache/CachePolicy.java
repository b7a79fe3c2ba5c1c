package com.couchtv.core.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Freshness and retry settings for one cache instance.
 *
 * @param ttl      how long a fetched value counts as fresh
 * @param cooldown how long a key is left alone after a failed fetch
 */
public record CachePolicy(Duration ttl, Duration cooldown) {

    public CachePolicy {
        Objects.requireNonNull(ttl, "ttl");
        Objects.requireNonNull(cooldown, "cooldown");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must not be negative: " + cooldown);
        }
    }

    public static CachePolicy ofSeconds(long ttlSeconds, long cooldownSeconds) {
        return new CachePolicy(Duration.ofSeconds(ttlSeconds), Duration.ofSeconds(cooldownSeconds));
    }
}
