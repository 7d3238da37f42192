package com.citation.resolution.cache;

import java.time.Duration;

/**
 * Sizing of the INSPIRE record cache, which spares a second metadata
 * lookup when the same record is reached through two keys in one run.
 *
 * @param maxSize maximum number of cached records
 * @param ttl     how long a record stays after it is written
 * @param enabled {@code false} to always hit the network
 */
public record CacheConfig(int maxSize, Duration ttl, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    /** 2,000 records for one hour. */
    public static CacheConfig defaults() {
        return new CacheConfig(2_000, Duration.ofHours(1), true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, Duration.ofSeconds(1), false);
    }
}
