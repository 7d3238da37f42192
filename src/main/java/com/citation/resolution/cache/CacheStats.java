package com.citation.resolution.cache;

/**
 * Point-in-time counters of an {@link InspireRecordCache}.
 */
public record CacheStats(long hits, long misses, long evictions, long entries) {

    public long lookups() {
        return hits + misses;
    }

    /** Share of lookups answered from the cache, 0.0 when nothing was looked up. */
    public double hitRate() {
        long lookups = lookups();
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
