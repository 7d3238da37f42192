package com.citation.resolution.cache;

import com.citation.resolution.source.InspireRecord;

import java.util.Optional;

/**
 * No-op cache implementation. Used when caching is disabled.
 */
public class NoOpInspireRecordCache implements InspireRecordCache {

    @Override
    public Optional<InspireRecord> get(String query) {
        return Optional.empty();
    }

    @Override
    public void put(String query, InspireRecord record) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
