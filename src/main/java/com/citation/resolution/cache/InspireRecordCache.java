package com.citation.resolution.cache;

import com.citation.resolution.source.InspireRecord;

import java.util.Optional;

/**
 * Cache of INSPIRE metadata lookups, keyed by INSPIRE search query.
 * Lives for one engine instance only; nothing is persisted between runs.
 */
public interface InspireRecordCache {

    /**
     * Gets a cached lookup. A present {@link InspireRecord#empty()} means INSPIRE
     * was asked and had no hit.
     */
    Optional<InspireRecord> get(String query);

    void put(String query, InspireRecord record);

    void invalidateAll();

    CacheStats getStats();
}
