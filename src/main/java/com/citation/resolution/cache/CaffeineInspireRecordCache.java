package com.citation.resolution.cache;

import com.citation.resolution.source.InspireRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed {@link InspireRecordCache}.
 * Shared by the ADS and Semantic Scholar adapters, which both need INSPIRE
 * cross-references for keys they cannot look up directly.
 */
public class CaffeineInspireRecordCache implements InspireRecordCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineInspireRecordCache.class);

    private final Cache<String, InspireRecord> cache;

    public CaffeineInspireRecordCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(config.ttl())
                .recordStats()
                .build();
        log.info("cache.initialized maxSize={} ttl={}", config.maxSize(), config.ttl());
    }

    /**
     * Creates the cache matching the configuration: Caffeine when enabled, no-op otherwise.
     */
    public static InspireRecordCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineInspireRecordCache(config) : new NoOpInspireRecordCache();
    }

    @Override
    public Optional<InspireRecord> get(String query) {
        return Optional.ofNullable(cache.getIfPresent(query));
    }

    @Override
    public void put(String query, InspireRecord record) {
        cache.put(query, record);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
