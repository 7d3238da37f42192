package com.citation.resolution.metrics;

import com.citation.resolution.core.model.ProviderName;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordFetch(ProviderName provider, String outcome, Duration duration) {
    }

    @Override
    public void incrementAccepted(ProviderName provider) {
    }

    @Override
    public void incrementDuplicate() {
    }

    @Override
    public void incrementExisting() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void recordRunSize(int keys) {
    }

    @Override
    public void recordLookupCacheHit() {
    }

    @Override
    public void recordLookupCacheMiss() {
    }
}
