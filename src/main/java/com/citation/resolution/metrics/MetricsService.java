package com.citation.resolution.metrics;

import com.citation.resolution.core.model.ProviderName;

import java.time.Duration;

/**
 * Interface for recording citation resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without a metrics registry.
 */
public interface MetricsService {

    /**
     * Records one adapter call.
     *
     * @param outcome {@code SUCCESS} or the failure reason name
     */
    void recordFetch(ProviderName provider, String outcome, Duration duration);

    void incrementAccepted(ProviderName provider);

    void incrementDuplicate();

    void incrementExisting();

    void incrementFailed();

    void recordRunSize(int keys);

    void recordLookupCacheHit();

    void recordLookupCacheMiss();
}
