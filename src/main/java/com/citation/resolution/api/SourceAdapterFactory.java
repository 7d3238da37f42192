package com.citation.resolution.api;

import com.citation.resolution.cache.CacheConfig;
import com.citation.resolution.cache.CaffeineInspireRecordCache;
import com.citation.resolution.cache.InspireRecordCache;
import com.citation.resolution.metrics.MetricsService;
import com.citation.resolution.source.AdsSourceAdapter;
import com.citation.resolution.source.HttpSourceSupport;
import com.citation.resolution.source.InspireClient;
import com.citation.resolution.source.InspireSourceAdapter;
import com.citation.resolution.source.LocalSourceAdapter;
import com.citation.resolution.source.SemanticScholarSourceAdapter;
import com.citation.resolution.source.SourceAdapterRegistry;

import java.util.Map;

/**
 * Builds the provider adapters described by a {@link ResolutionConfig}.
 * The adapters share one HTTP client and one INSPIRE metadata cache.
 */
public final class SourceAdapterFactory {

    private SourceAdapterFactory() {
    }

    /**
     * @param localEntries entries of the local collection, or {@code null} for none
     */
    public static SourceAdapterRegistry create(ResolutionConfig config, CacheConfig cacheConfig,
                                               MetricsService metricsService, Map<String, String> localEntries) {
        HttpSourceSupport http = HttpSourceSupport.create(config.getRequestTimeout());
        InspireRecordCache cache = CaffeineInspireRecordCache.create(
                cacheConfig != null ? cacheConfig : CacheConfig.defaults());
        InspireClient inspire = new InspireClient(http, config.getInspireBaseUrl(), cache, metricsService);

        SourceAdapterRegistry registry = new SourceAdapterRegistry()
                .register(new InspireSourceAdapter(inspire))
                .register(AdsSourceAdapter.builder()
                        .http(http)
                        .inspireClient(inspire)
                        .baseUrl(config.getAdsBaseUrl())
                        .apiKey(config.getAdsApiKey().orElse(null))
                        .build())
                .register(SemanticScholarSourceAdapter.builder()
                        .http(http)
                        .inspireClient(inspire)
                        .baseUrl(config.getSemanticScholarBaseUrl())
                        .apiKey(config.getSemanticScholarApiKey().orElse(null))
                        .build());

        if (localEntries != null && !localEntries.isEmpty()) {
            registry.register(new LocalSourceAdapter(localEntries));
        }
        return registry;
    }
}
