package com.citation.resolution.metrics;

import com.citation.resolution.core.model.ProviderName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code citation.fetch.duration}: Timer (tags: provider, outcome)</li>
 *   <li>{@code citation.accepted}: Counter (tag: provider)</li>
 *   <li>{@code citation.duplicate}: Counter</li>
 *   <li>{@code citation.existing}: Counter</li>
 *   <li>{@code citation.failed}: Counter</li>
 *   <li>{@code citation.run.size}: DistributionSummary</li>
 *   <li>{@code citation.lookup.cache.hit} / {@code citation.lookup.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<ProviderName, Counter> acceptedCounters = new ConcurrentHashMap<>();
    private final Counter duplicateCounter;
    private final Counter existingCounter;
    private final Counter failedCounter;
    private final DistributionSummary runSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.duplicateCounter = Counter.builder("citation.duplicate")
                .description("Keys skipped because they denote an already accepted paper")
                .register(registry);
        this.existingCounter = Counter.builder("citation.existing")
                .description("Keys skipped because they are already in the output set")
                .register(registry);
        this.failedCounter = Counter.builder("citation.failed")
                .description("Keys no provider could resolve")
                .register(registry);
        this.runSizeSummary = DistributionSummary.builder("citation.run.size")
                .description("Number of unique keys per run")
                .register(registry);
        this.cacheHitCounter = Counter.builder("citation.lookup.cache.hit")
                .description("INSPIRE metadata lookups served from cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("citation.lookup.cache.miss")
                .description("INSPIRE metadata lookups that went to the network")
                .register(registry);
    }

    @Override
    public void recordFetch(ProviderName provider, String outcome, Duration duration) {
        String key = provider.name() + ":" + outcome;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("citation.fetch.duration")
                        .description("Duration of single provider fetch attempts")
                        .tag("provider", provider.name())
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementAccepted(ProviderName provider) {
        acceptedCounters.computeIfAbsent(provider, p ->
                Counter.builder("citation.accepted")
                        .description("Entries accepted into the output set")
                        .tag("provider", p.name())
                        .register(registry)).increment();
    }

    @Override
    public void incrementDuplicate() {
        duplicateCounter.increment();
    }

    @Override
    public void incrementExisting() {
        existingCounter.increment();
    }

    @Override
    public void incrementFailed() {
        failedCounter.increment();
    }

    @Override
    public void recordRunSize(int keys) {
        runSizeSummary.record(keys);
    }

    @Override
    public void recordLookupCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordLookupCacheMiss() {
        cacheMissCounter.increment();
    }
}
