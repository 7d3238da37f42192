package com.citation.resolution.metrics;

import com.citation.resolution.core.model.ProviderName;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordFetch(ProviderName.INSPIRE, "SUCCESS", Duration.ofMillis(100));
                noOp.incrementAccepted(ProviderName.ADS);
                noOp.incrementDuplicate();
                noOp.incrementExisting();
                noOp.incrementFailed();
                noOp.recordRunSize(12);
                noOp.recordLookupCacheHit();
                noOp.recordLookupCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record fetch durations per provider and outcome")
        void recordFetch() {
            metrics.recordFetch(ProviderName.INSPIRE, "SUCCESS", Duration.ofMillis(150));
            metrics.recordFetch(ProviderName.INSPIRE, "SUCCESS", Duration.ofMillis(250));
            metrics.recordFetch(ProviderName.INSPIRE, "NOT_FOUND", Duration.ofMillis(50));

            Timer success = registry.find("citation.fetch.duration")
                    .tag("provider", "INSPIRE")
                    .tag("outcome", "SUCCESS")
                    .timer();
            Timer notFound = registry.find("citation.fetch.duration")
                    .tag("provider", "INSPIRE")
                    .tag("outcome", "NOT_FOUND")
                    .timer();

            assertNotNull(success);
            assertEquals(2, success.count());
            assertNotNull(notFound);
            assertEquals(1, notFound.count());
        }

        @Test
        @DisplayName("Should count accepted entries per provider")
        void incrementAccepted() {
            metrics.incrementAccepted(ProviderName.INSPIRE);
            metrics.incrementAccepted(ProviderName.INSPIRE);
            metrics.incrementAccepted(ProviderName.SEMANTIC_SCHOLAR);

            Counter inspire = registry.find("citation.accepted").tag("provider", "INSPIRE").counter();
            Counter s2 = registry.find("citation.accepted").tag("provider", "SEMANTIC_SCHOLAR").counter();

            assertNotNull(inspire);
            assertEquals(2.0, inspire.count());
            assertNotNull(s2);
            assertEquals(1.0, s2.count());
        }

        @Test
        @DisplayName("Should count skipped and failed keys")
        void dispositionCounters() {
            metrics.incrementDuplicate();
            metrics.incrementExisting();
            metrics.incrementExisting();
            metrics.incrementFailed();

            assertEquals(1.0, registry.get("citation.duplicate").counter().count());
            assertEquals(2.0, registry.get("citation.existing").counter().count());
            assertEquals(1.0, registry.get("citation.failed").counter().count());
        }

        @Test
        @DisplayName("Should record run sizes")
        void recordRunSize() {
            metrics.recordRunSize(10);
            metrics.recordRunSize(30);

            DistributionSummary summary = registry.get("citation.run.size").summary();
            assertEquals(2, summary.count());
            assertEquals(40.0, summary.totalAmount());
        }

        @Test
        @DisplayName("Should count lookup cache hits and misses")
        void cacheCounters() {
            metrics.recordLookupCacheHit();
            metrics.recordLookupCacheMiss();
            metrics.recordLookupCacheMiss();

            assertEquals(1.0, registry.get("citation.lookup.cache.hit").counter().count());
            assertEquals(2.0, registry.get("citation.lookup.cache.miss").counter().count());
        }
    }
}
