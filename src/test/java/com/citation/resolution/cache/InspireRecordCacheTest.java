package com.citation.resolution.cache;

import com.citation.resolution.source.InspireRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InspireRecordCacheTest {

    private static final InspireRecord RECORD =
            new InspireRecord(List.of("LIGOScientific:2016aoc"), "2016PhRvL.116f1102A", "1602.03837", null);

    @Nested
    @DisplayName("NoOpInspireRecordCache")
    class NoOpTests {

        @Test
        @DisplayName("Should always return empty on get")
        void getAlwaysEmpty() {
            NoOpInspireRecordCache cache = new NoOpInspireRecordCache();
            cache.put("texkeys:LIGOScientific:2016aoc", RECORD);
            assertTrue(cache.get("texkeys:LIGOScientific:2016aoc").isEmpty());
        }

        @Test
        @DisplayName("Should return empty stats")
        void emptyStats() {
            CacheStats stats = new NoOpInspireRecordCache().getStats();
            assertEquals(0, stats.hits());
            assertEquals(0, stats.entries());
            assertEquals(0.0, stats.hitRate());
        }
    }

    @Nested
    @DisplayName("CaffeineInspireRecordCache")
    class CaffeineTests {

        @Test
        @DisplayName("Should return stored records and count hits and misses")
        void putAndGet() {
            CaffeineInspireRecordCache cache = new CaffeineInspireRecordCache(CacheConfig.defaults());

            assertTrue(cache.get("arxiv:1602.03837").isEmpty());
            cache.put("arxiv:1602.03837", RECORD);
            assertEquals(RECORD, cache.get("arxiv:1602.03837").orElseThrow());

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(2, stats.lookups());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Should cache empty records")
        void emptyRecord() {
            CaffeineInspireRecordCache cache = new CaffeineInspireRecordCache(CacheConfig.defaults());
            cache.put("texkeys:Nobody:2020xx", InspireRecord.empty());

            assertTrue(cache.get("texkeys:Nobody:2020xx").orElseThrow().isEmpty());
        }

        @Test
        @DisplayName("invalidateAll should clear every entry")
        void invalidateAll() {
            CaffeineInspireRecordCache cache = new CaffeineInspireRecordCache(CacheConfig.defaults());
            cache.put("arxiv:1602.03837", RECORD);

            cache.invalidateAll();

            assertTrue(cache.get("arxiv:1602.03837").isEmpty());
        }
    }

    @Nested
    @DisplayName("CacheConfig")
    class ConfigTests {

        @Test
        @DisplayName("create picks the implementation from the enabled flag")
        void create() {
            assertInstanceOf(CaffeineInspireRecordCache.class, CaffeineInspireRecordCache.create(CacheConfig.defaults()));
            assertInstanceOf(NoOpInspireRecordCache.class, CaffeineInspireRecordCache.create(CacheConfig.disabled()));
        }

        @Test
        @DisplayName("Rejects non-positive sizes and TTLs")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, Duration.ofSeconds(10), true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, Duration.ZERO, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, null, true));
        }
    }
}
