package com.citation.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Fingerprint Tests")
class FingerprintTest {

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        @DisplayName("DOI loses resolver prefix and case")
        void doi() {
            assertEquals("10.1103/physrevlett.116.061102",
                    Fingerprint.of(null, null, "https://doi.org/10.1103/PhysRevLett.116.061102").doi());
            assertEquals("10.1103/physrevlett.116.061102",
                    Fingerprint.of(null, null, "doi:10.1103/PhysRevLett.116.061102").doi());
        }

        @Test
        @DisplayName("Eprint loses arXiv prefix and version")
        void eprint() {
            assertEquals("1602.03837", Fingerprint.of(null, "arXiv:1602.03837v2", null).eprint());
            assertEquals("hep-ph/9905318", Fingerprint.of(null, "hep-ph/9905318v1", null).eprint());
        }

        @Test
        @DisplayName("Blank fields become absent")
        void blanks() {
            Fingerprint fp = Fingerprint.of("  ", "", null);
            assertTrue(fp.isEmpty());
        }
    }

    @Nested
    @DisplayName("Intersection")
    class Intersection {

        @Test
        @DisplayName("One shared field is enough")
        void singleField() {
            Fingerprint a = Fingerprint.of("LIGOScientific:2016aoc", "1602.03837", null);
            Fingerprint b = Fingerprint.of("2016PhRvL.116f1102A", "arXiv:1602.03837", "10.1103/x");
            assertTrue(a.intersects(b));
            assertTrue(b.intersects(a));
        }

        @Test
        @DisplayName("Absent fields never match each other")
        void absentFields() {
            Fingerprint a = Fingerprint.of("A:2020ab", null, null);
            Fingerprint b = Fingerprint.of("B:2020cd", null, null);
            assertFalse(a.intersects(b));
            assertFalse(Fingerprint.of(null, null, null).intersects(Fingerprint.of(null, null, null)));
        }

        @Test
        @DisplayName("Null other never matches")
        void nullOther() {
            assertFalse(Fingerprint.of("A:2020ab", null, null).intersects(null));
        }
    }

    @Test
    @DisplayName("ResolvedEntry derives its fingerprint from natural key, eprint and DOI")
    void resolvedEntryFingerprint() {
        CitationKey key = new CitationKey("2508.18080", KeyFormat.ARXIV_NEW);
        ResolvedEntry entry = ResolvedEntry.from(key, ProviderName.INSPIRE,
                FetchOutcome.success("@article{LIGOScientific:2025hdt,\n}", "LIGOScientific:2025hdt", "2508.18080v1", null));

        assertEquals(Fingerprint.of("LIGOScientific:2025hdt", "2508.18080", null), entry.fingerprint());
    }

    @Test
    @DisplayName("ResolvedEntry cannot be built from a failure")
    void resolvedEntryFromFailure() {
        CitationKey key = new CitationKey("X:2020ab", KeyFormat.INSPIRE);
        assertThrows(IllegalArgumentException.class,
                () -> ResolvedEntry.from(key, ProviderName.ADS, FetchOutcome.notFound("missing")));
    }
}
