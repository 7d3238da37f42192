package com.citation.resolution.bibtex;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BibtexEntries Tests")
class BibtexEntriesTest {

    private static final String ADS_ENTRY = """
            @ARTICLE{2016PhRvL.116f1102A,
                   author = {{Abbott}, B.~P. and {Abbott}, R.},
                    title = "{Observation of Gravitational Waves from a Binary Black Hole Merger}",
                  journal = {\\prl},
                     year = 2016,
                      doi = {10.1103/PhysRevLett.116.061102},
                   eprint = {1602.03837}
            }""";

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("Extracts the entry key")
        void extractKey() {
            assertEquals(Optional.of("2016PhRvL.116f1102A"), BibtexEntries.extractKey(ADS_ENTRY));
            assertEquals(Optional.empty(), BibtexEntries.extractKey("no entry here"));
            assertEquals(Optional.empty(), BibtexEntries.extractKey(null));
        }

        @Test
        @DisplayName("Replaces only the entry key")
        void replaceKey() {
            String replaced = BibtexEntries.replaceKey(ADS_ENTRY, "LIGOScientific:2016aoc");

            assertTrue(replaced.startsWith("@ARTICLE{LIGOScientific:2016aoc,\n"));
            assertTrue(replaced.contains("eprint = {1602.03837}"));
        }

        @Test
        @DisplayName("Tolerates whitespace around the key")
        void whitespaceKey() {
            assertEquals("@misc{new,\n}", BibtexEntries.replaceKey("@misc{ old ,\n}", "new"));
        }
    }

    @Nested
    @DisplayName("Fields")
    class Fields {

        @Test
        @DisplayName("Reads braced and quoted values, case-insensitively")
        void extractFields() {
            Map<String, String> fields = BibtexEntries.extractFields(ADS_ENTRY, "eprint", "DOI", "volume");

            assertEquals("1602.03837", fields.get("eprint"));
            assertEquals("10.1103/PhysRevLett.116.061102", fields.get("DOI"));
            assertFalse(fields.containsKey("volume"));
        }

        @Test
        @DisplayName("Reads quoted values")
        void quoted() {
            assertEquals(Optional.of("2001.00001"),
                    BibtexEntries.extractField("@misc{x,\n  eprint = \"2001.00001\"\n}", "eprint"));
        }
    }

    @Test
    @DisplayName("Builds the crossref stub")
    void crossrefStub() {
        assertEquals("@misc{2508.18080,\n  crossref = {LIGOScientific:2025hdt}\n}",
                BibtexEntries.crossrefStub("2508.18080", "LIGOScientific:2025hdt"));
    }

    @Test
    @DisplayName("Recognizes well-formed entries")
    void wellFormed() {
        assertTrue(BibtexEntries.isWellFormed(ADS_ENTRY));
        assertFalse(BibtexEntries.isWellFormed("<html>Not found</html>"));
        assertFalse(BibtexEntries.isWellFormed(null));
    }

    @Nested
    @DisplayName("Document splitting")
    class Splitting {

        @Test
        @DisplayName("Splits on balanced braces and keeps directives")
        void splitBlocks() {
            String document = """
                    % generated
                    @string{apj = {ApJ}}

                    @article{A:2020ab,
                      title = {Nested {Braces} here},
                      note = {escaped \\} brace}
                    }
                    stray text
                    @comment(kept)
                    @misc{B:2020ab,
                      title = {B}
                    }
                    """;

            List<String> blocks = BibtexEntries.splitBlocks(document);

            assertEquals(4, blocks.size());
            assertTrue(BibtexEntries.isDirective(blocks.get(0)));
            assertEquals(Optional.of("A:2020ab"), BibtexEntries.extractKey(blocks.get(1)));
            assertTrue(blocks.get(1).endsWith("}"));
            assertEquals(Optional.of("comment"), BibtexEntries.blockType(blocks.get(2)));
            assertEquals(Optional.of("B:2020ab"), BibtexEntries.extractKey(blocks.get(3)));
        }

        @Test
        @DisplayName("segments keeps the free text between blocks in document order")
        void segments() {
            String document = """
                    % generated by hand
                    @string{apj = {ApJ}}
                    stray note
                    @misc{B:2020ab,
                      title = {B}
                    }
                    trailing words
                    """;

            List<BibtexEntries.Segment> segments = BibtexEntries.segments(document);

            assertEquals(List.of(false, true, false, true, false),
                    segments.stream().map(BibtexEntries.Segment::block).toList());
            assertEquals("% generated by hand", segments.get(0).text());
            assertEquals("stray note", segments.get(2).text());
            assertEquals("trailing words", segments.get(4).text());
        }

        @Test
        @DisplayName("Empty documents yield no blocks")
        void empty() {
            assertTrue(BibtexEntries.splitBlocks("").isEmpty());
            assertTrue(BibtexEntries.splitBlocks(null).isEmpty());
        }
    }
}
