package com.citation.resolution.tex;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CiteKeyExtractor Tests")
class CiteKeyExtractorTest {

    private final CiteKeyExtractor extractor = new CiteKeyExtractor();

    @Nested
    @DisplayName("Commands")
    class Commands {

        @Test
        @DisplayName("Finds every cite variant")
        void variants() {
            String tex = "\\cite{A:2020ab} \\citep{B:2020ab} \\citet{C:2020ab} \\citealt{D:2020ab} \\Citep{E:2020ab}";

            assertEquals(List.of("A:2020ab", "B:2020ab", "C:2020ab", "D:2020ab", "E:2020ab"),
                    extractor.extract(tex, "paper.tex").keys());
        }

        @Test
        @DisplayName("Skips optional arguments")
        void optionalArguments() {
            String tex = "as shown \\citep[e.g.][p.~3]{LIGOScientific:2016aoc} and \\citet[see][]{2508.18080}";

            assertEquals(List.of("LIGOScientific:2016aoc", "2508.18080"), extractor.extract(tex, "paper.tex").keys());
        }

        @Test
        @DisplayName("Splits comma-separated keys and trims them")
        void multipleKeys() {
            String tex = "\\cite{LIGOScientific:2016aoc, 2016PhRvL.116f1102A,hep-ph/9905318}";

            assertEquals(List.of("LIGOScientific:2016aoc", "2016PhRvL.116f1102A", "hep-ph/9905318"),
                    extractor.extract(tex, "paper.tex").keys());
        }

        @Test
        @DisplayName("Keeps first appearance order without repeats")
        void dedupes() {
            String tex = "\\cite{B:2020ab}\\cite{A:2020ab}\\cite{B:2020ab}";

            assertEquals(List.of("B:2020ab", "A:2020ab"), extractor.extract(tex, "paper.tex").keys());
        }
    }

    @Test
    @DisplayName("Empty keys produce warnings")
    void emptyKeys() {
        CiteKeyExtractor.ExtractionResult result = extractor.extract("\\cite{A:2020ab,,B:2020ab,}", "paper.tex");

        assertEquals(List.of("A:2020ab", "B:2020ab"), result.keys());
        assertEquals(2, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("paper.tex: Empty citation key"));
    }

    @Test
    @DisplayName("Commented-out citations are ignored, escaped percent signs are not comments")
    void comments() {
        String tex = "% \\cite{Old:1999aa}\n50\\% of \\cite{New:2020ab} % \\cite{Gone:2000aa}";

        assertEquals(List.of("New:2020ab"), extractor.extract(tex, "paper.tex").keys());
    }

    @Nested
    @DisplayName("Files")
    class FileInput {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Merges keys across files in order")
        void multipleFiles() throws IOException {
            Path intro = Files.writeString(tempDir.resolve("intro.tex"), "\\cite{A:2020ab,B:2020ab}");
            Path body = Files.writeString(tempDir.resolve("body.tex"), "\\citep{B:2020ab} \\citet{C:2020ab}");

            CiteKeyExtractor.ExtractionResult result = extractor.extractAll(List.of(intro, body));

            assertEquals(List.of("A:2020ab", "B:2020ab", "C:2020ab"), result.keys());
            assertFalse(result.hasWarnings());
        }

        @Test
        @DisplayName("A missing file is an UncheckedIOException")
        void missingFile() {
            assertThrows(UncheckedIOException.class, () -> extractor.extract(tempDir.resolve("absent.tex")));
        }
    }
}
