package com.citation.resolution.persistence;

import com.citation.resolution.merge.OutputEntrySet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("BibFileStore Tests")
class BibFileStoreTest {

    @TempDir
    Path tempDir;

    private final BibFileStore store = new BibFileStore();

    @Test
    @DisplayName("A missing file reads as an empty set")
    void missingFile() {
        OutputEntrySet set = store.read(tempDir.resolve("refs.bib"));

        assertTrue(set.isEmpty());
        assertTrue(set.preamble().isEmpty());
    }

    @Test
    @DisplayName("Reads entries in file order and keeps directives as preamble")
    void readsEntries() throws IOException {
        Path file = tempDir.resolve("refs.bib");
        Files.writeString(file, """
                @string{apj = {ApJ}}

                @article{LIGOScientific:2016aoc,
                  title = {Observation},
                  eprint = {1602.03837}
                }

                @misc{1602.03837,
                  crossref = {LIGOScientific:2016aoc}
                }

                @article{LIGOScientific:2016aoc,
                  title = {Duplicate}
                }
                """, StandardCharsets.UTF_8);

        OutputEntrySet set = store.read(file);

        assertEquals(List.of("LIGOScientific:2016aoc", "1602.03837"), set.keys());
        assertTrue(set.get("LIGOScientific:2016aoc").orElseThrow().contains("Observation"));
        assertEquals(List.of("@string{apj = {ApJ}}"), set.preamble());
        assertEquals(1, set.leftovers().size());
        assertTrue(set.leftovers().get(0).contains("Duplicate"));
    }

    @Test
    @DisplayName("Comment lines, unkeyed blocks and repeated keys survive a rewrite")
    void keepsEverythingOnRewrite() throws IOException {
        Path file = tempDir.resolve("refs.bib");
        Files.writeString(file, """
                % Bibliography for chapter 2, do not edit by hand
                @article{A:2020ab,
                  title = {First}
                }
                % duplicated below on purpose
                @article{A:2020ab,
                  title = {Second}
                }
                @misc{
                  title = {No key}
                }
                """, StandardCharsets.UTF_8);

        OutputEntrySet set = store.read(file);
        set.insert("B:2021cd", "@article{B:2021cd,\n  title = {New}\n}");
        store.write(file, set);
        String written = Files.readString(file);

        assertTrue(written.contains("% Bibliography for chapter 2, do not edit by hand"));
        assertTrue(written.contains("% duplicated below on purpose"));
        assertTrue(written.contains("title = {Second}"));
        assertTrue(written.contains("title = {No key}"));
        assertTrue(written.contains("title = {New}"));

        OutputEntrySet reread = store.read(file);
        assertEquals(List.of("A:2020ab", "B:2021cd"), reread.keys());
        assertTrue(reread.get("A:2020ab").orElseThrow().contains("First"));
        assertEquals(set.leftovers(), reread.leftovers());
        store.write(file, reread);
        assertEquals(written, Files.readString(file));
    }

    @Test
    @DisplayName("Write then read returns the same entries")
    void writeRead() {
        OutputEntrySet set = new OutputEntrySet();
        set.addPreamble("@preamble{\"\\newcommand{\\noop}[1]{}\"}");
        set.insert("Gödel:1931ab", "@article{Gödel:1931ab,\n  title = {Über formal unentscheidbare Sätze}\n}");
        set.insert("2508.18080", "@misc{2508.18080,\n  crossref = {LIGOScientific:2025hdt}\n}");
        Path file = tempDir.resolve("out/refs.bib");

        store.write(file, set);
        OutputEntrySet reread = store.read(file);

        assertEquals(set.entries(), reread.entries());
        assertEquals(set.preamble(), reread.preamble());
    }

    @Test
    @DisplayName("Writing replaces the file and leaves no temporary files")
    void atomicReplace() throws IOException {
        Path file = tempDir.resolve("refs.bib");
        Files.writeString(file, "@misc{old,\n}\n");
        OutputEntrySet set = new OutputEntrySet();
        set.insert("new", "@misc{new,\n}");

        store.write(file, set);

        assertEquals("@misc{new,\n}\n\n", Files.readString(file));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(List.of(file), files.toList());
        }
    }

    @Test
    @DisplayName("readEntries exposes the entries as a map")
    void readEntries() throws IOException {
        Path file = tempDir.resolve("group.bib");
        Files.writeString(file, "@article{groupkey,\n  title = {Local}\n}\n");

        assertEquals(List.of("groupkey"), List.copyOf(store.readEntries(file).keySet()));
    }
}
