package com.citation.resolution.persistence;

import com.citation.resolution.bibtex.BibtexEntries;
import com.citation.resolution.merge.OutputEntrySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Reads and writes {@code .bib} files as {@link OutputEntrySet}s.
 *
 * <p>Writes go to a temporary file in the target directory that is then moved over
 * the target, so a crash never leaves a half-written bibliography.</p>
 */
public class BibFileStore {
    private static final Logger log = LoggerFactory.getLogger(BibFileStore.class);

    /**
     * Loads a bibliography. A missing file yields an empty set.
     *
     * <p>Nothing in the file is lost on a later {@link #write}: directives and free text
     * become the preamble, and when a key appears twice the first entry is the one used
     * while the second is kept as a leftover, as is any block without a key.</p>
     */
    public OutputEntrySet read(Path file) {
        OutputEntrySet set = new OutputEntrySet();
        if (!Files.exists(file)) {
            log.debug("store.missing file={}", file);
            return set;
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
        for (BibtexEntries.Segment segment : BibtexEntries.segments(content)) {
            String block = segment.text();
            if (!segment.block() || BibtexEntries.isDirective(block)) {
                set.addPreamble(block);
                continue;
            }
            Optional<String> key = BibtexEntries.extractKey(block);
            if (key.isEmpty()) {
                log.warn("store.unkeyed_block file={} block={}", file, abbreviate(block));
                set.addLeftover(block);
                continue;
            }
            if (set.contains(key.get())) {
                log.warn("store.duplicate_key file={} key={}", file, key.get());
                set.addLeftover(block);
                continue;
            }
            set.insert(key.get(), block);
        }
        log.info("store.read file={} entries={}", file, set.size());
        return set;
    }

    /**
     * Reads a bibliography as a plain key to entry map, e.g. to back a local source.
     */
    public Map<String, String> readEntries(Path file) {
        return new LinkedHashMap<>(read(file).entries());
    }

    /**
     * Writes the set atomically: preamble blocks first, then entries in insertion order,
     * then leftovers, separated by blank lines. The file is replaced as a whole.
     */
    public void write(Path file, OutputEntrySet entries) {
        String content = render(entries);
        Path target = file.toAbsolutePath();
        Path directory = target.getParent();
        try {
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, content, StandardCharsets.UTF_8);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        log.info("store.written file={} entries={}", file, entries.size());
    }

    String render(OutputEntrySet entries) {
        StringBuilder out = new StringBuilder();
        for (String block : entries.preamble()) {
            out.append(block.strip()).append("\n\n");
        }
        for (String entry : entries.entries().values()) {
            out.append(entry.strip()).append("\n\n");
        }
        for (String block : entries.leftovers()) {
            out.append(block.strip()).append("\n\n");
        }
        return out.toString();
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("store.atomic_move_unsupported target={}", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static String abbreviate(String block) {
        String flat = block.replaceAll("\\s+", " ").trim();
        return flat.length() > 60 ? flat.substring(0, 60) + "..." : flat;
    }
}
