package com.citation.resolution.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thread-safe, insertion-ordered mapping from entry key to BibTeX entry text.
 * Keys are unique; inserting an existing key replaces its text in place.
 *
 * <p>Directive blocks ({@code @string}, {@code @preamble}, {@code @comment}) and free text
 * read from a file are kept verbatim as a preamble and written back ahead of the entries.
 * Blocks that cannot be keyed entries (no key, or a key already taken) are kept as
 * leftovers and written back after them.</p>
 */
public class OutputEntrySet {

    private final Map<String, String> entries = new LinkedHashMap<>();
    private final List<String> preamble = new ArrayList<>();
    private final List<String> leftovers = new ArrayList<>();

    public OutputEntrySet() {
    }

    public OutputEntrySet(Map<String, String> initial) {
        if (initial != null) {
            entries.putAll(initial);
        }
    }

    public synchronized boolean contains(String key) {
        return entries.containsKey(key);
    }

    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Inserts or replaces an entry.
     *
     * @return true if the key was new
     */
    public synchronized boolean insert(String key, String entry) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Entry key cannot be blank");
        }
        if (entry == null) {
            throw new IllegalArgumentException("Entry text cannot be null for key " + key);
        }
        return entries.put(key, entry) == null;
    }

    public synchronized void addPreamble(String block) {
        if (block != null && !block.isBlank()) {
            preamble.add(block);
        }
    }

    public synchronized List<String> preamble() {
        return List.copyOf(preamble);
    }

    public synchronized void addLeftover(String block) {
        if (block != null && !block.isBlank()) {
            leftovers.add(block);
        }
    }

    public synchronized List<String> leftovers() {
        return List.copyOf(leftovers);
    }

    public synchronized List<String> keys() {
        return List.copyOf(entries.keySet());
    }

    /**
     * Snapshot of the entries in insertion order.
     */
    public synchronized Map<String, String> entries() {
        return new LinkedHashMap<>(entries);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }
}
