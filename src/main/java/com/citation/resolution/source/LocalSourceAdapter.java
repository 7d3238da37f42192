package com.citation.resolution.source;

import com.citation.resolution.bibtex.BibtexEntries;
import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.ProviderName;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pseudo-provider backed by a pre-loaded entry collection, e.g. a shared group
 * {@code .bib} file. Keys are arbitrary strings; no format constraint applies.
 */
public class LocalSourceAdapter implements SourceAdapter {

    private final Map<String, String> entries;

    public LocalSourceAdapter(Map<String, String> entries) {
        this.entries = entries != null ? new LinkedHashMap<>(entries) : Map.of();
    }

    @Override
    public ProviderName provider() {
        return ProviderName.LOCAL_SOURCE;
    }

    /**
     * Synchronous lookup of the entry text stored under a raw key.
     */
    public Optional<String> lookup(String rawKey) {
        return Optional.ofNullable(entries.get(rawKey));
    }

    public boolean contains(String rawKey) {
        return entries.containsKey(rawKey);
    }

    public int size() {
        return entries.size();
    }

    @Override
    public FetchOutcome fetch(CitationKey key) {
        Optional<String> entry = lookup(key.raw());
        if (entry.isEmpty()) {
            return FetchOutcome.notFound("Key " + key.raw() + " is not in the local source");
        }
        String text = entry.get();
        Map<String, String> fields = BibtexEntries.extractFields(text, "eprint", "doi");
        String sourceKey = BibtexEntries.extractKey(text).orElse(key.raw());
        return FetchOutcome.success(text, sourceKey, fields.get("eprint"), fields.get("doi"));
    }
}
