package com.citation.resolution.core.model;

import java.util.Objects;

/**
 * An entry produced by a successful resolver run.
 * {@code naturalKey} is the key the provider's own record uses, which may differ
 * from the key found in the LaTeX source. Consumed exactly once by the merger.
 */
public record ResolvedEntry(
        CitationKey citationKey,
        ProviderName provider,
        String rawEntry,
        String naturalKey,
        String eprint,
        String doi
) {
    public ResolvedEntry {
        Objects.requireNonNull(citationKey, "citationKey is required");
        Objects.requireNonNull(provider, "provider is required");
        Objects.requireNonNull(rawEntry, "rawEntry is required");
        Objects.requireNonNull(naturalKey, "naturalKey is required");
    }

    /**
     * Builds the entry from a successful fetch outcome.
     */
    public static ResolvedEntry from(CitationKey key, ProviderName provider, FetchOutcome outcome) {
        if (!outcome.isSuccess()) {
            throw new IllegalArgumentException("Cannot build an entry from a failed outcome: " + outcome);
        }
        return new ResolvedEntry(key, provider, outcome.rawEntry(), outcome.sourceKey(),
                outcome.eprint(), outcome.doi());
    }

    public Fingerprint fingerprint() {
        return Fingerprint.of(naturalKey, eprint, doi);
    }
}
