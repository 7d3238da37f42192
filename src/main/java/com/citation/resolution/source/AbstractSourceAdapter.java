package com.citation.resolution.source;

import com.citation.resolution.bibtex.BibtexEntries;
import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Base class turning {@link SourceFetchException}s into failure outcomes and
 * building success outcomes from BibTeX text.
 */
public abstract class AbstractSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractSourceAdapter.class);

    @Override
    public final FetchOutcome fetch(CitationKey key) {
        try {
            FetchOutcome outcome = doFetch(key);
            log.debug("source.fetched provider={} key={} outcome={}", provider(), key.raw(), outcome);
            return outcome;
        } catch (SourceFetchException e) {
            log.debug("source.failed provider={} key={} reason={} message={}",
                    provider(), key.raw(), e.getReason(), e.getMessage());
            return FetchOutcome.failure(e.getReason(), e.getMessage());
        }
    }

    /**
     * Performs the provider-specific fetch.
     */
    protected abstract FetchOutcome doFetch(CitationKey key) throws SourceFetchException;

    /**
     * Builds a success outcome from the first entry in {@code bibtex}. Missing eprint
     * and DOI fields fall back to the given values.
     *
     * @throws SourceFetchException with {@link FailureReason#MALFORMED} if no keyed entry is present
     */
    protected FetchOutcome successFromBibtex(String bibtex, String fallbackEprint, String fallbackDoi)
            throws SourceFetchException {
        List<String> blocks = BibtexEntries.splitBlocks(bibtex);
        String entry = blocks.stream()
                .filter(block -> !BibtexEntries.isDirective(block))
                .findFirst()
                .orElse(null);
        if (entry == null || !BibtexEntries.isWellFormed(entry)) {
            throw new SourceFetchException(FailureReason.MALFORMED,
                    provider().getDisplayName() + " returned text that is not a BibTeX entry");
        }
        String sourceKey = BibtexEntries.extractKey(entry).orElseThrow();
        Map<String, String> fields = BibtexEntries.extractFields(entry, "eprint", "doi");
        String eprint = fields.getOrDefault("eprint", fallbackEprint);
        String doi = fields.getOrDefault("doi", fallbackDoi);
        return FetchOutcome.success(entry, sourceKey, eprint, doi);
    }
}
