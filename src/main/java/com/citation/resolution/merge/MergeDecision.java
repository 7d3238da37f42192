package com.citation.resolution.merge;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.ProviderName;
import com.citation.resolution.core.model.StubAssociation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The merger's verdict for one key.
 *
 * @param entryKey         key the entry is (or already was) stored under; {@code null} on failure
 * @param entry            normalized entry text for accepted keys
 * @param winningKey       earlier key this one duplicates
 * @param winningSourceKey provider key of the earlier entry
 * @param stub             crossref stub written for this key, if any
 */
public record MergeDecision(
        CitationKey key,
        MergeDisposition disposition,
        String entryKey,
        String entry,
        ProviderName provider,
        String winningKey,
        String winningSourceKey,
        StubAssociation stub,
        FailureReason failureReason,
        List<ProviderName> attempted
) {
    public MergeDecision {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(disposition, "disposition is required");
        attempted = attempted != null ? List.copyOf(attempted) : List.of();
    }

    public static MergeDecision accepted(CitationKey key, String entryKey, String entry,
                                         ProviderName provider, StubAssociation stub) {
        return new MergeDecision(key, MergeDisposition.ACCEPTED, entryKey, entry, provider,
                null, null, stub, null, List.of());
    }

    public static MergeDecision existing(CitationKey key, String entryKey, StubAssociation stub) {
        return new MergeDecision(key, MergeDisposition.SKIPPED_EXISTING, entryKey, null, null,
                null, null, stub, null, List.of());
    }

    public static MergeDecision duplicate(CitationKey key, ProviderName provider, String winningKey,
                                          String winningSourceKey, StubAssociation stub) {
        return new MergeDecision(key, MergeDisposition.SKIPPED_DUPLICATE, null, null, provider,
                winningKey, winningSourceKey, stub, null, List.of());
    }

    public static MergeDecision failed(CitationKey key, FailureReason reason, List<ProviderName> attempted) {
        return new MergeDecision(key, MergeDisposition.FAILED, null, null, null,
                null, null, null, reason, attempted);
    }

    public Optional<StubAssociation> getStub() {
        return Optional.ofNullable(stub);
    }
}
