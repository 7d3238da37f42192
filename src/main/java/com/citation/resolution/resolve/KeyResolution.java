package com.citation.resolution.resolve;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.ProviderName;
import com.citation.resolution.core.model.ResolvedEntry;
import com.citation.resolution.core.model.StubAssociation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Terminal result of a resolver run for one key.
 *
 * @param finalKey key the entry is stored under: the raw key for INSPIRE, bibcode and
 *                 unrecognized keys, the provider's natural key for arXiv keys
 * @param stub     crossref association for arXiv keys whose natural key differs
 */
public record KeyResolution(
        CitationKey key,
        ResolverState state,
        ResolvedEntry entry,
        String finalKey,
        StubAssociation stub,
        FailureReason lastFailure,
        List<FetchAttempt> attempts
) {
    public KeyResolution {
        Objects.requireNonNull(key, "key is required");
        Objects.requireNonNull(state, "state is required");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("KeyResolution requires a terminal state, got " + state);
        }
        attempts = attempts != null ? List.copyOf(attempts) : List.of();
    }

    public static KeyResolution succeeded(CitationKey key, ResolvedEntry entry, String finalKey,
                                          StubAssociation stub, List<FetchAttempt> attempts) {
        Objects.requireNonNull(entry, "entry is required");
        Objects.requireNonNull(finalKey, "finalKey is required");
        return new KeyResolution(key, ResolverState.SUCCEEDED, entry, finalKey, stub, null, attempts);
    }

    public static KeyResolution exhausted(CitationKey key, FailureReason lastFailure, List<FetchAttempt> attempts) {
        return new KeyResolution(key, ResolverState.EXHAUSTED, null, null, null,
                lastFailure != null ? lastFailure : FailureReason.NOT_FOUND, attempts);
    }

    public boolean isSucceeded() {
        return state == ResolverState.SUCCEEDED;
    }

    public Optional<StubAssociation> getStub() {
        return Optional.ofNullable(stub);
    }

    /**
     * Providers tried, in order.
     */
    public List<ProviderName> attemptedProviders() {
        return attempts.stream().map(FetchAttempt::provider).toList();
    }
}
