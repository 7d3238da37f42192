package com.citation.resolution.source;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.ProviderName;

/**
 * Capability interface for one bibliographic provider.
 *
 * <p>Implementations encapsulate authentication, request construction and response
 * parsing. Failures are returned as {@link FetchOutcome#failure} values and never
 * thrown, so the resolver can advance its fallback chain.</p>
 */
public interface SourceAdapter {

    /**
     * The provider this adapter talks to.
     */
    ProviderName provider();

    /**
     * Fetches the entry for a classified key. Blocks for at most one request
     * timeout per underlying call.
     */
    FetchOutcome fetch(CitationKey key);
}
