package com.citation.resolution.source;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.ProviderName;

/**
 * Fetches BibTeX directly from INSPIRE-HEP. No authentication is needed.
 */
public class InspireSourceAdapter extends AbstractSourceAdapter {

    private final InspireClient client;

    public InspireSourceAdapter(InspireClient client) {
        this.client = client;
    }

    @Override
    public ProviderName provider() {
        return ProviderName.INSPIRE;
    }

    @Override
    protected FetchOutcome doFetch(CitationKey key) throws SourceFetchException {
        String bibtex = client.fetchBibtex(key);
        return successFromBibtex(bibtex, key.format().isArxiv() ? key.raw() : null, null);
    }
}
