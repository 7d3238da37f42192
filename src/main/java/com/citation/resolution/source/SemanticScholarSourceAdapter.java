package com.citation.resolution.source;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.ProviderName;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;

/**
 * Fetches BibTeX from the Semantic Scholar Graph API ({@code citationStyles.bibtex}).
 *
 * <p>Semantic Scholar is addressed by arXiv id or DOI. Keys of other formats are
 * mapped through INSPIRE metadata first; ADS bibcodes that INSPIRE does not know
 * are {@link FailureReason#NOT_FOUND}. The API key is optional.</p>
 */
public class SemanticScholarSourceAdapter extends AbstractSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(SemanticScholarSourceAdapter.class);

    public static final String DEFAULT_BASE_URL = "https://api.semanticscholar.org";
    private static final String FIELDS = "externalIds,citationStyles";

    private final HttpSourceSupport http;
    private final InspireClient inspireClient;
    private final String baseUrl;
    private final String apiKey;

    private SemanticScholarSourceAdapter(Builder builder) {
        this.http = builder.http;
        this.inspireClient = builder.inspireClient;
        this.baseUrl = InspireClient.stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.apiKey = builder.apiKey;
    }

    @Override
    public ProviderName provider() {
        return ProviderName.SEMANTIC_SCHOLAR;
    }

    @Override
    protected FetchOutcome doFetch(CitationKey key) throws SourceFetchException {
        String paperId = paperIdFor(key);
        String url = baseUrl + "/graph/v1/paper/" + HttpSourceSupport.encode(paperId) + "?fields=" + FIELDS;
        HttpRequest.Builder request = http.request(url).header("Accept", "application/json").GET();
        if (apiKey != null && !apiKey.isBlank()) {
            request.header("x-api-key", apiKey);
        }
        String body = http.sendForBody(request.build(), "Semantic Scholar paper lookup");
        JsonNode paper = http.parseJson(body, "Semantic Scholar paper lookup");

        String bibtex = paper.path("citationStyles").path("bibtex").asText("");
        if (bibtex.isBlank()) {
            throw new SourceFetchException(FailureReason.NOT_FOUND,
                    "Semantic Scholar has no BibTeX for " + paperId);
        }
        JsonNode externalIds = paper.path("externalIds");
        String eprint = textOrNull(externalIds.path("ArXiv"));
        String doi = textOrNull(externalIds.path("DOI"));
        return successFromBibtex(bibtex, eprint, doi);
    }

    String paperIdFor(CitationKey key) throws SourceFetchException {
        if (key.format().isArxiv()) {
            return "arXiv:" + key.raw();
        }
        if (inspireClient == null) {
            throw new SourceFetchException(FailureReason.NOT_FOUND,
                    "Semantic Scholar cannot look up " + key.format() + " keys without INSPIRE metadata");
        }
        InspireRecord record = inspireClient.lookup(key);
        if (record.hasArxivId()) {
            return "arXiv:" + record.arxivId();
        }
        if (record.hasDoi()) {
            return "DOI:" + record.doi();
        }
        log.debug("s2.no_identifier key={}", key.raw());
        throw new SourceFetchException(FailureReason.NOT_FOUND,
                "No arXiv id or DOI known for " + key.raw());
    }

    private static String textOrNull(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private HttpSourceSupport http;
        private InspireClient inspireClient;
        private String baseUrl;
        private String apiKey;

        public Builder http(HttpSourceSupport http) {
            this.http = http;
            return this;
        }

        public Builder inspireClient(InspireClient inspireClient) {
            this.inspireClient = inspireClient;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public SemanticScholarSourceAdapter build() {
            if (http == null) {
                throw new IllegalArgumentException("http is required");
            }
            return new SemanticScholarSourceAdapter(this);
        }
    }
}
