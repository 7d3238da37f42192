package com.citation.resolution.source;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.ProviderName;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpRequest;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches BibTeX from the NASA Astrophysics Data System.
 *
 * <p>ADS only exports by bibcode, so the bibcode is found first:</p>
 * <ul>
 *   <li>bibcode keys are exported directly;</li>
 *   <li>arXiv keys are searched on ADS as {@code arXiv:<id>};</li>
 *   <li>INSPIRE and unrecognized keys use the ADS bibcode INSPIRE knows, then the
 *       arXiv id INSPIRE knows, then the key itself as a bibcode.</li>
 * </ul>
 * Requires an API token; without one every fetch is {@link FailureReason#AUTH_REQUIRED}.
 */
public class AdsSourceAdapter extends AbstractSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(AdsSourceAdapter.class);

    public static final String DEFAULT_BASE_URL = "https://api.adsabs.harvard.edu";

    private final HttpSourceSupport http;
    private final InspireClient inspireClient;
    private final String baseUrl;
    private final String apiKey;

    private AdsSourceAdapter(Builder builder) {
        this.http = builder.http;
        this.inspireClient = builder.inspireClient;
        this.baseUrl = InspireClient.stripTrailingSlash(builder.baseUrl != null ? builder.baseUrl : DEFAULT_BASE_URL);
        this.apiKey = builder.apiKey;
    }

    @Override
    public ProviderName provider() {
        return ProviderName.ADS;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    protected FetchOutcome doFetch(CitationKey key) throws SourceFetchException {
        if (!hasApiKey()) {
            throw new SourceFetchException(FailureReason.AUTH_REQUIRED,
                    "ADS API key not set (use ADS_API_KEY or configure adsApiKey)");
        }
        switch (key.format()) {
            case ADS_BIBCODE:
                return export(key.raw(), null);
            case ARXIV_NEW:
            case ARXIV_OLD:
                return exportByArxiv(key.raw());
            case INSPIRE:
            case UNRECOGNIZED:
            default:
                return fetchViaInspire(key);
        }
    }

    private FetchOutcome fetchViaInspire(CitationKey key) throws SourceFetchException {
        InspireRecord record = lookupQuietly(key);
        if (record.hasAdsBibcode()) {
            Optional<FetchOutcome> outcome = tryExport(record.adsBibcode(), record.arxivId());
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
        if (record.hasArxivId()) {
            Optional<String> bibcode = searchByArxiv(record.arxivId());
            if (bibcode.isPresent()) {
                Optional<FetchOutcome> outcome = tryExport(bibcode.get(), record.arxivId());
                if (outcome.isPresent()) {
                    return outcome.get();
                }
            }
        }
        // Last resort: the key itself may be a bibcode the classifier did not recognize
        return export(key.raw(), record.arxivId());
    }

    private FetchOutcome exportByArxiv(String arxivId) throws SourceFetchException {
        String bibcode = searchByArxiv(arxivId)
                .orElseThrow(() -> new SourceFetchException(FailureReason.NOT_FOUND,
                        "ADS has no record for arXiv:" + arxivId));
        return export(bibcode, arxivId);
    }

    private InspireRecord lookupQuietly(CitationKey key) {
        if (inspireClient == null) {
            return InspireRecord.empty();
        }
        try {
            return inspireClient.lookup(key);
        } catch (SourceFetchException e) {
            log.debug("ads.inspire_lookup_failed key={} reason={} message={}",
                    key.raw(), e.getReason(), e.getMessage());
            return InspireRecord.empty();
        }
    }

    private Optional<FetchOutcome> tryExport(String bibcode, String arxivId) throws SourceFetchException {
        try {
            return Optional.of(export(bibcode, arxivId));
        } catch (SourceFetchException e) {
            if (e.getReason() != FailureReason.NOT_FOUND) {
                throw e;
            }
            log.debug("ads.export_missing bibcode={}", bibcode);
            return Optional.empty();
        }
    }

    Optional<String> searchByArxiv(String arxivId) throws SourceFetchException {
        String url = baseUrl + "/v1/search/query?q=" + HttpSourceSupport.encode("arXiv:" + arxivId) + "&fl=bibcode";
        String body = http.sendForBody(authorized(url).GET().build(), "ADS search");
        JsonNode docs = http.parseJson(body, "ADS search").path("response").path("docs");
        if (!docs.isArray() || docs.isEmpty()) {
            return Optional.empty();
        }
        String bibcode = docs.get(0).path("bibcode").asText("");
        return bibcode.isBlank() ? Optional.empty() : Optional.of(bibcode);
    }

    FetchOutcome export(String bibcode, String arxivId) throws SourceFetchException {
        String requestBody = http.toJson(Map.of("bibcode", List.of(bibcode)));
        String body = http.sendForBody(authorized(baseUrl + "/v1/export/bibtex")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build(), "ADS export");
        String export = http.parseJson(body, "ADS export").path("export").asText("").strip();
        if (export.isEmpty() || export.startsWith("No records")) {
            throw new SourceFetchException(FailureReason.NOT_FOUND, "ADS has no record for " + bibcode);
        }
        return successFromBibtex(export, arxivId, null);
    }

    private HttpRequest.Builder authorized(String url) {
        return http.request(url).header("Authorization", "Bearer " + apiKey);
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

        public AdsSourceAdapter build() {
            if (http == null) {
                throw new IllegalArgumentException("http is required");
            }
            return new AdsSourceAdapter(this);
        }
    }
}
