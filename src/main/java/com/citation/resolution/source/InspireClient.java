package com.citation.resolution.source;

import com.citation.resolution.cache.InspireRecordCache;
import com.citation.resolution.cache.NoOpInspireRecordCache;
import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.metrics.MetricsService;
import com.citation.resolution.metrics.NoOpMetricsService;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Low-level client for the INSPIRE-HEP literature API.
 *
 * <p>Serves two purposes: fetching BibTeX for the INSPIRE adapter, and looking up
 * cross-reference metadata (ADS bibcode, arXiv id, DOI) for the ADS and Semantic
 * Scholar adapters. Metadata lookups go through an {@link InspireRecordCache}.</p>
 */
public class InspireClient {
    private static final Logger log = LoggerFactory.getLogger(InspireClient.class);

    public static final String DEFAULT_BASE_URL = "https://inspirehep.net";
    private static final String METADATA_FIELDS = "texkeys,arxiv_eprints,dois,external_system_identifiers";

    private final HttpSourceSupport http;
    private final String baseUrl;
    private final InspireRecordCache cache;
    private final MetricsService metricsService;

    public InspireClient(HttpSourceSupport http, String baseUrl) {
        this(http, baseUrl, new NoOpInspireRecordCache(), new NoOpMetricsService());
    }

    public InspireClient(HttpSourceSupport http, String baseUrl,
                         InspireRecordCache cache, MetricsService metricsService) {
        this.http = http;
        this.baseUrl = stripTrailingSlash(baseUrl != null ? baseUrl : DEFAULT_BASE_URL);
        this.cache = cache != null ? cache : new NoOpInspireRecordCache();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Builds the INSPIRE search query for a key. The {@code texkeys:} field prefix keeps
     * the colon of a texkey from being read as a field operator.
     */
    public static String queryFor(CitationKey key) {
        switch (key.format()) {
            case ARXIV_NEW:
            case ARXIV_OLD:
                return "arxiv:" + key.raw();
            case ADS_BIBCODE:
                return "external_system_identifiers.value:\"" + key.raw() + "\"";
            case INSPIRE:
            case UNRECOGNIZED:
            default:
                return "texkeys:" + key.raw();
        }
    }

    /**
     * Fetches the BibTeX text INSPIRE has for a key.
     *
     * @throws SourceFetchException {@link FailureReason#NOT_FOUND} when INSPIRE answers with an empty body
     */
    public String fetchBibtex(CitationKey key) throws SourceFetchException {
        String url = baseUrl + "/api/literature?q=" + HttpSourceSupport.encode(queryFor(key)) + "&format=bibtex";
        String body = http.sendForBody(http.request(url)
                .header("Accept", "application/x-bibtex")
                .GET()
                .build(), "INSPIRE BibTeX query");
        if (body.isBlank()) {
            throw new SourceFetchException(FailureReason.NOT_FOUND, "INSPIRE has no record for " + key.raw());
        }
        return body.strip();
    }

    /**
     * Looks up cross-reference metadata for a key. Answers that INSPIRE gave, including
     * "no hit", are cached; transport failures are not.
     */
    public InspireRecord lookup(CitationKey key) throws SourceFetchException {
        String query = queryFor(key);
        Optional<InspireRecord> cached = cache.get(query);
        if (cached.isPresent()) {
            metricsService.recordLookupCacheHit();
            log.debug("inspire.lookup.cached query={}", query);
            return cached.get();
        }
        metricsService.recordLookupCacheMiss();

        String url = baseUrl + "/api/literature?q=" + HttpSourceSupport.encode(query)
                + "&fields=" + METADATA_FIELDS;
        String body = http.sendForBody(http.request(url)
                .header("Accept", "application/json")
                .GET()
                .build(), "INSPIRE metadata query");
        InspireRecord record = parseRecord(http.parseJson(body, "INSPIRE metadata query"));
        cache.put(query, record);
        log.debug("inspire.lookup query={} bibcode={} arxiv={} doi={}",
                query, record.adsBibcode(), record.arxivId(), record.doi());
        return record;
    }

    static InspireRecord parseRecord(JsonNode root) throws SourceFetchException {
        JsonNode hits = root.path("hits").path("hits");
        if (!hits.isArray()) {
            throw new SourceFetchException(FailureReason.MALFORMED, "INSPIRE response has no hits array");
        }
        if (hits.isEmpty()) {
            return InspireRecord.empty();
        }
        JsonNode metadata = hits.get(0).path("metadata");

        List<String> texkeys = new ArrayList<>();
        for (JsonNode texkey : metadata.path("texkeys")) {
            texkeys.add(texkey.asText());
        }

        String bibcode = null;
        for (JsonNode external : metadata.path("external_system_identifiers")) {
            if ("ADS".equalsIgnoreCase(external.path("schema").asText())) {
                bibcode = textOrNull(external.path("value"));
                break;
            }
        }

        String arxivId = textOrNull(metadata.path("arxiv_eprints").path(0).path("value"));
        String doi = textOrNull(metadata.path("dois").path(0).path("value"));
        return new InspireRecord(texkeys, bibcode, arxivId, doi);
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
