package com.citation.resolution.source;

import com.citation.resolution.classify.KeyClassifier;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.FetchOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AdsSourceAdapter Tests")
class AdsSourceAdapterTest {

    private static final String EXPORT = """
            {"msg": "Retrieved 1 abstracts", "export": "@ARTICLE{2016PhRvL.116f1102A,\\n  title = {Observation},\\n  eprint = {1602.03837},\\n  doi = {10.1103/PhysRevLett.116.061102}\\n}\\n"}
            """;
    private static final String SEARCH = """
            {"responseHeader": {"status": 0}, "response": {"numFound": 1, "docs": [{"bibcode": "2016PhRvL.116f1102A"}]}}
            """;
    private static final String EMPTY_SEARCH = "{\"response\": {\"numFound\": 0, \"docs\": []}}";

    private static AdsSourceAdapter adapter(StubHttp stub, String apiKey) {
        return AdsSourceAdapter.builder()
                .http(stub.support())
                .inspireClient(new InspireClient(stub.support(), "http://inspire.test"))
                .baseUrl("http://ads.test")
                .apiKey(apiKey)
                .build();
    }

    @Test
    @DisplayName("Without an API key every fetch is AUTH_REQUIRED and nothing is sent")
    void noApiKey() {
        StubHttp stub = new StubHttp();

        FetchOutcome outcome = adapter(stub, null).fetch(KeyClassifier.toCitationKey("2016PhRvL.116f1102A"));

        assertEquals(FailureReason.AUTH_REQUIRED, outcome.failureReason());
        assertTrue(stub.requests().isEmpty());
    }

    @Test
    @DisplayName("Bibcodes are exported directly with the bearer token")
    void bibcode() {
        StubHttp stub = new StubHttp().on("/v1/export/bibtex", 200, EXPORT);

        FetchOutcome outcome = adapter(stub, "secret").fetch(KeyClassifier.toCitationKey("2016PhRvL.116f1102A"));

        assertTrue(outcome.isSuccess());
        assertEquals("2016PhRvL.116f1102A", outcome.sourceKey());
        assertEquals("1602.03837", outcome.eprint());
        assertEquals("Bearer secret", stub.requests().get(0).headers().firstValue("Authorization").orElseThrow());
        assertEquals("POST", stub.requests().get(0).method());
    }

    @Test
    @DisplayName("arXiv keys are searched first, then exported")
    void arxiv() {
        StubHttp stub = new StubHttp()
                .on("/v1/search/query", 200, SEARCH)
                .on("/v1/export/bibtex", 200, EXPORT);

        FetchOutcome outcome = adapter(stub, "secret").fetch(KeyClassifier.toCitationKey("1602.03837"));

        assertTrue(outcome.isSuccess());
        assertEquals("2016PhRvL.116f1102A", outcome.sourceKey());
        assertTrue(stub.requests().get(0).uri().toString().contains("arXiv%3A1602.03837"));
        assertEquals(1, stub.requestsTo("/v1/export/bibtex"));
    }

    @Test
    @DisplayName("An arXiv id ADS does not know is NOT_FOUND")
    void arxivUnknown() {
        StubHttp stub = new StubHttp().on("/v1/search/query", 200, EMPTY_SEARCH);

        FetchOutcome outcome = adapter(stub, "secret").fetch(KeyClassifier.toCitationKey("2508.18080"));

        assertEquals(FailureReason.NOT_FOUND, outcome.failureReason());
        assertEquals(0, stub.requestsTo("/v1/export/bibtex"));
    }

    @Test
    @DisplayName("INSPIRE keys use the bibcode INSPIRE knows")
    void inspireKey() {
        StubHttp stub = new StubHttp()
                .on("inspire.test/api/literature", 200, InspireSourceAdapterTest.METADATA)
                .on("/v1/export/bibtex", 200, EXPORT);

        FetchOutcome outcome = adapter(stub, "secret").fetch(KeyClassifier.toCitationKey("LIGOScientific:2016aoc"));

        assertTrue(outcome.isSuccess());
        assertEquals("2016PhRvL.116f1102A", outcome.sourceKey());
        assertEquals(0, stub.requestsTo("/v1/search/query"));
    }

    @Test
    @DisplayName("An INSPIRE lookup failure falls through to exporting the key itself")
    void inspireLookupFails() {
        StubHttp stub = new StubHttp()
                .failOn("inspire.test", new IOException("down"))
                .on("/v1/export/bibtex", 200, "{\"export\": \"No records found\"}");

        FetchOutcome outcome = adapter(stub, "secret").fetch(KeyClassifier.toCitationKey("LIGOScientific:2016aoc"));

        assertEquals(FailureReason.NOT_FOUND, outcome.failureReason());
        assertEquals(1, stub.requestsTo("/v1/export/bibtex"));
    }

    @Test
    @DisplayName("Rejected tokens are AUTH_REQUIRED")
    void rejectedToken() {
        StubHttp stub = new StubHttp().on("/v1/export/bibtex", 401, "{\"error\": \"Unauthorized\"}");

        assertEquals(FailureReason.AUTH_REQUIRED,
                adapter(stub, "wrong").fetch(KeyClassifier.toCitationKey("2016PhRvL.116f1102A")).failureReason());
    }
}
