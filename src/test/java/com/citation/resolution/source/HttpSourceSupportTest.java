package com.citation.resolution.source;

import com.citation.resolution.core.model.FailureReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.http.HttpTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpSourceSupport Tests")
class HttpSourceSupportTest {

    @ParameterizedTest
    @CsvSource({
            "404, NOT_FOUND",
            "429, RATE_LIMITED",
            "401, AUTH_REQUIRED",
            "403, AUTH_REQUIRED",
            "500, TRANSPORT",
            "503, TRANSPORT",
            "302, TRANSPORT"
    })
    @DisplayName("Maps status codes to failure reasons")
    void statusMapping(int status, FailureReason expected) {
        assertEquals(expected, HttpSourceSupport.reasonForStatus(status));
    }

    @Test
    @DisplayName("Failure messages include a summary of the body")
    void messageIncludesBody() {
        SourceFetchException e = assertThrows(SourceFetchException.class,
                () -> HttpSourceSupport.checkStatus(503, "  upstream unavailable \n", "ADS export"));

        assertEquals(FailureReason.TRANSPORT, e.getReason());
        assertEquals("ADS export returned status 503: upstream unavailable", e.getMessage());
    }

    @Test
    @DisplayName("Timeouts are TRANSPORT failures")
    void timeout() {
        StubHttp stub = new StubHttp().failOn("slow", new HttpTimeoutException("timed out"));
        HttpSourceSupport support = stub.support();

        SourceFetchException e = assertThrows(SourceFetchException.class,
                () -> support.sendForBody(support.request("http://slow.test/").GET().build(), "lookup"));

        assertEquals(FailureReason.TRANSPORT, e.getReason());
        assertTrue(e.getMessage().contains("timed out after 5000ms"));
    }

    @Test
    @DisplayName("Requests carry the user agent")
    void userAgent() {
        HttpSourceSupport support = new StubHttp().support();

        assertEquals(HttpSourceSupport.USER_AGENT,
                support.request("http://x.test/").GET().build().headers().firstValue("User-Agent").orElseThrow());
    }

    @Test
    @DisplayName("Empty JSON bodies are MALFORMED")
    void emptyJson() {
        HttpSourceSupport support = new StubHttp().support();

        SourceFetchException e = assertThrows(SourceFetchException.class, () -> support.parseJson("", "lookup"));
        assertEquals(FailureReason.MALFORMED, e.getReason());
    }
}
