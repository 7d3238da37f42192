package com.citation.resolution.source;

import com.citation.resolution.core.model.FailureReason;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Shared HTTP plumbing for the remote adapters: request defaults, status mapping
 * and JSON parsing. Every problem surfaces as a {@link SourceFetchException}.
 */
public class HttpSourceSupport {
    private static final Logger log = LoggerFactory.getLogger(HttpSourceSupport.class);

    static final String USER_AGENT = "citation-resolution/1.0";

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpSourceSupport(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Creates support with a fresh client whose connect timeout equals the request timeout.
     */
    public static HttpSourceSupport create(Duration requestTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(requestTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new HttpSourceSupport(client, new ObjectMapper(), requestTimeout);
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * Starts a request with the per-request timeout and user agent applied.
     */
    public HttpRequest.Builder request(String url) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("User-Agent", USER_AGENT);
    }

    /**
     * Sends a request and returns the body of a 200 response.
     *
     * @param what short description used in failure messages
     */
    public String sendForBody(HttpRequest request, String what) throws SourceFetchException {
        HttpResponse<String> response = send(request, what);
        checkStatus(response.statusCode(), response.body(), what);
        return response.body() != null ? response.body() : "";
    }

    HttpResponse<String> send(HttpRequest request, String what) throws SourceFetchException {
        log.debug("http.request method={} uri={}", request.method(), request.uri());
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new SourceFetchException(FailureReason.TRANSPORT,
                    what + " timed out after " + requestTimeout.toMillis() + "ms", e);
        } catch (IOException e) {
            throw new SourceFetchException(FailureReason.TRANSPORT,
                    what + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceFetchException(FailureReason.TRANSPORT, what + " interrupted", e);
        }
    }

    /**
     * Maps a non-200 status to its failure reason.
     */
    static void checkStatus(int status, String body, String what) throws SourceFetchException {
        if (status == 200) {
            return;
        }
        FailureReason reason = reasonForStatus(status);
        throw new SourceFetchException(reason, what + " returned status " + status + summarize(body));
    }

    static FailureReason reasonForStatus(int status) {
        switch (status) {
            case 404:
                return FailureReason.NOT_FOUND;
            case 429:
                return FailureReason.RATE_LIMITED;
            case 401:
            case 403:
                return FailureReason.AUTH_REQUIRED;
            default:
                return FailureReason.TRANSPORT;
        }
    }

    /**
     * Parses a JSON body, mapping syntax errors to {@link FailureReason#MALFORMED}.
     */
    public JsonNode parseJson(String body, String what) throws SourceFetchException {
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new SourceFetchException(FailureReason.MALFORMED, what + " returned an empty body");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(FailureReason.MALFORMED,
                    what + " returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String toJson(Object value) throws SourceFetchException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(FailureReason.MALFORMED, "Could not encode request body", e);
        }
    }

    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String summarize(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        String trimmed = body.strip();
        return ": " + (trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed);
    }
}
