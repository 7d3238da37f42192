package com.citation.resolution.tracing;

import com.citation.resolution.core.model.CitationKey;

import java.util.Map;

/**
 * Opens spans around resolution runs and per-key resolutions.
 * {@link NoOpTracingService} is used when no tracing backend is configured.
 */
public interface TracingService {

    String RUN_SPAN = "citation.run";
    String RESOLVE_SPAN = "citation.resolve";

    Span startSpan(String operationName, Map<String, String> attributes);

    default Span startRun(String runId) {
        return startSpan(RUN_SPAN, Map.of("runId", runId));
    }

    default Span startResolve(CitationKey key) {
        return startSpan(RESOLVE_SPAN, Map.of(
                "citationKey", key.raw(),
                "keyFormat", key.format().name()));
    }
}
