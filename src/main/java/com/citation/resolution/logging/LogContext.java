package com.citation.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forKey(runId, "LIGOScientific:2016aoc", "INSPIRE")) {
 *     log.info("resolution.succeeded key={} provider={}", key, provider);
 * } // MDC entries are restored
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole resolution run.
     */
    public static LogContext forRun(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("operation", "run");
        return ctx;
    }

    /**
     * Creates a log context for resolving a single key.
     */
    public static LogContext forKey(String runId, String citationKey, String keyFormat) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("citationKey", citationKey);
        ctx.put("keyFormat", keyFormat);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Creates a log context for merging a resolved key into the output set.
     */
    public static LogContext forMerge(String runId, String citationKey) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("citationKey", citationKey);
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    /**
     * Restores the MDC values that were present before this context was opened.
     */
    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
