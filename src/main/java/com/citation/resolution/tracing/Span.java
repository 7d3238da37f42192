package com.citation.resolution.tracing;

/**
 * A traced unit of work: one resolution run or one key's trip through the fallback chain.
 * Ends when closed, so spans sit in try-with-resources blocks.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records {@code cause} and marks the span as failed.
     */
    default void fail(Throwable cause) {
        recordException(cause);
        setStatus(SpanStatus.ERROR);
    }

    /**
     * Marks the span {@link SpanStatus#OK} when {@code succeeded}, {@link SpanStatus#ERROR} otherwise.
     */
    default void complete(boolean succeeded) {
        setStatus(succeeded ? SpanStatus.OK : SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
