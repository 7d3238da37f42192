package com.citation.resolution.source;

import com.citation.resolution.core.model.FailureReason;

/**
 * Raised inside adapters to abort a fetch with a typed reason.
 * Converted to a {@link com.citation.resolution.core.model.FetchOutcome} at the adapter boundary.
 */
public class SourceFetchException extends Exception {

    private final FailureReason reason;

    public SourceFetchException(FailureReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SourceFetchException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public FailureReason getReason() {
        return reason;
    }
}
