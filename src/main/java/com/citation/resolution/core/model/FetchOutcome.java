package com.citation.resolution.core.model;

import java.util.Objects;

/**
 * Result of one adapter attempt: either a raw entry or a typed failure.
 */
public record FetchOutcome(
        boolean success,
        String rawEntry,
        String sourceKey,
        String eprint,
        String doi,
        FailureReason failureReason,
        String message
) {
    public FetchOutcome {
        if (success) {
            Objects.requireNonNull(rawEntry, "rawEntry is required on success");
            Objects.requireNonNull(sourceKey, "sourceKey is required on success");
        } else {
            Objects.requireNonNull(failureReason, "failureReason is required on failure");
        }
    }

    /**
     * Creates a successful outcome.
     */
    public static FetchOutcome success(String rawEntry, String sourceKey, String eprint, String doi) {
        return new FetchOutcome(true, rawEntry, sourceKey, eprint, doi, null, null);
    }

    /**
     * Creates a failed outcome.
     */
    public static FetchOutcome failure(FailureReason reason, String message) {
        return new FetchOutcome(false, null, null, null, null, reason, message);
    }

    public static FetchOutcome notFound(String message) {
        return failure(FailureReason.NOT_FOUND, message);
    }

    public boolean isSuccess() {
        return success;
    }

    @Override
    public String toString() {
        return success
                ? "FetchOutcome{success, sourceKey=" + sourceKey + ", eprint=" + eprint + ", doi=" + doi + '}'
                : "FetchOutcome{failure, reason=" + failureReason + ", message=" + message + '}';
    }
}
