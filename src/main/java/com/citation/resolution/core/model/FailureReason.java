package com.citation.resolution.core.model;

/**
 * Why a single adapter attempt failed. Every reason advances the fallback chain.
 */
public enum FailureReason {
    NOT_FOUND,
    /**
     * Provider throttled the client. Reported separately from {@link #NOT_FOUND}.
     */
    RATE_LIMITED,
    AUTH_REQUIRED,
    /**
     * Connection problem, timeout or unexpected status.
     */
    TRANSPORT,
    /**
     * Response received but not structurally usable.
     */
    MALFORMED
}
