package com.citation.resolution.resolve;

import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.ProviderName;

import java.time.Duration;

/**
 * One provider attempt in a key's trail.
 *
 * @param failureReason {@code null} when the attempt succeeded
 */
public record FetchAttempt(ProviderName provider, FailureReason failureReason, String message, Duration duration) {

    public boolean succeeded() {
        return failureReason == null;
    }
}
