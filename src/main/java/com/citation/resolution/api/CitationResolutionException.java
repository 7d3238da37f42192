package com.citation.resolution.api;

/**
 * Base exception for failures that abort a resolution run.
 */
public class CitationResolutionException extends RuntimeException {

    public CitationResolutionException(String message) {
        super(message);
    }

    public CitationResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
