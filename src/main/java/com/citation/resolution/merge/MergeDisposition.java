package com.citation.resolution.merge;

/**
 * What the merger did with a key's resolution.
 */
public enum MergeDisposition {
    ACCEPTED,
    SKIPPED_EXISTING,
    SKIPPED_DUPLICATE,
    FAILED
}
