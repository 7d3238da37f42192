package com.citation.resolution.core.model;

import java.util.Locale;

/**
 * Source preference policy used by the fallback router.
 */
public enum PreferredSource {
    ADS,
    INSPIRE,
    SEMANTIC_SCHOLAR,
    /**
     * Pick the source that matches the key format.
     */
    AUTO;

    /**
     * Parses a user supplied policy name, case-insensitively.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static PreferredSource parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Preferred source must not be null or blank");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "ads":
                return ADS;
            case "inspire":
                return INSPIRE;
            case "semantic-scholar":
            case "semanticscholar":
            case "semantic_scholar":
            case "s2":
                return SEMANTIC_SCHOLAR;
            case "auto":
                return AUTO;
            default:
                throw new IllegalArgumentException("Unknown preferred source: '" + value + "'");
        }
    }
}
