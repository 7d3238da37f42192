package com.citation.resolution.core.model;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identity signature of a paper. Two entries denote the same paper when their
 * fingerprints agree on any single present field.
 *
 * <p>Values are stored normalized: trimmed, DOI lower-cased without resolver prefix,
 * eprint without {@code arXiv:} prefix or version suffix.</p>
 */
public record Fingerprint(String naturalKey, String eprint, String doi) {

    private static final Pattern DOI_PREFIX = Pattern.compile("(?i)^(https?://(dx\\.)?doi\\.org/|doi:)");
    private static final Pattern ARXIV_PREFIX = Pattern.compile("(?i)^arxiv:");
    private static final Pattern VERSION_SUFFIX = Pattern.compile("v\\d+$");

    /**
     * Creates a fingerprint, normalizing each field and dropping blank ones.
     */
    public static Fingerprint of(String naturalKey, String eprint, String doi) {
        return new Fingerprint(normalizeKey(naturalKey), normalizeEprint(eprint), normalizeDoi(doi));
    }

    public boolean isEmpty() {
        return naturalKey == null && eprint == null && doi == null;
    }

    /**
     * Returns true if any present field equals the same field of {@code other}.
     */
    public boolean intersects(Fingerprint other) {
        if (other == null) {
            return false;
        }
        return matches(naturalKey, other.naturalKey)
                || matches(eprint, other.eprint)
                || matches(doi, other.doi);
    }

    private static boolean matches(String a, String b) {
        return a != null && a.equals(b);
    }

    static String normalizeKey(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    static String normalizeEprint(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String stripped = ARXIV_PREFIX.matcher(value.trim()).replaceFirst("");
        return VERSION_SUFFIX.matcher(stripped).replaceFirst("");
    }

    static String normalizeDoi(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return DOI_PREFIX.matcher(value.trim()).replaceFirst("").toLowerCase(Locale.ROOT);
    }
}
