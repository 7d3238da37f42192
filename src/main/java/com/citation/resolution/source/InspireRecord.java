package com.citation.resolution.source;

import java.util.List;

/**
 * Cross-reference metadata of one INSPIRE literature record.
 * An empty record means INSPIRE answered but had no matching hit.
 */
public record InspireRecord(List<String> texkeys, String adsBibcode, String arxivId, String doi) {

    private static final InspireRecord EMPTY = new InspireRecord(List.of(), null, null, null);

    public InspireRecord {
        texkeys = texkeys != null ? List.copyOf(texkeys) : List.of();
    }

    public static InspireRecord empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return texkeys.isEmpty() && adsBibcode == null && arxivId == null && doi == null;
    }

    public boolean hasAdsBibcode() {
        return adsBibcode != null && !adsBibcode.isBlank();
    }

    public boolean hasArxivId() {
        return arxivId != null && !arxivId.isBlank();
    }

    public boolean hasDoi() {
        return doi != null && !doi.isBlank();
    }
}
