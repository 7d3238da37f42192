package com.citation.resolution.core.model;

import java.util.Objects;

/**
 * A raw citation key together with its detected format.
 * Created once per unique raw token and never mutated.
 */
public record CitationKey(String raw, KeyFormat format) {

    public CitationKey {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(format, "format is required");
    }

    @Override
    public String toString() {
        return raw + " [" + format + "]";
    }
}
