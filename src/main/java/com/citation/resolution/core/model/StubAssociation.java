package com.citation.resolution.core.model;

import java.util.Objects;

/**
 * Links an arXiv identifier used as a citation key to the natural-keyed entry,
 * so the identifier stays resolvable through a {@code crossref} stub.
 */
public record StubAssociation(String stubKey, String targetKey) {

    public StubAssociation {
        Objects.requireNonNull(stubKey, "stubKey is required");
        Objects.requireNonNull(targetKey, "targetKey is required");
    }

    /**
     * Returns the same stub pointing at a different target.
     */
    public StubAssociation retarget(String newTargetKey) {
        return new StubAssociation(stubKey, newTargetKey);
    }
}
