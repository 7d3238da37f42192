package com.citation.resolution.core.model;

/**
 * Bibliographic sources an entry can be fetched from.
 */
public enum ProviderName {
    INSPIRE("INSPIRE"),
    ADS("ADS"),
    SEMANTIC_SCHOLAR("Semantic Scholar"),
    /**
     * Pseudo-provider backed by a pre-supplied entry collection instead of the network.
     */
    LOCAL_SOURCE("local source");

    private final String displayName;

    ProviderName(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
