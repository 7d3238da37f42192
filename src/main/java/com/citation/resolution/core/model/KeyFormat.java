package com.citation.resolution.core.model;

/**
 * Syntactic format of a raw citation key.
 * Detection is purely pattern based and never touches the network.
 */
public enum KeyFormat {
    /**
     * INSPIRE texkey, e.g. {@code LIGOScientific:2016aoc}.
     */
    INSPIRE,

    /**
     * 19-character NASA ADS bibcode, e.g. {@code 2016PhRvL.116f1102A}.
     */
    ADS_BIBCODE,

    /**
     * New-style arXiv identifier, e.g. {@code 2508.18080}.
     */
    ARXIV_NEW,

    /**
     * Old-style arXiv identifier, e.g. {@code hep-ph/9905318}.
     */
    ARXIV_OLD,

    /**
     * Anything else. Only resolvable remotely by luck or from a local source.
     */
    UNRECOGNIZED;

    /**
     * Returns true for both arXiv identifier styles.
     */
    public boolean isArxiv() {
        return this == ARXIV_NEW || this == ARXIV_OLD;
    }
}
