package com.citation.resolution.rules;

/**
 * A text transform applied to an accepted BibTeX entry before it is written.
 * Rules run in ascending priority order.
 */
public interface EntryRule {

    String getName();

    int getPriority();

    String apply(String entry);
}
