package com.citation.resolution.resolve;

/**
 * States of the per-key resolver state machine.
 * {@link #SUCCEEDED} and {@link #EXHAUSTED} are terminal.
 */
public enum ResolverState {
    /**
     * Key classified, not yet routed.
     */
    PENDING,

    /**
     * Fallback router invoked; transitions immediately.
     */
    ROUTING,

    /**
     * Waiting on one provider's response.
     */
    ATTEMPTING,

    SUCCEEDED,

    /**
     * Every routed provider failed.
     */
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
