package com.citation.resolution.api;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.KeyFormat;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown before any fetch when keys do not have the enforced format.
 */
public class KeyTypeMismatchException extends CitationResolutionException {

    private final KeyFormat enforced;
    private final List<CitationKey> offendingKeys;

    public KeyTypeMismatchException(KeyFormat enforced, List<CitationKey> offendingKeys) {
        super(buildMessage(enforced, offendingKeys));
        this.enforced = enforced;
        this.offendingKeys = List.copyOf(offendingKeys);
    }

    public KeyFormat getEnforced() {
        return enforced;
    }

    public List<CitationKey> getOffendingKeys() {
        return offendingKeys;
    }

    private static String buildMessage(KeyFormat enforced, List<CitationKey> offendingKeys) {
        return offendingKeys.size() + " key(s) are not of type " + enforced + ": "
                + offendingKeys.stream()
                .map(k -> k.raw() + " (" + k.format() + ")")
                .collect(Collectors.joining(", "));
    }
}
