package com.citation.resolution.rules;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the rule set applied to accepted entries.
 */
public final class DefaultNormalizationRules {

    public static final int LINE_ENDING_PRIORITY = 1;
    public static final int AAS_PRIORITY = 30;

    private DefaultNormalizationRules() {
    }

    /**
     * Rules that always run: line endings unified to {@code \n}.
     */
    public static List<EntryRule> baseRules() {
        return List.of(NormalizationRule.builder()
                .name("line-endings")
                .pattern("\\r\\n?")
                .replacement("\n")
                .priority(LINE_ENDING_PRIORITY)
                .build());
    }

    /**
     * Creates an engine with the base rules plus the optional transforms.
     *
     * @param maxAuthors    author limit, 0 to keep every author
     * @param asciiFolding  fold non-ASCII characters
     * @param aasMacros     AAS macro table to expand, empty to leave macros untouched
     */
    public static NormalizationEngine createEngine(int maxAuthors, boolean asciiFolding, Map<String, String> aasMacros) {
        List<EntryRule> rules = new ArrayList<>(baseRules());
        if (maxAuthors > 0) {
            rules.add(new AuthorTruncationRule(maxAuthors));
        }
        if (asciiFolding) {
            rules.add(new AsciiFoldingRule());
        }
        if (aasMacros != null && !aasMacros.isEmpty()) {
            rules.addAll(AasMacros.toRules(aasMacros, AAS_PRIORITY));
        }
        return new NormalizationEngine(rules);
    }
}
