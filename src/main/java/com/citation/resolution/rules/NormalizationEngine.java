package com.citation.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Applies entry rules to accepted BibTeX entries.
 * Rules are applied in priority order (lower priority number = earlier).
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<EntryRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<? extends EntryRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    public synchronized void addRule(EntryRule rule) {
        rules.add(rule);
        sortRules();
    }

    public synchronized boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    public synchronized List<EntryRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Runs every rule over the entry text. A {@code null} entry yields {@code null}.
     */
    public String normalize(String entry) {
        if (entry == null) {
            return null;
        }
        String result = entry;
        for (EntryRule rule : getRules()) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("normalization.applied rule={}", rule.getName());
            }
        }
        return result;
    }

    private void sortRules() {
        rules.sort(Comparator.comparingInt(EntryRule::getPriority));
    }
}
