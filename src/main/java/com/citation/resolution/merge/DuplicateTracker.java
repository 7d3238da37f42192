package com.citation.resolution.merge;

import com.citation.resolution.bibtex.BibtexEntries;
import com.citation.resolution.core.model.Fingerprint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Registry of fingerprints already accepted in a run.
 *
 * <p>Each registered entry is indexed by its natural key, eprint and DOI. A candidate
 * matching on any single field is a duplicate of the earliest registered entry it
 * matches, unless that entry was registered for the same input key. Calls are serialized on the tracker's monitor; the engine additionally
 * commits in input order, which makes the verdicts independent of completion order.</p>
 */
public class DuplicateTracker {
    private static final Logger log = LoggerFactory.getLogger(DuplicateTracker.class);

    private final Map<String, Registration> byNaturalKey = new HashMap<>();
    private final Map<String, Registration> byEprint = new HashMap<>();
    private final Map<String, Registration> byDoi = new HashMap<>();
    private final Map<String, Registration> byEntryKey = new HashMap<>();
    private long sequence;

    /**
     * Outcome of {@link #observe}.
     */
    public sealed interface Verdict permits Novel, DuplicateOf {
    }

    public record Novel() implements Verdict {
    }

    /**
     * @param key       output key of the entry registered first
     * @param sourceKey provider key of that entry
     */
    public record DuplicateOf(String key, String sourceKey) implements Verdict {
    }

    private record Registration(long order, String inputKey, String key, String sourceKey) {
    }

    /**
     * Checks a candidate against the registry, registering it when novel.
     *
     * <p>Two input keys that resolve to the same entry key are still two sightings of one
     * paper: the later one is a duplicate even though it would be stored under the same key.</p>
     *
     * @param inputKey    citation key as written in the document
     * @param key         key the candidate would be stored under
     * @param sourceKey   provider key of the candidate
     * @param fingerprint candidate fingerprint
     */
    public synchronized Verdict observe(String inputKey, String key, String sourceKey, Fingerprint fingerprint) {
        Objects.requireNonNull(inputKey, "inputKey is required");
        Objects.requireNonNull(key, "key is required");
        Fingerprint fp = fingerprint != null ? fingerprint : Fingerprint.of(null, null, null);

        Registration match = earliest(
                lookup(byNaturalKey, fp.naturalKey()),
                lookup(byEprint, fp.eprint()),
                lookup(byDoi, fp.doi()));

        if (match != null && !match.inputKey().equals(inputKey)) {
            log.debug("duplicate.detected inputKey={} key={} winner={} winnerSourceKey={}",
                    inputKey, key, match.key(), match.sourceKey());
            return new DuplicateOf(match.key(), match.sourceKey());
        }

        register(inputKey, key, sourceKey, fp);
        return new Novel();
    }

    /**
     * Registers an entry already present in the output, deriving its fingerprint from
     * the entry's key and its {@code eprint}/{@code doi} fields. Crossref stubs are not seeded.
     */
    public synchronized void seed(String key, String entryText) {
        if (BibtexEntries.extractField(entryText, "crossref").isPresent()) {
            return;
        }
        Map<String, String> fields = BibtexEntries.extractFields(entryText, "eprint", "doi");
        String sourceKey = BibtexEntries.extractKey(entryText).orElse(key);
        register(key, key, sourceKey, Fingerprint.of(key, fields.get("eprint"), fields.get("doi")));
    }

    public synchronized void seedAll(OutputEntrySet existing) {
        existing.entries().forEach(this::seed);
        log.debug("duplicate.seeded entries={}", existing.size());
    }

    public synchronized int size() {
        return byEntryKey.size();
    }

    private void register(String inputKey, String key, String sourceKey, Fingerprint fp) {
        Registration registration = byEntryKey.computeIfAbsent(key,
                k -> new Registration(sequence++, inputKey, k, sourceKey != null ? sourceKey : k));
        index(byNaturalKey, fp.naturalKey(), registration);
        index(byEprint, fp.eprint(), registration);
        index(byDoi, fp.doi(), registration);
    }

    private static void index(Map<String, Registration> index, String value, Registration registration) {
        if (value != null) {
            index.putIfAbsent(value, registration);
        }
    }

    private static Registration lookup(Map<String, Registration> index, String value) {
        return value != null ? index.get(value) : null;
    }

    private static Registration earliest(Registration... candidates) {
        Registration best = null;
        for (Registration candidate : candidates) {
            if (candidate != null && (best == null || candidate.order() < best.order())) {
                best = candidate;
            }
        }
        return best;
    }
}
