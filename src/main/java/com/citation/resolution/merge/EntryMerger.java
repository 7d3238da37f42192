package com.citation.resolution.merge;

import com.citation.resolution.bibtex.BibtexEntries;
import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.ResolvedEntry;
import com.citation.resolution.core.model.StubAssociation;
import com.citation.resolution.metrics.MetricsService;
import com.citation.resolution.metrics.NoOpMetricsService;
import com.citation.resolution.resolve.KeyResolution;
import com.citation.resolution.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges terminal resolutions into the output set.
 *
 * <p>For a successful resolution, in order: an entry whose key is already present is
 * skipped (unless refreshing), an entry whose fingerprint was seen earlier in the run is
 * skipped as a duplicate, and anything else is normalized and inserted. arXiv keys also
 * get a crossref stub pointing at whichever entry ends up representing the paper.</p>
 *
 * <p>Not thread-safe: callers must merge one resolution at a time, in input order.</p>
 */
public class EntryMerger {
    private static final Logger log = LoggerFactory.getLogger(EntryMerger.class);

    private final OutputEntrySet output;
    private final DuplicateTracker tracker;
    private final NormalizationEngine normalizationEngine;
    private final boolean fullRefresh;
    private final MetricsService metricsService;

    public EntryMerger(OutputEntrySet output, DuplicateTracker tracker, NormalizationEngine normalizationEngine,
                       boolean fullRefresh, MetricsService metricsService) {
        this.output = output;
        this.tracker = tracker;
        this.normalizationEngine = normalizationEngine != null ? normalizationEngine : new NormalizationEngine();
        this.fullRefresh = fullRefresh;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public EntryMerger(OutputEntrySet output, DuplicateTracker tracker, boolean fullRefresh) {
        this(output, tracker, new NormalizationEngine(), fullRefresh, new NoOpMetricsService());
    }

    public MergeDecision merge(KeyResolution resolution) {
        CitationKey key = resolution.key();
        if (!resolution.isSucceeded()) {
            metricsService.incrementFailed();
            return MergeDecision.failed(key, resolution.lastFailure(), resolution.attemptedProviders());
        }

        ResolvedEntry entry = resolution.entry();
        String finalKey = resolution.finalKey();

        if (!fullRefresh && output.contains(finalKey)) {
            metricsService.incrementExisting();
            log.info("merge.skipped_existing key={} entryKey={}", key.raw(), finalKey);
            StubAssociation stub = writeStub(resolution, finalKey);
            return MergeDecision.existing(key, finalKey, stub);
        }

        DuplicateTracker.Verdict verdict = tracker.observe(key.raw(), finalKey, entry.naturalKey(),
                entry.fingerprint());
        if (verdict instanceof DuplicateTracker.DuplicateOf duplicate) {
            metricsService.incrementDuplicate();
            log.info("merge.skipped_duplicate key={} winner={} winnerSourceKey={}",
                    key.raw(), duplicate.key(), duplicate.sourceKey());
            StubAssociation stub = writeStub(resolution, duplicate.key());
            return MergeDecision.duplicate(key, entry.provider(), duplicate.key(), duplicate.sourceKey(), stub);
        }

        String normalized = normalizationEngine.normalize(entry.rawEntry());
        output.insert(finalKey, normalized);
        metricsService.incrementAccepted(entry.provider());
        log.info("merge.accepted key={} entryKey={} provider={}", key.raw(), finalKey, entry.provider());
        StubAssociation stub = writeStub(resolution, finalKey);
        return MergeDecision.accepted(key, finalKey, normalized, entry.provider(), stub);
    }

    /**
     * Inserts the arXiv crossref stub, pointed at {@code targetKey}.
     *
     * @return the stub written, or {@code null} when there is none or it already exists
     */
    private StubAssociation writeStub(KeyResolution resolution, String targetKey) {
        if (resolution.stub() == null) {
            return null;
        }
        StubAssociation stub = resolution.stub().retarget(targetKey);
        if (stub.stubKey().equals(targetKey)) {
            return null;
        }
        if (!fullRefresh && output.contains(stub.stubKey())) {
            log.debug("merge.stub_exists stubKey={}", stub.stubKey());
            return null;
        }
        output.insert(stub.stubKey(), BibtexEntries.crossrefStub(stub.stubKey(), stub.targetKey()));
        log.debug("merge.stub_written stubKey={} targetKey={}", stub.stubKey(), stub.targetKey());
        return stub;
    }
}
