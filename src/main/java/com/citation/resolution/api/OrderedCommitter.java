package com.citation.resolution.api;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.logging.LogContext;
import com.citation.resolution.merge.EntryMerger;
import com.citation.resolution.merge.MergeDecision;
import com.citation.resolution.resolve.KeyResolution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges resolutions in input order, whatever order workers finish in.
 *
 * <p>Each completed resolution is buffered at its input index; under the lock the
 * contiguous prefix of completed slots is handed to the {@link EntryMerger}. The merge
 * order, and therefore which key wins a duplicate conflict, depends only on input order.</p>
 */
class OrderedCommitter {
    private static final Logger log = LoggerFactory.getLogger(OrderedCommitter.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final String runId;
    private final List<CitationKey> keys;
    private final EntryMerger merger;
    private final KeyResolution[] pending;
    private final MergeDecision[] decisions;
    private int next;
    private boolean closed;

    OrderedCommitter(String runId, List<CitationKey> keys, EntryMerger merger) {
        this.runId = runId;
        this.keys = List.copyOf(keys);
        this.merger = merger;
        this.pending = new KeyResolution[keys.size()];
        this.decisions = new MergeDecision[keys.size()];
    }

    /**
     * Records a decision made without resolving, e.g. a key skipped before fetching.
     */
    void decide(int index, MergeDecision decision) {
        lock.lock();
        try {
            decisions[index] = decision;
            drain();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buffers a terminal resolution and merges every slot that is now in order.
     */
    void submit(int index, KeyResolution resolution) {
        lock.lock();
        try {
            if (closed) {
                log.warn("commit.late key={} state={}", resolution.key().raw(), resolution.state());
                return;
            }
            pending[index] = resolution;
            drain();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Closes the committer. Buffered resolutions are merged; slots that never completed
     * are reported as {@link FailureReason#TRANSPORT} failures.
     *
     * @return one decision per key, in input order
     */
    List<MergeDecision> finish() {
        lock.lock();
        try {
            closed = true;
            while (next < decisions.length) {
                if (decisions[next] == null && pending[next] == null) {
                    CitationKey key = keys.get(next);
                    log.warn("commit.unfinished key={}", key.raw());
                    decisions[next] = mergeOne(KeyResolution.exhausted(key, FailureReason.TRANSPORT, List.of()));
                    next++;
                } else {
                    drain();
                }
            }
            return new ArrayList<>(Arrays.asList(decisions));
        } finally {
            lock.unlock();
        }
    }

    int committed() {
        lock.lock();
        try {
            return next;
        } finally {
            lock.unlock();
        }
    }

    private void drain() {
        while (next < decisions.length && (decisions[next] != null || pending[next] != null)) {
            if (decisions[next] == null) {
                decisions[next] = mergeOne(pending[next]);
                pending[next] = null;
            }
            next++;
        }
    }

    private MergeDecision mergeOne(KeyResolution resolution) {
        try (LogContext ctx = LogContext.forMerge(runId, resolution.key().raw())) {
            return merger.merge(resolution);
        } catch (RuntimeException e) {
            log.error("commit.merge_failed key={} error={}", resolution.key().raw(), e.toString());
            return MergeDecision.failed(resolution.key(), FailureReason.MALFORMED, resolution.attemptedProviders());
        }
    }
}
