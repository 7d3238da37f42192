package com.citation.resolution.api;

import com.citation.resolution.classify.KeyClassifier;
import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.KeyFormat;
import com.citation.resolution.logging.LogContext;
import com.citation.resolution.merge.DuplicateTracker;
import com.citation.resolution.merge.EntryMerger;
import com.citation.resolution.merge.MergeDecision;
import com.citation.resolution.merge.OutputEntrySet;
import com.citation.resolution.metrics.MetricsService;
import com.citation.resolution.metrics.NoOpMetricsService;
import com.citation.resolution.resolve.KeyResolution;
import com.citation.resolution.resolve.Resolver;
import com.citation.resolution.rules.NormalizationEngine;
import com.citation.resolution.source.LocalSourceAdapter;
import com.citation.resolution.source.SourceAdapterRegistry;
import com.citation.resolution.tracing.NoOpTracingService;
import com.citation.resolution.tracing.Span;
import com.citation.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves a list of citation keys into an output entry set.
 *
 * <p>A run deduplicates and classifies the keys, checks the enforced key type (aborting
 * before any fetch on a mismatch), skips keys already present, and resolves the rest on a
 * fixed pool of {@code maxConcurrency} workers. Results are merged in input order, so the
 * output and the report do not depend on which provider answers first.</p>
 */
public class ResolutionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ResolutionEngine.class);

    private final ResolutionConfig config;
    private final SourceAdapterRegistry adapters;
    private final NormalizationEngine normalizationEngine;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService executor;
    private volatile boolean closed;

    public ResolutionEngine(ResolutionConfig config, SourceAdapterRegistry adapters) {
        this(config, adapters, new NormalizationEngine(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public ResolutionEngine(ResolutionConfig config, SourceAdapterRegistry adapters,
                            NormalizationEngine normalizationEngine,
                            MetricsService metricsService, TracingService tracingService) {
        this.config = config != null ? config : ResolutionConfig.defaults();
        this.adapters = adapters;
        this.normalizationEngine = normalizationEngine != null ? normalizationEngine : new NormalizationEngine();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
        this.executor = Executors.newFixedThreadPool(this.config.getMaxConcurrency(), new WorkerThreadFactory());
    }

    /**
     * Resolves the keys and merges the results into {@code output}.
     *
     * @param rawKeys keys in first-citation order; blanks and repeats are dropped
     * @param output  entries already present; receives the new entries and stubs
     * @throws KeyTypeMismatchException if a key does not have the enforced format
     */
    public ResolutionReport run(List<String> rawKeys, OutputEntrySet output) {
        if (closed) {
            throw new IllegalStateException("ResolutionEngine is closed");
        }
        String runId = LogContext.generateRunId();
        List<CitationKey> keys = classify(rawKeys);

        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracingService.startRun(runId)) {
            span.setAttribute("keys", keys.size());
            metricsService.recordRunSize(keys.size());

            try {
                enforceKeyType(keys);
            } catch (KeyTypeMismatchException e) {
                span.fail(e);
                log.error("run.aborted runId={} reason=key_type_mismatch offending={}",
                        runId, e.getOffendingKeys().size());
                throw e;
            }

            log.info("run.started runId={} keys={} existing={} concurrency={}",
                    runId, keys.size(), output.size(), config.getMaxConcurrency());
            if (keys.isEmpty()) {
                span.complete(true);
                return ResolutionReport.empty(runId);
            }

            DuplicateTracker tracker = new DuplicateTracker();
            if (!config.isFullRefresh() && config.isSeedFingerprintsFromExisting()) {
                tracker.seedAll(output);
            }
            EntryMerger merger = new EntryMerger(output, tracker, normalizationEngine,
                    config.isFullRefresh(), metricsService);
            OrderedCommitter committer = new OrderedCommitter(runId, keys, merger);

            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < keys.size(); i++) {
                CitationKey key = keys.get(i);
                if (!config.isFullRefresh() && output.contains(key.raw())) {
                    metricsService.incrementExisting();
                    log.info("run.skipped_existing key={}", key.raw());
                    committer.decide(i, MergeDecision.existing(key, key.raw(), null));
                    continue;
                }
                int index = i;
                futures.add(CompletableFuture.runAsync(
                        () -> committer.submit(index, resolveKey(runId, key)), executor));
            }

            awaitCompletion(runId, futures);
            List<MergeDecision> decisions = committer.finish();
            ResolutionReport report = ResolutionReport.from(runId, decisions);

            span.setAttribute("accepted", report.accepted().size());
            span.setAttribute("failed", report.failedKeys().size());
            span.complete(report.isSuccess());
            log.info("run.completed runId={} report={}", runId, report);
            return report;
        }
    }

    /**
     * Classifies the keys, dropping blanks and keeping the first occurrence of repeats.
     */
    List<CitationKey> classify(List<String> rawKeys) {
        Set<String> unique = new LinkedHashSet<>();
        if (rawKeys != null) {
            for (String raw : rawKeys) {
                if (raw != null && !raw.isBlank()) {
                    unique.add(raw.trim());
                }
            }
        }
        return unique.stream().map(KeyClassifier::toCitationKey).toList();
    }

    private void enforceKeyType(List<CitationKey> keys) {
        Optional<KeyFormat> enforced = config.getEnforcedKeyType();
        if (enforced.isEmpty()) {
            return;
        }
        Optional<LocalSourceAdapter> local = adapters.localSource();
        List<CitationKey> offending = keys.stream()
                .filter(key -> key.format() != enforced.get())
                .filter(key -> local.map(l -> !l.contains(key.raw())).orElse(true))
                .toList();
        if (!offending.isEmpty()) {
            throw new KeyTypeMismatchException(enforced.get(), offending);
        }
    }

    private KeyResolution resolveKey(String runId, CitationKey key) {
        try (LogContext ctx = LogContext.forKey(runId, key.raw(), key.format().name())) {
            Resolver resolver = new Resolver(adapters, config.getPreferredSource(), config.isPreferRemote(),
                    metricsService, tracingService);
            return resolver.resolve(key);
        } catch (RuntimeException e) {
            log.error("resolution.failed key={} error={}", key.raw(), e.toString());
            return KeyResolution.exhausted(key, FailureReason.TRANSPORT, List.of());
        }
    }

    private void awaitCompletion(String runId, List<CompletableFuture<Void>> futures) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(config.getRunTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("run.timeout runId={} timeout={}", runId, config.getRunTimeout());
            futures.forEach(f -> f.cancel(true));
        } catch (InterruptedException e) {
            log.warn("run.interrupted runId={}", runId);
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.error("run.worker_failed runId={} error={}", runId, e.getCause() != null ? e.getCause().toString() : e.toString());
        }
    }

    public ResolutionConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_COUNTER = new AtomicInteger();
        private final int pool = POOL_COUNTER.incrementAndGet();
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "citation-resolver-" + pool + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
