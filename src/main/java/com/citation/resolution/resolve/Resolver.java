package com.citation.resolution.resolve;

import com.citation.resolution.bibtex.BibtexEntries;
import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FailureReason;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.PreferredSource;
import com.citation.resolution.core.model.ProviderName;
import com.citation.resolution.core.model.ResolvedEntry;
import com.citation.resolution.core.model.StubAssociation;
import com.citation.resolution.metrics.MetricsService;
import com.citation.resolution.metrics.NoOpMetricsService;
import com.citation.resolution.routing.FallbackRouter;
import com.citation.resolution.source.SourceAdapter;
import com.citation.resolution.source.SourceAdapterRegistry;
import com.citation.resolution.tracing.NoOpTracingService;
import com.citation.resolution.tracing.Span;
import com.citation.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Drives one key through its fallback chain.
 *
 * <p>State machine: {@code PENDING -> ROUTING -> ATTEMPTING(p) -> SUCCEEDED | ATTEMPTING(next) | EXHAUSTED}.
 * Providers are tried strictly one after another and each at most once; any failure,
 * including an adapter throwing, advances the chain. The resolver holds no state
 * between calls and may be shared by workers.</p>
 */
public class Resolver {
    private static final Logger log = LoggerFactory.getLogger(Resolver.class);

    private final SourceAdapterRegistry adapters;
    private final PreferredSource preferredSource;
    private final boolean preferRemote;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public Resolver(SourceAdapterRegistry adapters, PreferredSource preferredSource, boolean preferRemote) {
        this(adapters, preferredSource, preferRemote, new NoOpMetricsService(), new NoOpTracingService());
    }

    public Resolver(SourceAdapterRegistry adapters, PreferredSource preferredSource, boolean preferRemote,
                    MetricsService metricsService, TracingService tracingService) {
        this.adapters = adapters;
        this.preferredSource = preferredSource;
        this.preferRemote = preferRemote;
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    /**
     * Computes the provider chain for a key, dropping providers with no registered adapter.
     */
    public List<ProviderName> route(CitationKey key) {
        boolean localHit = adapters.localSource().map(local -> local.contains(key.raw())).orElse(false);
        List<ProviderName> routed = FallbackRouter.route(preferredSource, key.format(), localHit, preferRemote);
        return routed.stream().filter(adapters::contains).toList();
    }

    /**
     * Resolves a key to a terminal {@link KeyResolution}.
     */
    public KeyResolution resolve(CitationKey key) {
        ResolverState state = ResolverState.PENDING;
        log.debug("resolver.state key={} state={}", key.raw(), state);

        try (Span span = tracingService.startResolve(key)) {

            state = ResolverState.ROUTING;
            List<ProviderName> chain = route(key);
            log.debug("resolver.state key={} state={} chain={}", key.raw(), state, chain);

            List<FetchAttempt> attempts = new ArrayList<>(chain.size());
            FailureReason lastFailure = FailureReason.NOT_FOUND;

            for (ProviderName provider : chain) {
                state = ResolverState.ATTEMPTING;
                log.debug("resolver.state key={} state={} provider={}", key.raw(), state, provider);

                SourceAdapter adapter = adapters.get(provider).orElseThrow();
                long start = System.nanoTime();
                FetchOutcome outcome = invoke(adapter, key);
                Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

                String outcomeTag = outcome.isSuccess() ? "SUCCESS" : outcome.failureReason().name();
                metricsService.recordFetch(provider, outcomeTag, elapsed);

                if (outcome.isSuccess()) {
                    attempts.add(new FetchAttempt(provider, null, null, elapsed));
                    KeyResolution resolution = succeed(key, provider, outcome, attempts);
                    span.setAttribute("provider", provider.name());
                    span.setAttribute("state", ResolverState.SUCCEEDED.name());
                    span.complete(true);
                    log.info("resolution.succeeded key={} provider={} sourceKey={} attempts={}",
                            key.raw(), provider, outcome.sourceKey(), attempts.size());
                    return resolution;
                }

                attempts.add(new FetchAttempt(provider, outcome.failureReason(), outcome.message(), elapsed));
                lastFailure = outcome.failureReason();
                log.debug("resolution.attempt_failed key={} provider={} reason={} message={}",
                        key.raw(), provider, outcome.failureReason(), outcome.message());
            }

            span.setAttribute("state", ResolverState.EXHAUSTED.name());
            span.setAttribute("attempts", attempts.size());
            span.complete(false);
            log.warn("resolution.exhausted key={} lastFailure={} tried={}",
                    key.raw(), lastFailure, chain);
            return KeyResolution.exhausted(key, lastFailure, attempts);
        }
    }

    private FetchOutcome invoke(SourceAdapter adapter, CitationKey key) {
        try {
            FetchOutcome outcome = adapter.fetch(key);
            if (outcome == null) {
                return FetchOutcome.failure(FailureReason.MALFORMED, adapter.provider() + " returned no outcome");
            }
            return outcome;
        } catch (RuntimeException e) {
            log.warn("resolution.adapter_error key={} provider={} error={}",
                    key.raw(), adapter.provider(), e.toString());
            return FetchOutcome.failure(FailureReason.TRANSPORT,
                    adapter.provider() + " failed unexpectedly: " + e.getMessage());
        }
    }

    private KeyResolution succeed(CitationKey key, ProviderName provider, FetchOutcome outcome,
                                  List<FetchAttempt> attempts) {
        ResolvedEntry entry = ResolvedEntry.from(key, provider, outcome);
        if (key.format().isArxiv()) {
            // Entry keeps the provider's key; the arXiv id becomes a crossref stub
            String naturalKey = entry.naturalKey();
            StubAssociation stub = naturalKey.equals(key.raw()) ? null : new StubAssociation(key.raw(), naturalKey);
            return KeyResolution.succeeded(key, entry, naturalKey, stub, attempts);
        }
        // The key from the LaTeX source wins over the provider's key
        String rewritten = BibtexEntries.replaceKey(entry.rawEntry(), key.raw());
        ResolvedEntry rekeyed = new ResolvedEntry(key, provider, rewritten, entry.naturalKey(),
                entry.eprint(), entry.doi());
        return KeyResolution.succeeded(key, rekeyed, key.raw(), null, attempts);
    }
}
