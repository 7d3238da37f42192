package com.citation.resolution.api;

import com.citation.resolution.core.model.CitationKey;
import com.citation.resolution.core.model.FetchOutcome;
import com.citation.resolution.core.model.ProviderName;
import com.citation.resolution.source.SourceAdapter;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted adapter: answers from a key to outcome map, NOT_FOUND otherwise.
 * Fetches can be made to wait on a latch or to count one down when done.
 * The highest number of fetches running at once is recorded.
 */
final class FakeSourceAdapter implements SourceAdapter {

    private final ProviderName provider;
    private final Map<String, FetchOutcome> outcomes = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> gates = new ConcurrentHashMap<>();
    private final Map<String, CountDownLatch> signals = new ConcurrentHashMap<>();
    private final List<String> fetched = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger peakInFlight = new AtomicInteger();
    private volatile CountDownLatch sharedGate;
    private volatile CountDownLatch started;

    FakeSourceAdapter(ProviderName provider) {
        this.provider = provider;
    }

    static String entry(String key, String eprint, String doi) {
        StringBuilder entry = new StringBuilder("@article{").append(key).append(",\n  title = {Paper ").append(key).append("}");
        if (eprint != null) {
            entry.append(",\n  eprint = {").append(eprint).append("}");
        }
        if (doi != null) {
            entry.append(",\n  doi = {").append(doi).append("}");
        }
        return entry.append("\n}").toString();
    }

    FakeSourceAdapter succeed(String rawKey, String naturalKey, String eprint, String doi) {
        outcomes.put(rawKey, FetchOutcome.success(entry(naturalKey, eprint, doi), naturalKey, eprint, doi));
        return this;
    }

    FakeSourceAdapter waitFor(String rawKey, CountDownLatch gate) {
        gates.put(rawKey, gate);
        return this;
    }

    /**
     * Every fetch counts {@code started} down on entry, then waits on {@code gate}.
     */
    FakeSourceAdapter holdAll(CountDownLatch started, CountDownLatch gate) {
        this.started = started;
        this.sharedGate = gate;
        return this;
    }

    FakeSourceAdapter signalWhenDone(String rawKey, CountDownLatch signal) {
        signals.put(rawKey, signal);
        return this;
    }

    List<String> fetched() {
        return fetched;
    }

    int peakInFlight() {
        return peakInFlight.get();
    }

    @Override
    public ProviderName provider() {
        return provider;
    }

    @Override
    public FetchOutcome fetch(CitationKey key) {
        peakInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
        try {
            fetched.add(key.raw());
            if (started != null) {
                started.countDown();
            }
            await(sharedGate);
            await(gates.get(key.raw()));
            return answer(key);
        } finally {
            inFlight.decrementAndGet();
        }
    }

    private static void await(CountDownLatch gate) {
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private FetchOutcome answer(CitationKey key) {
        FetchOutcome outcome = outcomes.getOrDefault(key.raw(), FetchOutcome.notFound(provider + " has no " + key.raw()));
        CountDownLatch signal = signals.get(key.raw());
        if (signal != null) {
            signal.countDown();
        }
        return outcome;
    }
}
