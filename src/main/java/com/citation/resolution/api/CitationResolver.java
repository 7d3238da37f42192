package com.citation.resolution.api;

import com.citation.resolution.cache.CacheConfig;
import com.citation.resolution.merge.OutputEntrySet;
import com.citation.resolution.metrics.MetricsService;
import com.citation.resolution.metrics.NoOpMetricsService;
import com.citation.resolution.persistence.BibFileStore;
import com.citation.resolution.rules.AasMacros;
import com.citation.resolution.rules.DefaultNormalizationRules;
import com.citation.resolution.rules.NormalizationEngine;
import com.citation.resolution.source.SourceAdapterRegistry;
import com.citation.resolution.tex.CiteKeyExtractor;
import com.citation.resolution.tracing.NoOpTracingService;
import com.citation.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for resolving the citations of LaTeX documents into a {@code .bib} file.
 *
 * <pre>
 * try (CitationResolver resolver = CitationResolver.builder()
 *         .config(ResolutionConfig.builder().fromEnvironment(System.getenv()).build())
 *         .build()) {
 *     CitationResolver.RunResult result = resolver.run(List.of(Path.of("paper.tex")), Path.of("refs.bib"));
 *     System.exit(result.exitStatus());
 * }
 * </pre>
 */
public class CitationResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CitationResolver.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_UNRESOLVED = 1;
    public static final int EXIT_KEY_TYPE_MISMATCH = 2;

    private final ResolutionConfig config;
    private final ResolutionEngine engine;
    private final CiteKeyExtractor extractor;
    private final BibFileStore store;
    private final ReportFormatter formatter;

    /**
     * Result of {@link #run}.
     *
     * @param report   {@code null} when the run was aborted before resolving
     * @param warnings extraction warnings and the abort message, if any
     */
    public record RunResult(ResolutionReport report, List<String> warnings, int exitStatus) {
        public RunResult {
            warnings = warnings != null ? List.copyOf(warnings) : List.of();
        }

        public boolean isAborted() {
            return report == null;
        }
    }

    private CitationResolver(Builder builder) {
        this.config = builder.config;
        this.extractor = new CiteKeyExtractor();
        this.store = builder.store;
        this.formatter = new ReportFormatter();

        Map<String, String> aasMacros = config.isExpandAasMacros()
                ? (builder.aasMacros != null ? builder.aasMacros : AasMacros.builtIn())
                : Map.of();
        NormalizationEngine normalization = DefaultNormalizationRules.createEngine(
                config.getMaxAuthors(), config.isAsciiFolding(), aasMacros);

        Map<String, String> localEntries = builder.localSource != null
                ? store.readEntries(builder.localSource)
                : null;
        SourceAdapterRegistry adapters = builder.adapters != null
                ? builder.adapters
                : SourceAdapterFactory.create(config, builder.cacheConfig, builder.metricsService, localEntries);

        this.engine = new ResolutionEngine(config, adapters, normalization,
                builder.metricsService, builder.tracingService);
    }

    /**
     * Extracts the keys cited in {@code texFiles}, resolves those missing from {@code bibFile}
     * and writes the merged bibliography back. Nothing is written when the run adds nothing.
     *
     * @throws java.io.UncheckedIOException if a file cannot be read or written
     */
    public RunResult run(List<Path> texFiles, Path bibFile) {
        CiteKeyExtractor.ExtractionResult extraction = extractor.extractAll(texFiles);
        extraction.warnings().forEach(w -> log.warn("extraction.warning {}", w));

        OutputEntrySet output = store.read(bibFile);
        ResolutionReport report;
        try {
            report = engine.run(extraction.keys(), output);
        } catch (KeyTypeMismatchException e) {
            log.error("run.aborted reason={}", e.getMessage());
            List<String> warnings = new ArrayList<>(extraction.warnings());
            warnings.add(e.getMessage());
            return new RunResult(null, warnings, EXIT_KEY_TYPE_MISMATCH);
        }

        if (!report.accepted().isEmpty() || !report.stubs().isEmpty()) {
            store.write(bibFile, output);
        }
        formatter.format(report).forEach(line -> log.info("{}", line));
        return new RunResult(report, extraction.warnings(), report.exitStatus());
    }

    /**
     * Resolves keys directly into an entry set, without files.
     */
    public ResolutionReport resolve(List<String> keys, OutputEntrySet output) {
        return engine.run(keys, output);
    }

    public ResolutionConfig getConfig() {
        return config;
    }

    public ReportFormatter getFormatter() {
        return formatter;
    }

    @Override
    public void close() {
        engine.close();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ResolutionConfig config = ResolutionConfig.defaults();
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();
        private SourceAdapterRegistry adapters;
        private BibFileStore store = new BibFileStore();
        private Map<String, String> aasMacros;
        private Path localSource;

        public Builder config(ResolutionConfig config) {
            this.config = config;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Uses these adapters instead of building them from the config.
         */
        public Builder adapters(SourceAdapterRegistry adapters) {
            this.adapters = adapters;
            return this;
        }

        public Builder store(BibFileStore store) {
            this.store = store;
            return this;
        }

        /**
         * Macro table parsed from {@code aasjournals.sty}; the built-in table is used otherwise.
         */
        public Builder aasMacros(String styContent) {
            this.aasMacros = AasMacros.parse(styContent);
            return this;
        }

        /**
         * A {@code .bib} file consulted as the local source.
         */
        public Builder localSource(Path localSource) {
            this.localSource = localSource;
            return this;
        }

        public CitationResolver build() {
            if (config == null) {
                throw new IllegalArgumentException("config is required");
            }
            if (store == null) {
                throw new IllegalArgumentException("store is required");
            }
            return new CitationResolver(this);
        }
    }
}
