package com.citation.resolution.api;

import com.citation.resolution.core.model.KeyFormat;
import com.citation.resolution.core.model.PreferredSource;
import com.citation.resolution.source.AdsSourceAdapter;
import com.citation.resolution.source.InspireClient;
import com.citation.resolution.source.SemanticScholarSourceAdapter;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Options for a citation resolution run.
 * Configures provider preference, concurrency, timeouts, entry transforms and credentials.
 */
public class ResolutionConfig {

    public static final String ADS_API_KEY_ENV = "ADS_API_KEY";
    public static final String SEMANTIC_SCHOLAR_API_KEY_ENV = "SEMANTIC_SCHOLAR_API_KEY";

    private static final int DEFAULT_MAX_CONCURRENCY = 4;
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofMinutes(10);

    private final PreferredSource preferredSource;
    private final int maxConcurrency;
    private final Duration requestTimeout;
    private final Duration runTimeout;
    private final boolean fullRefresh;
    private final boolean preferRemote;
    private final KeyFormat enforcedKeyType;
    private final int maxAuthors;
    private final boolean asciiFolding;
    private final boolean expandAasMacros;
    private final String adsApiKey;
    private final String semanticScholarApiKey;
    private final String inspireBaseUrl;
    private final String adsBaseUrl;
    private final String semanticScholarBaseUrl;
    private final boolean seedFingerprintsFromExisting;

    private ResolutionConfig(Builder builder) {
        this.preferredSource = builder.preferredSource;
        this.maxConcurrency = builder.maxConcurrency;
        this.requestTimeout = builder.requestTimeout;
        this.runTimeout = builder.runTimeout;
        this.fullRefresh = builder.fullRefresh;
        this.preferRemote = builder.preferRemote;
        this.enforcedKeyType = builder.enforcedKeyType;
        this.maxAuthors = builder.maxAuthors;
        this.asciiFolding = builder.asciiFolding;
        this.expandAasMacros = builder.expandAasMacros;
        this.adsApiKey = builder.adsApiKey;
        this.semanticScholarApiKey = builder.semanticScholarApiKey;
        this.inspireBaseUrl = builder.inspireBaseUrl;
        this.adsBaseUrl = builder.adsBaseUrl;
        this.semanticScholarBaseUrl = builder.semanticScholarBaseUrl;
        this.seedFingerprintsFromExisting = builder.seedFingerprintsFromExisting;
    }

    public PreferredSource getPreferredSource() {
        return preferredSource;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    /**
     * When true, keys already present in the output are fetched again and replaced.
     */
    public boolean isFullRefresh() {
        return fullRefresh;
    }

    /**
     * When true, remote providers are consulted before the local source.
     */
    public boolean isPreferRemote() {
        return preferRemote;
    }

    /**
     * Key format every key must have, if one is enforced.
     */
    public Optional<KeyFormat> getEnforcedKeyType() {
        return Optional.ofNullable(enforcedKeyType);
    }

    public int getMaxAuthors() {
        return maxAuthors;
    }

    public boolean isAsciiFolding() {
        return asciiFolding;
    }

    public boolean isExpandAasMacros() {
        return expandAasMacros;
    }

    public Optional<String> getAdsApiKey() {
        return Optional.ofNullable(adsApiKey);
    }

    public Optional<String> getSemanticScholarApiKey() {
        return Optional.ofNullable(semanticScholarApiKey);
    }

    public String getInspireBaseUrl() {
        return inspireBaseUrl;
    }

    public String getAdsBaseUrl() {
        return adsBaseUrl;
    }

    public String getSemanticScholarBaseUrl() {
        return semanticScholarBaseUrl;
    }

    /**
     * Whether entries already in the output take part in duplicate detection.
     * Ignored in full-refresh mode.
     */
    public boolean isSeedFingerprintsFromExisting() {
        return seedFingerprintsFromExisting;
    }

    /**
     * Creates default options.
     */
    public static ResolutionConfig defaults() {
        return builder().build();
    }

    /**
     * Creates options that refetch every key, replacing existing entries.
     */
    public static ResolutionConfig refresh() {
        return builder().fullRefresh(true).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private PreferredSource preferredSource = PreferredSource.AUTO;
        private int maxConcurrency = DEFAULT_MAX_CONCURRENCY;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private Duration runTimeout = DEFAULT_RUN_TIMEOUT;
        private boolean fullRefresh = false;
        private boolean preferRemote = false;
        private KeyFormat enforcedKeyType;
        private int maxAuthors = 0;
        private boolean asciiFolding = false;
        private boolean expandAasMacros = false;
        private String adsApiKey;
        private String semanticScholarApiKey;
        private String inspireBaseUrl = InspireClient.DEFAULT_BASE_URL;
        private String adsBaseUrl = AdsSourceAdapter.DEFAULT_BASE_URL;
        private String semanticScholarBaseUrl = SemanticScholarSourceAdapter.DEFAULT_BASE_URL;
        private boolean seedFingerprintsFromExisting = true;

        public Builder preferredSource(PreferredSource preferredSource) {
            if (preferredSource == null) {
                throw new IllegalArgumentException("preferredSource cannot be null");
            }
            this.preferredSource = preferredSource;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency <= 0) {
                throw new IllegalArgumentException("maxConcurrency must be positive");
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            validatePositive(requestTimeout, "requestTimeout");
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            validatePositive(runTimeout, "runTimeout");
            this.runTimeout = runTimeout;
            return this;
        }

        public Builder fullRefresh(boolean fullRefresh) {
            this.fullRefresh = fullRefresh;
            return this;
        }

        public Builder preferRemote(boolean preferRemote) {
            this.preferRemote = preferRemote;
            return this;
        }

        /**
         * Requires every key to have the given format; {@code null} lifts the requirement.
         */
        public Builder enforcedKeyType(KeyFormat enforcedKeyType) {
            if (enforcedKeyType == KeyFormat.UNRECOGNIZED) {
                throw new IllegalArgumentException("UNRECOGNIZED cannot be enforced");
            }
            this.enforcedKeyType = enforcedKeyType;
            return this;
        }

        /**
         * Limits author lists; 0 disables truncation.
         */
        public Builder maxAuthors(int maxAuthors) {
            if (maxAuthors < 0) {
                throw new IllegalArgumentException("maxAuthors cannot be negative");
            }
            this.maxAuthors = maxAuthors;
            return this;
        }

        public Builder asciiFolding(boolean asciiFolding) {
            this.asciiFolding = asciiFolding;
            return this;
        }

        public Builder expandAasMacros(boolean expandAasMacros) {
            this.expandAasMacros = expandAasMacros;
            return this;
        }

        public Builder adsApiKey(String adsApiKey) {
            this.adsApiKey = blankToNull(adsApiKey);
            return this;
        }

        public Builder semanticScholarApiKey(String semanticScholarApiKey) {
            this.semanticScholarApiKey = blankToNull(semanticScholarApiKey);
            return this;
        }

        public Builder inspireBaseUrl(String inspireBaseUrl) {
            this.inspireBaseUrl = requireUrl(inspireBaseUrl, "inspireBaseUrl");
            return this;
        }

        public Builder adsBaseUrl(String adsBaseUrl) {
            this.adsBaseUrl = requireUrl(adsBaseUrl, "adsBaseUrl");
            return this;
        }

        public Builder semanticScholarBaseUrl(String semanticScholarBaseUrl) {
            this.semanticScholarBaseUrl = requireUrl(semanticScholarBaseUrl, "semanticScholarBaseUrl");
            return this;
        }

        public Builder seedFingerprintsFromExisting(boolean seedFingerprintsFromExisting) {
            this.seedFingerprintsFromExisting = seedFingerprintsFromExisting;
            return this;
        }

        /**
         * Fills API keys not set explicitly from {@code ADS_API_KEY} and
         * {@code SEMANTIC_SCHOLAR_API_KEY}.
         */
        public Builder fromEnvironment(Map<String, String> environment) {
            if (environment == null) {
                return this;
            }
            if (adsApiKey == null) {
                adsApiKey(environment.get(ADS_API_KEY_ENV));
            }
            if (semanticScholarApiKey == null) {
                semanticScholarApiKey(environment.get(SEMANTIC_SCHOLAR_API_KEY_ENV));
            }
            return this;
        }

        public ResolutionConfig build() {
            if (runTimeout.compareTo(requestTimeout) < 0) {
                throw new IllegalArgumentException("runTimeout must be >= requestTimeout");
            }
            return new ResolutionConfig(this);
        }

        private static void validatePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
        }

        private static String requireUrl(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " cannot be blank");
            }
            return value;
        }

        private static String blankToNull(String value) {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }
}
