package com.citation.resolution.routing;

import com.citation.resolution.core.model.KeyFormat;
import com.citation.resolution.core.model.PreferredSource;
import com.citation.resolution.core.model.ProviderName;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces the ordered provider list a key is tried against.
 * Pure and deterministic: the result depends only on the arguments.
 */
public final class FallbackRouter {

    private static final List<ProviderName> ADS_FIRST =
            List.of(ProviderName.ADS, ProviderName.INSPIRE, ProviderName.SEMANTIC_SCHOLAR);
    private static final List<ProviderName> INSPIRE_FIRST =
            List.of(ProviderName.INSPIRE, ProviderName.ADS, ProviderName.SEMANTIC_SCHOLAR);
    private static final List<ProviderName> SEMANTIC_SCHOLAR_FIRST =
            List.of(ProviderName.SEMANTIC_SCHOLAR, ProviderName.INSPIRE, ProviderName.ADS);

    private FallbackRouter() {
        // utility class
    }

    /**
     * Routes a key without local-source involvement.
     */
    public static List<ProviderName> route(PreferredSource policy, KeyFormat format) {
        Objects.requireNonNull(policy, "policy is required");
        Objects.requireNonNull(format, "format is required");
        switch (policy) {
            case ADS:
                return ADS_FIRST;
            case INSPIRE:
                return INSPIRE_FIRST;
            case SEMANTIC_SCHOLAR:
                return SEMANTIC_SCHOLAR_FIRST;
            case AUTO:
            default:
                return format == KeyFormat.ADS_BIBCODE ? ADS_FIRST : INSPIRE_FIRST;
        }
    }

    /**
     * Routes a key, placing {@link ProviderName#LOCAL_SOURCE} when the key is present
     * in the local collection.
     *
     * @param localHit     whether the raw key exists verbatim in the local collection
     * @param preferRemote when set, the local source is only a last resort for
     *                     {@link KeyFormat#UNRECOGNIZED} keys
     */
    public static List<ProviderName> route(PreferredSource policy, KeyFormat format,
                                           boolean localHit, boolean preferRemote) {
        List<ProviderName> remote = route(policy, format);
        if (!localHit) {
            return remote;
        }
        List<ProviderName> providers = new ArrayList<>(remote.size() + 1);
        if (!preferRemote) {
            providers.add(ProviderName.LOCAL_SOURCE);
            providers.addAll(remote);
        } else {
            providers.addAll(remote);
            if (format == KeyFormat.UNRECOGNIZED) {
                providers.add(ProviderName.LOCAL_SOURCE);
            }
        }
        return List.copyOf(providers);
    }
}
