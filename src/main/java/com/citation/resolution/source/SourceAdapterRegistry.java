package com.citation.resolution.source;

import com.citation.resolution.core.model.ProviderName;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-to-adapter lookup used by the resolver to dispatch on the routed
 * provider list.
 */
public class SourceAdapterRegistry {

    private final Map<ProviderName, SourceAdapter> adapters = new EnumMap<>(ProviderName.class);

    public SourceAdapterRegistry register(SourceAdapter adapter) {
        adapters.put(adapter.provider(), adapter);
        return this;
    }

    public Optional<SourceAdapter> get(ProviderName provider) {
        return Optional.ofNullable(adapters.get(provider));
    }

    public boolean contains(ProviderName provider) {
        return adapters.containsKey(provider);
    }

    /**
     * Returns the local source adapter if one is registered.
     */
    public Optional<LocalSourceAdapter> localSource() {
        SourceAdapter adapter = adapters.get(ProviderName.LOCAL_SOURCE);
        return adapter instanceof LocalSourceAdapter ? Optional.of((LocalSourceAdapter) adapter) : Optional.empty();
    }

    public Collection<SourceAdapter> all() {
        return Collections.unmodifiableCollection(adapters.values());
    }
}
