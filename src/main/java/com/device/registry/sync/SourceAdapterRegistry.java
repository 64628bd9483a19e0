package com.device.registry.sync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Fixed table of source adapters keyed by source id. Built once; every configured source
 * maps to exactly one adapter.
 */
public final class SourceAdapterRegistry {

    private final Map<String, SourceAdapter> adapters;

    private SourceAdapterRegistry(Map<String, SourceAdapter> adapters) {
        this.adapters = Collections.unmodifiableMap(new LinkedHashMap<>(adapters));
    }

    /**
     * Returns the adapter for a source.
     *
     * @throws IllegalArgumentException if no adapter is registered for the source
     */
    public SourceAdapter get(String sourceId) {
        SourceAdapter adapter = adapters.get(sourceId);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for source: " + sourceId);
        }
        return adapter;
    }

    public boolean contains(String sourceId) {
        return adapters.containsKey(sourceId);
    }

    /**
     * Source ids in registration order.
     */
    public Set<String> sourceIds() {
        return adapters.keySet();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

        public Builder register(SourceAdapter adapter) {
            Objects.requireNonNull(adapter, "adapter is required");
            String sourceId = Objects.requireNonNull(adapter.sourceId(), "adapter sourceId is required");
            if (adapters.putIfAbsent(sourceId, adapter) != null) {
                throw new IllegalArgumentException("Adapter already registered for source: " + sourceId);
            }
            return this;
        }

        public SourceAdapterRegistry build() {
            return new SourceAdapterRegistry(adapters);
        }
    }
}
