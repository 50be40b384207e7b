package com.themis.refinery.core.metrics.impl.inmemory;

import com.themis.refinery.core.metrics.MetricsRegistry;
import com.themis.refinery.core.metrics.api.MetricsRegistryProvider;

/**
 * Low-priority provider; only chosen when Prometheus is not registered.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public String name() {
        return "InMemory";
    }
}
