package com.themis.refinery.core.metrics.impl.prometheus;

import com.themis.refinery.core.metrics.MetricsRegistry;
import com.themis.refinery.core.metrics.api.MetricsRegistryProvider;

/**
 * Production provider, registered in
 * {@code META-INF/services/com.themis.refinery.core.metrics.api.MetricsRegistryProvider}.
 */
public final class PrometheusMetricsRegistryProvider implements MetricsRegistryProvider {

    @Override
    public MetricsRegistry create() {
        return new PrometheusMetricsRegistry();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public String name() {
        return "Prometheus";
    }
}
