package com.themis.refinery.core.metrics;

import com.themis.refinery.core.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered through {@link java.util.ServiceLoader}
 * (see {@link com.themis.refinery.core.metrics.api.MetricsRegistryProvider});
 * without a provider every metric is a no-op.
 *
 * <pre>{@code
 * Counter errors = MetricsRegistry.getInstance().counter("themis_rule_application_errors");
 * errors.increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * @param name metric name, lowercase with underscores
     * @param tags alternating label names and values
     */
    Counter counter(String name, String... tags);

    Gauge gauge(String name, String... tags);

    Timer timer(String name, String... tags);

    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }
}
