package com.themis.refinery.core.metrics.api;

import com.themis.refinery.core.metrics.MetricsRegistry;

/**
 * Service-provider hook for metrics backends. The provider with the highest
 * priority wins.
 */
public interface MetricsRegistryProvider {

    MetricsRegistry create();

    int priority();

    String name();
}
