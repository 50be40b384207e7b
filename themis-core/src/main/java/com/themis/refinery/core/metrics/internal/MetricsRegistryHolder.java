package com.themis.refinery.core.metrics.internal;

import com.themis.refinery.core.metrics.MetricsRegistry;
import com.themis.refinery.core.metrics.api.MetricsRegistryProvider;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Process-wide registry, chosen once from the providers on the class path.
 *
 * <p>The {@value #PROVIDER_PROPERTY} system property names the provider to
 * use, or {@code none} to turn metrics off. Without it the provider with the
 * highest priority is used.
 *
 * <p><b>INTERNAL USE ONLY</b>
 */
public final class MetricsRegistryHolder {
    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final String PROVIDER_PROPERTY = "themis.metrics.provider";
    static final String DISABLED = "none";

    public static final MetricsRegistry INSTANCE = resolve(discover(), System.getProperty(PROVIDER_PROPERTY));

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    static MetricsRegistry resolve(List<MetricsRegistryProvider> providers, String requested) {
        Optional<MetricsRegistryProvider> chosen = select(providers, requested);
        if (chosen.isEmpty()) {
            logger.info(String.format("Metrics disabled (requested %s, found %s)",
                    requested == null ? "any" : requested, names(providers)));
            return new NoOpMetricsRegistry();
        }
        MetricsRegistryProvider provider = chosen.get();
        logger.info(String.format("Metrics provider: %s (priority %d, found %s)",
                provider.name(), provider.priority(), names(providers)));
        return provider.create();
    }

    static Optional<MetricsRegistryProvider> select(List<MetricsRegistryProvider> providers, String requested) {
        if (requested == null || requested.isBlank()) {
            return providers.stream().max(Comparator.comparingInt(MetricsRegistryProvider::priority));
        }
        if (DISABLED.equalsIgnoreCase(requested.trim())) {
            return Optional.empty();
        }
        Optional<MetricsRegistryProvider> named = providers.stream()
                .filter(provider -> provider.name().equalsIgnoreCase(requested.trim()))
                .findFirst();
        if (named.isEmpty()) {
            logger.warning(String.format("Metrics provider %s not found among %s", requested, names(providers)));
        }
        return named;
    }

    private static List<MetricsRegistryProvider> discover() {
        List<MetricsRegistryProvider> providers = new ArrayList<>();
        ServiceLoader.load(MetricsRegistryProvider.class).forEach(providers::add);
        return providers;
    }

    private static List<String> names(List<MetricsRegistryProvider> providers) {
        return providers.stream().map(MetricsRegistryProvider::name).toList();
    }
}
