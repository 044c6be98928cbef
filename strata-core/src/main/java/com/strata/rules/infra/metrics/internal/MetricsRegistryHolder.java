package com.strata.rules.infra.metrics.internal;

import com.strata.rules.infra.metrics.MetricsRegistry;
import com.strata.rules.infra.metrics.api.MetricsRegistryProvider;

import java.util.Comparator;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.logging.Logger;

/**
 * Initialization-on-demand holder for the process-wide {@link MetricsRegistry}.
 *
 * <p>The provider with the highest {@link MetricsRegistryProvider#priority()} found by
 * {@link ServiceLoader} wins; with none on the classpath metrics are discarded.
 * Not part of the public API.
 */
public final class MetricsRegistryHolder {

    private static final Logger logger = Logger.getLogger(MetricsRegistryHolder.class.getName());

    public static final MetricsRegistry INSTANCE = discover();

    private MetricsRegistryHolder() {
        throw new AssertionError("No instances");
    }

    public static MetricsRegistry noop() {
        return NoOpMetricsRegistry.INSTANCE;
    }

    private static MetricsRegistry discover() {
        Optional<MetricsRegistryProvider> provider = ServiceLoader.load(MetricsRegistryProvider.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .max(Comparator.comparingInt(MetricsRegistryProvider::priority));

        if (provider.isEmpty()) {
            logger.info("No MetricsRegistryProvider on the classpath, metrics are disabled");
            return NoOpMetricsRegistry.INSTANCE;
        }
        MetricsRegistryProvider selected = provider.get();
        logger.info(String.format("Metrics provider '%s' selected (priority %d)",
                selected.name(), selected.priority()));
        return selected.create();
    }
}
