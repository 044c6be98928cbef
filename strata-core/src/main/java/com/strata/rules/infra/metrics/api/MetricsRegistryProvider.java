package com.strata.rules.infra.metrics.api;

import com.strata.rules.infra.metrics.MetricsRegistry;

/**
 * Service Provider Interface for {@link MetricsRegistry} implementations.
 *
 * <p>Implementations must:
 * <ul>
 *   <li>Have a public no-arg constructor
 *   <li>Be thread-safe
 *   <li>Register themselves in {@code META-INF/services}
 * </ul>
 */
public interface MetricsRegistryProvider {

    /**
     * Creates a new MetricsRegistry instance.
     */
    MetricsRegistry create();

    /**
     * Provider priority for selection.
     * Higher values are preferred when multiple providers exist.
     */
    default int priority() {
        return 0;
    }

    default String name() {
        return getClass().getSimpleName();
    }
}
