package com.strata.rules.infra.metrics.impl.inmemory;

import com.strata.rules.infra.metrics.MetricsRegistry;
import com.strata.rules.infra.metrics.api.MetricsRegistryProvider;

/**
 * Registers {@link InMemoryMetricsRegistry} with {@link java.util.ServiceLoader}.
 *
 * <p>Test modules activate it with a
 * {@code META-INF/services/com.strata.rules.infra.metrics.api.MetricsRegistryProvider}
 * resource naming this class. Its priority beats any production provider so that
 * tests observe the metrics the engine records.
 */
public final class InMemoryMetricsRegistryProvider implements MetricsRegistryProvider {

    static final int TEST_PRIORITY = 1000;

    @Override
    public MetricsRegistry create() {
        return new InMemoryMetricsRegistry();
    }

    @Override
    public int priority() {
        return TEST_PRIORITY;
    }

    @Override
    public String name() {
        return "in-memory";
    }
}
