package com.strata.rules.infra.metrics;

import com.strata.rules.infra.metrics.internal.MetricsRegistryHolder;

/**
 * Framework-agnostic metrics registry.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; without a
 * provider on the classpath a no-op registry is used.
 *
 * <pre>{@code
 * MetricsRegistry metrics = MetricsRegistry.getInstance();
 * metrics.counter("rule_compositions_total").increment();
 * }</pre>
 */
public interface MetricsRegistry {

    /**
     * Creates or retrieves a counter metric.
     *
     * @param name metric name (lowercase, underscores only)
     * @param tags optional key-value pairs for labels
     * @return thread-safe counter instance
     */
    Counter counter(String name, String... tags);

    /**
     * Creates or retrieves a gauge metric.
     */
    Gauge gauge(String name, String... tags);

    /**
     * Creates or retrieves a timer histogram.
     */
    Timer timer(String name, String... tags);

    /**
     * Gets the process-wide registry instance.
     */
    static MetricsRegistry getInstance() {
        return MetricsRegistryHolder.INSTANCE;
    }

    /**
     * Registry that records nothing.
     */
    static MetricsRegistry noop() {
        return MetricsRegistryHolder.noop();
    }
}
