package com.strata.rules.service;

import com.strata.rules.infra.metrics.MetricsRegistry;
import com.strata.rules.infra.metrics.impl.inmemory.InMemoryMetricsRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsProviderDiscoveryTest {

    @Test
    void shouldPickInMemoryProviderRegisteredForTests() {
        assertThat(MetricsRegistry.getInstance())
                .isInstanceOf(InMemoryMetricsRegistry.class)
                .isSameAs(MetricsRegistry.getInstance());
        assertThat(MetricsRegistry.noop()).isNotSameAs(MetricsRegistry.getInstance());
    }
}
