package com.strata.rules.infra.metrics.impl.inmemory;


import com.strata.rules.infra.metrics.Counter;
import com.strata.rules.infra.metrics.Gauge;
import com.strata.rules.infra.metrics.MetricsRegistry;
import com.strata.rules.infra.metrics.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory metrics registry for testing.
 *
 * <pre>{@code
 * InMemoryMetricsRegistry metrics = new InMemoryMetricsRegistry();
 * RuleOrchestrator orchestrator = RuleOrchestrator.builder().metrics(metrics).build();
 *
 * orchestrator.composeRule("child.mdc", rules);
 * assertThat(metrics.getCounterValue("rule_compositions_total")).isEqualTo(1L);
 * }</pre>
 */
public final class InMemoryMetricsRegistry implements MetricsRegistry {

    private final Map<String, InMemoryCounter> counters = new ConcurrentHashMap<>();
    private final Map<String, InMemoryGauge> gauges = new ConcurrentHashMap<>();
    private final Map<String, InMemoryTimer> timers = new ConcurrentHashMap<>();

    @Override
    public Counter counter(String name, String... tags) {
        return counters.computeIfAbsent(name, InMemoryCounter::new);
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return gauges.computeIfAbsent(name, InMemoryGauge::new);
    }

    @Override
    public Timer timer(String name, String... tags) {
        return timers.computeIfAbsent(name, InMemoryTimer::new);
    }

    // Test helper methods

    public long getCounterValue(String name) {
        Counter counter = counters.get(name);
        return counter != null ? counter.count() : 0L;
    }

    public double getGaugeValue(String name) {
        Gauge gauge = gauges.get(name);
        return gauge != null ? gauge.value() : 0.0;
    }

    public List<Duration> getTimerRecordings(String name) {
        InMemoryTimer timer = timers.get(name);
        return timer != null ? timer.getRecordings() : List.of();
    }

    public void reset() {
        counters.clear();
        gauges.clear();
        timers.clear();
    }
}
