package com.strata.rules.infra.metrics.internal;

import com.strata.rules.infra.metrics.Counter;
import com.strata.rules.infra.metrics.Gauge;
import com.strata.rules.infra.metrics.MetricsRegistry;
import com.strata.rules.infra.metrics.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Registry used when no provider is on the classpath. Every metric is a shared
 * instance that discards what it is given; timers still run the timed work.
 */
final class NoOpMetricsRegistry implements MetricsRegistry {

    static final NoOpMetricsRegistry INSTANCE = new NoOpMetricsRegistry();

    private static final Counter COUNTER = new Counter() {
        @Override
        public void increment() {
        }

        @Override
        public void increment(long amount) {
        }

        @Override
        public long count() {
            return 0L;
        }
    };

    private static final Gauge GAUGE = new Gauge() {
        @Override
        public void set(double value) {
        }

        @Override
        public double value() {
            return 0.0;
        }
    };

    private static final Timer TIMER = new Timer() {
        @Override
        public <T> T record(Supplier<T> supplier) {
            return supplier.get();
        }

        @Override
        public void record(Duration duration) {
        }

        @Override
        public Duration percentile(double percentile) {
            return Duration.ZERO;
        }
    };

    private NoOpMetricsRegistry() {
    }

    @Override
    public Counter counter(String name, String... tags) {
        return COUNTER;
    }

    @Override
    public Gauge gauge(String name, String... tags) {
        return GAUGE;
    }

    @Override
    public Timer timer(String name, String... tags) {
        return TIMER;
    }
}
