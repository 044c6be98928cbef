package com.strata.rules.infra.metrics;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Latency histogram with percentile tracking.
 * Thread-safe.
 */
public interface Timer {
    /**
     * Times execution of a supplier.
     *
     * @return supplier result
     */
    <T> T record(Supplier<T> supplier);

    /**
     * Records a pre-measured duration.
     */
    void record(Duration duration);

    /**
     * Gets percentile value.
     *
     * @param percentile value between 0.0 and 1.0
     * @return duration at percentile
     */
    Duration percentile(double percentile);
}
