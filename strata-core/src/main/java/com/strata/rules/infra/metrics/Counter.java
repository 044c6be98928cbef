package com.strata.rules.infra.metrics;

/**
 * Monotonically increasing count, e.g. compositions performed since startup.
 */
public interface Counter {

    void increment();

    /**
     * @param amount non-negative increment
     * @throws IllegalArgumentException if {@code amount} is negative
     */
    void increment(long amount);

    long count();
}
