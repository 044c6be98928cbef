package com.strata.rules.infra.metrics;

/**
 * Last-written value, such as the number of rules in the active snapshot.
 */
public interface Gauge {

    void set(double value);

    double value();
}
