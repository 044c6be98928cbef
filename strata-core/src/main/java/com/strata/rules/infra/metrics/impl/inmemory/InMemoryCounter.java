package com.strata.rules.infra.metrics.impl.inmemory;

import com.strata.rules.infra.metrics.Counter;

import java.util.concurrent.atomic.LongAdder;

final class InMemoryCounter implements Counter {

    private final String name;
    private final LongAdder total = new LongAdder();

    InMemoryCounter(String name) {
        this.name = name;
    }

    @Override
    public void increment() {
        total.increment();
    }

    @Override
    public void increment(long amount) {
        if (amount < 0) {
            throw new IllegalArgumentException(String.format("Counter %s is monotonic, got %d", name, amount));
        }
        total.add(amount);
    }

    @Override
    public long count() {
        return total.sum();
    }

    @Override
    public String toString() {
        return "InMemoryCounter{name='" + name + "', count=" + count() + '}';
    }
}
