/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.cache;

import com.strata.rules.api.model.CacheStatus;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;

/**
 * Cache store that never stores anything.
 *
 * <p>Useful to measure composition without memoization or to isolate caching
 * issues. Every {@code get} is a miss and is counted as one.
 */
public final class NoOpCacheStore<V> implements CacheStore<V> {

    private final LongAdder misses = new LongAdder();

    @Override
    public Optional<V> get(String key) {
        misses.increment();
        return Optional.empty();
    }

    @Override
    public Optional<CacheEntry<V>> peek(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, V value) {
    }

    @Override
    public void put(String key, V value, Duration ttl) {
    }

    @Override
    public void invalidate(String key) {
    }

    @Override
    public Set<String> keys() {
        return Set.of();
    }

    @Override
    public void clear() {
        misses.reset();
    }

    @Override
    public CacheStatus stats() {
        return CacheStatus.of(0, 0, 0, misses.sum(), 0, 0);
    }

    @Override
    public long maxSize() {
        return 0;
    }

    @Override
    public Duration defaultTtl() {
        return Duration.ZERO;
    }
}
