/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.cache;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Creates {@link CacheStore} instances from a {@link CacheConfig}.
 *
 * <pre>{@code
 * CacheStore<CompositionResult> cache = CacheFactory.create(CacheConfig.loadDefault());
 * }</pre>
 */
public final class CacheFactory {
    private static final Logger logger = Logger.getLogger(CacheFactory.class.getName());

    private CacheFactory() {
        throw new AssertionError("No instances");
    }

    public static <V> CacheStore<V> create(CacheConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Creates a store whose expiry is driven by the given clock.
     */
    public static <V> CacheStore<V> create(CacheConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(clock, "clock");
        logger.info("Creating cache store: " + config);

        return switch (config.getCacheType()) {
            case IN_MEMORY -> InMemoryCacheStore.<V>builder()
                    .maxSize(config.getMaxSize())
                    .defaultTtl(config.getTtl())
                    .clock(clock)
                    .build();
            case CAFFEINE -> CaffeineCacheStore.<V>builder()
                    .maxSize(config.getMaxSize())
                    .defaultTtl(config.getTtl())
                    .recordStats(config.isRecordStats())
                    .clock(clock)
                    .build();
            case NO_OP -> new NoOpCacheStore<>();
        };
    }
}
