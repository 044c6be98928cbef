/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.strata.rules.api.model.CacheStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cache store backed by Caffeine.
 *
 * <p>Differences from {@link InMemoryCacheStore}:
 * <ul>
 *   <li>Size eviction follows Window TinyLFU, which approximates but does not equal LRU</li>
 *   <li>Per-entry TTL is enforced through a variable {@link Expiry}</li>
 *   <li>{@code lastAccessedAt} is not refreshed on hits</li>
 * </ul>
 *
 * <p>Maintenance runs on the calling thread, so removal notifications (and therefore
 * the expired-item count) are visible as soon as {@link #stats()} returns.
 */
public class CaffeineCacheStore<V> implements CacheStore<V> {
    private static final Logger logger = Logger.getLogger(CaffeineCacheStore.class.getName());

    private final Cache<String, CacheEntry<V>> cache;
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;
    private final boolean statsEnabled;

    private final LongAdder expired = new LongAdder();
    // Caffeine counters cannot be reset; clear() moves the baseline instead
    private final AtomicReference<CacheStats> baseline = new AtomicReference<>(CacheStats.empty());

    private CaffeineCacheStore(Builder<V> builder) {
        if (builder.maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + builder.maxSize);
        }
        if (builder.defaultTtl == null || builder.defaultTtl.isZero() || builder.defaultTtl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + builder.defaultTtl);
        }
        this.maxSize = builder.maxSize;
        this.defaultTtl = builder.defaultTtl;
        this.clock = Objects.requireNonNull(builder.clock, "clock");
        this.statsEnabled = builder.recordStats;

        Caffeine<Object, Object> cacheBuilder = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .executor(Runnable::run)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()));

        if (statsEnabled) {
            cacheBuilder.recordStats();
        }

        this.cache = cacheBuilder
                .expireAfter(new EntryExpiry<V>(clock))
                .removalListener((String key, CacheEntry<V> value, RemovalCause cause) -> {
                    if (cause == RemovalCause.EXPIRED) {
                        expired.increment();
                    }
                    if (cause.wasEvicted() && logger.isLoggable(Level.FINE)) {
                        logger.fine(String.format("Cache eviction: key=%s, cause=%s", key, cause));
                    }
                })
                .build();

        logger.info(String.format(
                "CaffeineCacheStore initialized: maxSize=%d, ttl=%ds, stats=%b",
                maxSize, defaultTtl.toSeconds(), statsEnabled));
    }

    @Override
    public Optional<V> get(String key) {
        CacheEntry<V> entry = cache.getIfPresent(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public Optional<CacheEntry<V>> peek(String key) {
        return Optional.ofNullable(cache.policy().getIfPresentQuietly(key))
                .filter(entry -> !entry.isExpired(clock.instant()));
    }

    @Override
    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        Objects.requireNonNull(value, "value");
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        Instant now = clock.instant();
        cache.put(key, new CacheEntry<>(key, value, now, ttl == null ? null : now.plus(ttl), now));
    }

    @Override
    public void invalidate(String key) {
        cache.invalidate(key);
    }

    @Override
    public Set<String> keys() {
        return Set.copyOf(cache.asMap().keySet());
    }

    @Override
    public void clear() {
        long size = cache.estimatedSize();
        cache.invalidateAll();
        cache.cleanUp();
        expired.reset();
        baseline.set(cache.stats());
        logger.info("Cache cleared: " + size + " entries removed");
    }

    @Override
    public CacheStatus stats() {
        cache.cleanUp();
        CacheStats stats = statsEnabled ? cache.stats().minus(baseline.get()) : CacheStats.empty();
        return CacheStatus.of(cache.estimatedSize(), maxSize, stats.hitCount(), stats.missCount(),
                expired.sum(), stats.evictionCount());
    }

    @Override
    public long maxSize() {
        return maxSize;
    }

    @Override
    public Duration defaultTtl() {
        return defaultTtl;
    }

    /**
     * Expiry derived from each entry's own deadline, so overwrites and TTL-less
     * entries are handled uniformly.
     */
    private static final class EntryExpiry<V> implements Expiry<String, CacheEntry<V>> {
        private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

        private final Clock clock;

        EntryExpiry(Clock clock) {
            this.clock = clock;
        }

        @Override
        public long expireAfterCreate(String key, CacheEntry<V> entry, long currentTime) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return remainingNanos(entry);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry<V> entry, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private long remainingNanos(CacheEntry<V> entry) {
            if (entry.expiresAt() == null) {
                return Long.MAX_VALUE;
            }
            Duration remaining = Duration.between(clock.instant(), entry.expiresAt());
            if (remaining.isNegative()) {
                return 0L;
            }
            // toNanos overflows past ~292 years
            return remaining.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : remaining.toNanos();
        }
    }

    /**
     * Builder for CaffeineCacheStore.
     */
    public static class Builder<V> {
        private int maxSize = InMemoryCacheStore.DEFAULT_MAX_SIZE;
        private Duration defaultTtl = InMemoryCacheStore.DEFAULT_TTL;
        private Clock clock = Clock.systemUTC();
        private boolean recordStats = true;

        public Builder<V> maxSize(int maxSize) {
            this.maxSize = maxSize;
            return this;
        }

        public Builder<V> defaultTtl(Duration ttl) {
            this.defaultTtl = ttl;
            return this;
        }

        public Builder<V> clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder<V> recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CaffeineCacheStore<V> build() {
            return new CaffeineCacheStore<>(this);
        }
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }
}
