/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.cache;

import com.strata.rules.api.model.CacheStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory LRU + TTL cache.
 *
 * <p>Features:
 * <ul>
 *   <li>Exact LRU eviction: a {@link LinkedHashMap} kept in recency order</li>
 *   <li>Per-entry TTL with lazy expiry on lookup</li>
 *   <li>Opportunistic purge of expired entries when a put hits the capacity</li>
 *   <li>Single lock around map and recency bookkeeping</li>
 *   <li>Injected {@link Clock} for deterministic expiry in tests</li>
 * </ul>
 *
 * <p>Recency is a strict total order, so two entries never tie for eviction.
 */
public class InMemoryCacheStore<V> implements CacheStore<V> {
    private static final Logger logger = Logger.getLogger(InMemoryCacheStore.class.getName());

    public static final int DEFAULT_MAX_SIZE = 100;
    public static final Duration DEFAULT_TTL = Duration.ofSeconds(3600);

    // eldest entry is the least recently used; hits and overwrites move a key to the tail
    private final LinkedHashMap<String, CacheEntry<V>> entries;
    private final ReentrantLock lock = new ReentrantLock();

    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder expired = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    public InMemoryCacheStore(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        requirePositive(defaultTtl);
        this.maxSize = maxSize;
        this.defaultTtl = defaultTtl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(Math.min(maxSize, 1024));

        logger.info(String.format(
                "InMemoryCacheStore initialized: maxSize=%d, ttl=%ds",
                maxSize, defaultTtl.toSeconds()));
    }

    public InMemoryCacheStore() {
        this(DEFAULT_MAX_SIZE, DEFAULT_TTL, Clock.systemUTC());
    }

    @Override
    public Optional<V> get(String key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }

            Instant now = clock.instant();
            if (entry.isExpired(now)) {
                entries.remove(key);
                expired.increment();
                misses.increment();
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Expired entry removed on lookup: " + key);
                }
                return Optional.empty();
            }

            hits.increment();
            entries.remove(key);
            entries.put(key, entry.touch(now));
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CacheEntry<V>> peek(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null || entry.isExpired(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void put(String key, V value) {
        put(key, value, defaultTtl);
    }

    @Override
    public void put(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (ttl != null) {
            requirePositive(ttl);
        }

        lock.lock();
        try {
            Instant now = clock.instant();
            if (!entries.containsKey(key) && entries.size() >= maxSize) {
                purgeExpired(now);
                if (entries.size() >= maxSize) {
                    evictLRU();
                }
            }
            Instant expiresAt = ttl == null ? null : now.plus(ttl);
            entries.remove(key);
            entries.put(key, new CacheEntry<>(key, value, now, expiresAt, now));
        } finally {
            lock.unlock();
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Cached entry: key=%s, ttl=%s", key, ttl));
        }
    }

    @Override
    public void invalidate(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Set<String> keys() {
        lock.lock();
        try {
            return Set.copyOf(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void clear() {
        int size;
        lock.lock();
        try {
            size = entries.size();
            entries.clear();
            hits.reset();
            misses.reset();
            expired.reset();
            evictions.reset();
        } finally {
            lock.unlock();
        }
        logger.info("Cache cleared: " + size + " entries removed");
    }

    @Override
    public CacheStatus stats() {
        lock.lock();
        try {
            return CacheStatus.of(entries.size(), maxSize, hits.sum(), misses.sum(),
                    expired.sum(), evictions.sum());
        } finally {
            lock.unlock();
        }
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
     * Evict the least recently used entry. Caller holds the lock.
     */
    private void evictLRU() {
        Iterator<Map.Entry<String, CacheEntry<V>>> it = entries.entrySet().iterator();
        if (it.hasNext()) {
            String lruKey = it.next().getKey();
            it.remove();
            evictions.increment();

            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Evicted LRU entry: " + lruKey);
            }
        }
    }

    /**
     * Drop every expired entry. Caller holds the lock.
     */
    private void purgeExpired(Instant now) {
        int cleaned = 0;
        Iterator<CacheEntry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                expired.increment();
                cleaned++;
            }
        }
        if (cleaned > 0 && logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Purged %d expired entries", cleaned));
        }
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
    }

    /**
     * Builder for InMemoryCacheStore.
     */
    public static class Builder<V> {
        private int maxSize = DEFAULT_MAX_SIZE;
        private Duration defaultTtl = DEFAULT_TTL;
        private Clock clock = Clock.systemUTC();

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

        public InMemoryCacheStore<V> build() {
            return new InMemoryCacheStore<>(maxSize, defaultTtl, clock);
        }
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }
}
