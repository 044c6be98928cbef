/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.cache;

import com.strata.rules.api.model.CacheStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * Generic string-keyed cache with capacity bound and per-entry TTL.
 *
 * <p>Implementations must be safe for concurrent use. A {@code get} racing with an
 * evicting {@code put} may see the old or the new value but never a partially
 * built entry. Expiry is detected lazily on access; no background thread is used.
 *
 * @param <V> cached value type, expected to be immutable
 */
public interface CacheStore<V> {

    /**
     * A cached value with its bookkeeping timestamps.
     *
     * @param expiresAt null when the entry never expires
     */
    record CacheEntry<V>(
            String key,
            V value,
            Instant createdAt,
            Instant expiresAt,
            Instant lastAccessedAt
    ) {
        public boolean isExpired(Instant now) {
            return expiresAt != null && now.isAfter(expiresAt);
        }

        CacheEntry<V> touch(Instant now) {
            return new CacheEntry<>(key, value, createdAt, expiresAt, now);
        }
    }

    /**
     * Looks up a value. A hit refreshes the entry's recency; an expired entry is
     * removed and reported as absent.
     */
    Optional<V> get(String key);

    /**
     * Reads an entry without touching recency or statistics. Expired entries are absent.
     */
    Optional<CacheEntry<V>> peek(String key);

    /**
     * Stores a value with the store's default TTL.
     */
    void put(String key, V value);

    /**
     * Stores a value. When a new key would exceed the capacity the least recently
     * used entry is evicted first.
     *
     * @param ttl time to live, or null for an entry that never expires
     */
    void put(String key, V value, Duration ttl);

    void invalidate(String key);

    default void invalidateAll(Collection<String> keys) {
        keys.forEach(this::invalidate);
    }

    /**
     * Snapshot of the keys currently held, expired ones possibly included.
     */
    Set<String> keys();

    /**
     * Removes every entry and resets the statistics counters.
     */
    void clear();

    CacheStatus stats();

    long maxSize();

    Duration defaultTtl();
}
