/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time cache statistics. Counters cover the store's lifetime and reset
 * only on an explicit clear.
 */
public record CacheStatus(
        @JsonProperty("size") long size,
        @JsonProperty("max_size") long maxSize,
        @JsonProperty("hit_rate") double hitRate,
        @JsonProperty("total_accesses") long totalAccesses,
        @JsonProperty("expired_items") long expiredItems,
        @JsonProperty("hits") long hits,
        @JsonProperty("misses") long misses,
        @JsonProperty("evictions") long evictions
) {
    public static CacheStatus of(long size, long maxSize, long hits, long misses,
                                 long expiredItems, long evictions) {
        long total = hits + misses;
        return new CacheStatus(size, maxSize, total > 0 ? (double) hits / total : 0.0,
                total, expiredItems, hits, misses, evictions);
    }

    public String format() {
        return String.format(
                "Cache Status: size=%d/%d, accesses=%d, hits=%d (%.1f%%), misses=%d, expired=%d, evictions=%d",
                size, maxSize, totalAccesses, hits, hitRate * 100, misses, expiredItems, evictions);
    }
}
