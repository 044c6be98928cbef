/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.cache;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Configuration for composition cache stores.
 *
 * <p>Sources, in increasing precedence:
 * <ol>
 *   <li>Builder defaults (IN_MEMORY, 100 entries, 3600 s)</li>
 *   <li>Classpath properties file {@code strata-cache.properties}</li>
 *   <li>Environment variables</li>
 * </ol>
 *
 * <p>Example properties:
 * <pre>
 * cache.type=IN_MEMORY
 * cache.max.size=100
 * cache.ttl.seconds=3600
 * cache.record.stats=true
 * </pre>
 *
 * <p>Environment variables: {@code STRATA_CACHE_TYPE}, {@code STRATA_CACHE_MAX_SIZE},
 * {@code STRATA_CACHE_TTL_SECONDS}.
 *
 * <p>TTLs are capped at {@link #MAX_TTL}. Invalid values coming from properties or
 * the environment are logged and ignored. Invalid values passed to the builder throw {@link IllegalArgumentException}.
 *
 * <pre>{@code
 * CacheConfig config = CacheConfig.loadDefault();
 * CacheStore<CompositionResult> cache = CacheFactory.create(config);
 * }</pre>
 */
public final class CacheConfig {

    private static final Logger logger = Logger.getLogger(CacheConfig.class.getName());

    public static final String DEFAULT_PROPERTIES = "strata-cache.properties";

    /** Longest accepted TTL */
    public static final Duration MAX_TTL = Duration.ofDays(365);

    static final String ENV_CACHE_TYPE = "STRATA_CACHE_TYPE";
    static final String ENV_MAX_SIZE = "STRATA_CACHE_MAX_SIZE";
    static final String ENV_TTL_SECONDS = "STRATA_CACHE_TTL_SECONDS";

    static final String PROP_CACHE_TYPE = "cache.type";
    static final String PROP_MAX_SIZE = "cache.max.size";
    static final String PROP_TTL_SECONDS = "cache.ttl.seconds";
    static final String PROP_RECORD_STATS = "cache.record.stats";

    /**
     * Supported cache store types.
     */
    public enum CacheType {
        /** Exact LRU with lazy TTL expiry (default) */
        IN_MEMORY,

        /** Caffeine with W-TinyLFU eviction and per-entry expiry */
        CAFFEINE,

        /** Stores nothing (benchmarking, debugging) */
        NO_OP
    }

    private final CacheType cacheType;
    private final int maxSize;
    private final Duration ttl;
    private final boolean recordStats;

    private CacheConfig(Builder builder) {
        this.cacheType = builder.cacheType;
        this.maxSize = builder.maxSize;
        this.ttl = builder.ttl;
        this.recordStats = builder.recordStats;
        validate();
    }

    public static CacheConfig defaults() {
        return builder().build();
    }

    /**
     * Small cache with a short TTL, for local development.
     */
    public static CacheConfig forDevelopment() {
        return builder()
                .cacheType(CacheType.IN_MEMORY)
                .maxSize(50)
                .ttl(Duration.ofMinutes(5))
                .recordStats(true)
                .build();
    }

    public static CacheConfig forProduction() {
        return builder()
                .cacheType(CacheType.CAFFEINE)
                .maxSize(1_000)
                .ttl(Duration.ofHours(1))
                .recordStats(true)
                .build();
    }

    /**
     * Defaults overridden by environment variables only.
     */
    public static CacheConfig fromEnvironment() {
        return load(new Properties(), System::getenv);
    }

    /**
     * Loads {@code strata-cache.properties} from the classpath, then applies environment overrides.
     */
    public static CacheConfig loadDefault() {
        return loadFromProperties(DEFAULT_PROPERTIES);
    }

    /**
     * Loads a classpath properties file, then applies environment overrides.
     * A missing or unreadable file leaves the defaults in place.
     */
    public static CacheConfig loadFromProperties(String resource) {
        logger.info("Loading cache configuration from: " + resource);

        Properties props = new Properties();
        try (InputStream is = CacheConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + resource);
            } else {
                logger.warning("Cache properties not found on classpath: " + resource + ". Using defaults.");
            }
        } catch (IOException e) {
            logger.warning("Could not read cache properties " + resource + ": " + e.getMessage()
                    + ". Using defaults.");
        }
        return load(props, System::getenv);
    }

    /**
     * Builds a configuration from explicit sources.
     *
     * @param props properties (lower precedence)
     * @param env   environment lookup (higher precedence), returns null for unset keys
     */
    public static CacheConfig load(Properties props, Function<String, String> env) {
        Builder builder = builder();
        builder.applyLayer("properties", props::getProperty,
                PROP_CACHE_TYPE, PROP_MAX_SIZE, PROP_TTL_SECONDS, PROP_RECORD_STATS);
        builder.applyLayer("environment", env,
                ENV_CACHE_TYPE, ENV_MAX_SIZE, ENV_TTL_SECONDS, null);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
                .cacheType(cacheType)
                .maxSize(maxSize)
                .ttl(ttl)
                .recordStats(recordStats);
    }

    private void validate() {
        if (cacheType == null) {
            throw new IllegalArgumentException("cacheType is required");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive: " + ttl);
        }
        if (ttl.compareTo(MAX_TTL) > 0) {
            throw new IllegalArgumentException("ttl exceeds " + MAX_TTL + ": " + ttl);
        }
    }

    public CacheType getCacheType() { return cacheType; }
    public int getMaxSize() { return maxSize; }
    public Duration getTtl() { return ttl; }
    public boolean isRecordStats() { return recordStats; }

    @Override
    public String toString() {
        return "CacheConfig{type=" + cacheType + ", maxSize=" + maxSize
                + ", ttl=" + ttl.toSeconds() + "s, recordStats=" + recordStats + "}";
    }

    public static class Builder {
        private CacheType cacheType = CacheType.IN_MEMORY;
        private int maxSize = InMemoryCacheStore.DEFAULT_MAX_SIZE;
        private Duration ttl = InMemoryCacheStore.DEFAULT_TTL;
        private boolean recordStats = true;

        private Builder() {
        }

        public Builder cacheType(CacheType cacheType) {
            this.cacheType = cacheType;
            return this;
        }

        public Builder maxSize(int maxSize) {
            if (maxSize <= 0) {
                throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
            }
            this.maxSize = maxSize;
            return this;
        }

        public Builder ttl(Duration ttl) {
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                throw new IllegalArgumentException("ttl must be positive: " + ttl);
            }
            if (ttl.compareTo(MAX_TTL) > 0) {
                throw new IllegalArgumentException("ttl exceeds " + MAX_TTL + ": " + ttl);
            }
            this.ttl = ttl;
            return this;
        }

        public Builder ttlSeconds(long seconds) {
            return ttl(Duration.ofSeconds(seconds));
        }

        public Builder recordStats(boolean recordStats) {
            this.recordStats = recordStats;
            return this;
        }

        public CacheConfig build() {
            return new CacheConfig(this);
        }

        /**
         * Applies one layer of external values. Each lookup returns null for an unset key.
         */
        private void applyLayer(String source, Function<String, String> lookup,
                                String typeKey, String sizeKey, String ttlKey, String statsKey) {
            value(lookup, typeKey).ifPresent(val -> {
                try {
                    this.cacheType = CacheType.valueOf(val.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    logger.warning("Invalid " + typeKey + " in " + source + ": " + val
                            + ", keeping " + this.cacheType);
                }
            });
            positiveLong(source, lookup, sizeKey).ifPresent(val -> {
                if (val > Integer.MAX_VALUE) {
                    logger.warning("Invalid " + sizeKey + " in " + source + ": " + val);
                } else {
                    this.maxSize = val.intValue();
                }
            });
            positiveLong(source, lookup, ttlKey).ifPresent(val -> {
                if (val > MAX_TTL.toSeconds()) {
                    logger.warning("Invalid " + ttlKey + " in " + source + ": " + val
                            + " exceeds " + MAX_TTL.toSeconds() + ", keeping " + this.ttl.toSeconds());
                } else {
                    this.ttl = Duration.ofSeconds(val);
                }
            });
            if (statsKey != null) {
                value(lookup, statsKey).ifPresent(val -> this.recordStats = Boolean.parseBoolean(val));
            }
        }

        private static Optional<String> value(Function<String, String> lookup, String key) {
            String value = lookup.apply(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded cache setting: " + key + "=" + value.trim());
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Long> positiveLong(String source, Function<String, String> lookup, String key) {
            return value(lookup, key).flatMap(val -> {
                long parsed;
                try {
                    parsed = Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid " + key + " in " + source + ": " + val + ", keeping default");
                    return Optional.empty();
                }
                if (parsed <= 0) {
                    logger.warning(key + " must be positive in " + source + ": " + val + ", keeping default");
                    return Optional.empty();
                }
                return Optional.of(parsed);
            });
        }
    }
}
