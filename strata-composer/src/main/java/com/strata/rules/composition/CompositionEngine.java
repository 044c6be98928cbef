/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.composition;

import com.strata.rules.api.ICompositionEngine;
import com.strata.rules.api.IInheritanceResolver;
import com.strata.rules.api.model.CacheStatus;
import com.strata.rules.api.model.CompositionConflict;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ConflictKind;
import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.compiler.resolution.InheritanceResolver;
import com.strata.rules.infra.cache.CacheConfig;
import com.strata.rules.infra.cache.CacheFactory;
import com.strata.rules.infra.cache.CacheStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composes rules by folding their inheritance chain and memoizes the results.
 *
 * <p><b>Caching:</b> results are keyed by the rule path plus a fingerprint of every
 * (path, checksum) pair in its chain, so any ancestor edit produces a new key.
 * Every stored key is indexed with the paths of its chain; {@link #invalidate(String)}
 * uses that index to drop the compositions of a rule and of all its descendants.
 * The index never holds more keys than the cache can: keys that miss are dropped,
 * and once the index outgrows the cache capacity it is trimmed to the keys the cache
 * still holds.
 *
 * <p><b>Failure policy:</b>
 * <ul>
 *   <li>Unknown rule: {@code success=false}, not cached.</li>
 *   <li>Cyclic chain: {@code success=false} with a {@link ConflictKind#CIRCULAR_INHERITANCE} conflict.</li>
 *   <li>Cache backend errors: logged, surfaced as a result warning, composition recomputed.</li>
 * </ul>
 *
 * <p>Thread-safe as long as the supplied {@link CacheStore} is; rule maps passed in
 * are treated as immutable snapshots.
 */
public class CompositionEngine implements ICompositionEngine {

    private static final Logger logger = Logger.getLogger(CompositionEngine.class.getName());

    private final IInheritanceResolver resolver;
    private final CacheStore<CompositionResult> cache;
    private final ChainFolder folder;
    private final Map<String, List<String>> chainsByKey = new ConcurrentHashMap<>();

    public CompositionEngine(IInheritanceResolver resolver, CacheStore<CompositionResult> cache) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.folder = new ChainFolder(resolver);
    }

    /**
     * Engine with the default resolver and a cache built from {@link CacheConfig#loadDefault()}.
     */
    public CompositionEngine() {
        this(new InheritanceResolver(), CacheFactory.create(CacheConfig.loadDefault()));
    }

    @Override
    public CompositionResult compose(String rulePath, Map<String, ParsedRule> allRules) {
        Objects.requireNonNull(rulePath, "rulePath");
        Objects.requireNonNull(allRules, "allRules");

        if (!allRules.containsKey(rulePath)) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Cannot compose unknown rule " + rulePath);
            }
            return CompositionResult.notFound(rulePath);
        }

        InheritanceChain chain = resolver.buildChain(rulePath, allRules);
        if (chain.isTruncated()) {
            return cycleFailure(rulePath, chain);
        }

        String key = ChainFingerprint.cacheKey(rulePath, chain, allRules);
        List<String> cacheWarnings = new ArrayList<>();

        Optional<CompositionResult> cached = lookup(key, cacheWarnings);
        if (cached.isPresent()) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("Composition cache hit for " + rulePath);
            }
            return cached.get();
        }

        CompositionResult result = folder.fold(chain, allRules);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Composed %s from %d rules: %d sections, %d conflicts",
                    rulePath, chain.size(), result.composedSections().size(), result.conflicts().size()));
        }

        store(key, chain, result, cacheWarnings);
        return result.withWarnings(cacheWarnings);
    }

    @Override
    public void invalidate(String rulePath) {
        List<String> keys = new ArrayList<>();
        chainsByKey.forEach((key, chain) -> {
            if (chain.contains(rulePath)) {
                keys.add(key);
            }
        });
        if (keys.isEmpty()) {
            return;
        }
        keys.forEach(chainsByKey::remove);
        cache.invalidateAll(keys);
        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Invalidated %d cached compositions depending on %s", keys.size(), rulePath));
        }
    }

    @Override
    public void clearCache() {
        cache.clear();
        chainsByKey.clear();
        logger.info("Composition cache cleared");
    }

    @Override
    public CacheStatus cacheStatus() {
        return cache.stats();
    }

    private CompositionResult cycleFailure(String rulePath, InheritanceChain chain) {
        String repeated = chain.repeatedPath().orElse(rulePath);
        List<String> upward = new ArrayList<>(chain.paths());
        Collections.reverse(upward);
        String loop = String.join(" -> ", upward);

        CompositionConflict conflict = CompositionConflict.of(repeated, repeated, rulePath,
                ConflictKind.CIRCULAR_INHERITANCE, "composition aborted: " + loop);
        logger.warning(String.format("Circular inheritance while composing %s: %s", rulePath, loop));
        return CompositionResult.failure(rulePath, List.of(conflict),
                List.of("Circular inheritance detected: " + loop), chain.paths());
    }

    private Optional<CompositionResult> lookup(String key, List<String> warnings) {
        try {
            Optional<CompositionResult> cached = cache.get(key);
            if (cached.isEmpty()) {
                // evicted or expired since it was indexed
                chainsByKey.remove(key);
            }
            return cached;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Composition cache lookup failed, recomputing", e);
            warnings.add("Cache lookup failed: " + e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String key, InheritanceChain chain, CompositionResult result, List<String> warnings) {
        try {
            cache.put(key, result);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Composition cache store failed, result not cached", e);
            warnings.add("Cache store failed: " + e.getMessage());
            return;
        }
        chainsByKey.put(key, chain.paths());
        if (chainsByKey.size() > cache.maxSize()) {
            Set<String> live = cache.keys();
            chainsByKey.keySet().retainAll(live);
        }
    }

    /**
     * Number of cache keys currently tracked for invalidation.
     */
    int indexedKeyCount() {
        return chainsByKey.size();
    }
}
