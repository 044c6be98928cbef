/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api;

import com.strata.rules.api.model.CacheStatus;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ParsedRule;

import java.util.Map;

/**
 * Merges a rule with its ancestors into a single composed result.
 */
public interface ICompositionEngine {

    /**
     * Composes a rule. Never throws for data problems; cycles and unknown paths
     * yield {@code success=false}.
     */
    CompositionResult compose(String rulePath, Map<String, ParsedRule> allRules);

    /**
     * Drops cached compositions of {@code rulePath} and of every rule that inherits from it.
     */
    void invalidate(String rulePath);

    void clearCache();

    CacheStatus cacheStatus();
}
