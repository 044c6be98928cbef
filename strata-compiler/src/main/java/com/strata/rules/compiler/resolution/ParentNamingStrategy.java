/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.resolution;

import com.strata.rules.api.model.ParsedRule;

import java.util.List;

/**
 * Convention used to find a parent for rules without an explicit {@code inherit} key.
 *
 * <p>Implementations only generate candidate paths; the resolver picks the first
 * candidate that exists in the rule set. Hosts can plug in their own layout
 * without touching the resolution algorithm.
 */
@FunctionalInterface
public interface ParentNamingStrategy {

    /**
     * Candidate parent paths for {@code rule}, most preferred first.
     * Must never contain the rule's own path.
     */
    List<String> candidates(ParsedRule rule);
}
