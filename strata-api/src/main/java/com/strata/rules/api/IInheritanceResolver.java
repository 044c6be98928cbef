/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api;

import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.InheritanceEdge;
import com.strata.rules.api.model.InheritanceType;
import com.strata.rules.api.model.ParsedRule;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves parent links between rules. Implementations are stateless and never
 * throw for data problems: unresolved parents and cycles are reported through
 * return values.
 */
public interface IInheritanceResolver {

    /**
     * Direct parent of a rule, or empty for a root rule.
     */
    Optional<String> resolveParent(ParsedRule rule, Map<String, ParsedRule> allRules);

    /**
     * Inheritance policy of {@code rule} towards {@code parent}.
     *
     * @param parent the resolved parent, may be null
     */
    InheritanceType inferInheritanceType(ParsedRule rule, ParsedRule parent);

    /**
     * Child to parent edge, or empty for a root rule.
     */
    Optional<InheritanceEdge> resolveEdge(ParsedRule rule, Map<String, ParsedRule> allRules);

    /**
     * Explicit {@code inherit} target that does not resolve to any rule.
     * A rule without an explicit target, or one naming itself, is never an orphan.
     */
    Optional<String> missingParent(ParsedRule rule, Map<String, ParsedRule> allRules);

    /**
     * Walks parent links upward from {@code path}. The walk stops at a root or at the
     * first repeated path, in which case the returned chain is truncated.
     */
    InheritanceChain buildChain(String path, Map<String, ParsedRule> allRules);
}
