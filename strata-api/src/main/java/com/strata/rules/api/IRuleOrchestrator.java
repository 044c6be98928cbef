/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api;

import com.strata.rules.api.exceptions.RuleSourceException;
import com.strata.rules.api.model.CacheStatus;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.HierarchyInfo;
import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;

import java.util.List;
import java.util.Map;

/**
 * Entry point used by host layers. All operations are in-process and synchronous;
 * the rule set passed in is treated as an immutable snapshot.
 */
public interface IRuleOrchestrator {

    /**
     * Parses raw documents. Individual malformed documents never abort the batch.
     */
    Map<String, ParsedRule> loadHierarchy(Map<String, String> rawDocuments);

    /**
     * Loads documents through a rule source and parses them.
     *
     * @throws RuleSourceException if the source is unavailable
     */
    Map<String, ParsedRule> loadHierarchy(RuleSource source);

    CompositionResult composeRule(String path, Map<String, ParsedRule> allRules);

    /**
     * Composes a rule and renders it in the rule's own format.
     */
    String composeRuleContent(String path, Map<String, ParsedRule> allRules);

    InheritanceChain resolveInheritanceChain(String path, Map<String, ParsedRule> allRules);

    ValidationReport validateHierarchy(Map<String, ParsedRule> allRules);

    /**
     * Rules referenced by {@code path}, transitively, dependencies first and the rule last.
     */
    List<String> resolveDependencies(String path, Map<String, ParsedRule> allRules);

    HierarchyInfo hierarchyInfo(Map<String, ParsedRule> allRules);

    CacheStatus cacheStatus();

    void invalidate(String path);

    void clearCache();
}
