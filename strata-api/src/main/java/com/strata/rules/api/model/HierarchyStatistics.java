/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Aggregate numbers for a validated rule set.
 *
 * @param totalRules           size of the rule set
 * @param rulesWithInheritance rules with a resolved parent
 * @param maxDepth             distinct rules in the longest chain (0 for an empty set)
 * @param totalConflicts       conflict entries summed across all rules
 * @param inheritanceTypes     resolved edges per inheritance type
 */
public record HierarchyStatistics(
        @JsonProperty("total_rules") int totalRules,
        @JsonProperty("rules_with_inheritance") int rulesWithInheritance,
        @JsonProperty("max_depth") int maxDepth,
        @JsonProperty("total_conflicts") int totalConflicts,
        @JsonProperty("inheritance_types") Map<InheritanceType, Integer> inheritanceTypes
) {
    public HierarchyStatistics {
        inheritanceTypes = inheritanceTypes == null || inheritanceTypes.isEmpty()
                ? Map.of() : Collections.unmodifiableMap(new EnumMap<>(inheritanceTypes));
    }

    public static HierarchyStatistics empty() {
        return new HierarchyStatistics(0, 0, 0, 0, null);
    }
}
