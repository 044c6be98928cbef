/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of validating a whole rule set. {@code valid} is true iff there are no
 * errors; warnings never invalidate a hierarchy.
 */
public record ValidationReport(
        @JsonProperty("valid") boolean valid,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("warnings") List<String> warnings,
        @JsonProperty("circular_dependencies") List<List<String>> circularDependencies,
        @JsonProperty("orphaned_rules") List<String> orphanedRules,
        @JsonProperty("rule_conflicts") Map<String, List<CompositionConflict>> ruleConflicts,
        @JsonProperty("statistics") HierarchyStatistics statistics
) {
    public ValidationReport {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        circularDependencies = circularDependencies == null
                ? List.of() : circularDependencies.stream().map(List::copyOf).toList();
        orphanedRules = orphanedRules == null ? List.of() : List.copyOf(orphanedRules);
        ruleConflicts = ruleConflicts == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ruleConflicts));
        if (statistics == null) statistics = HierarchyStatistics.empty();
    }

    public String summary() {
        return String.format(
                "Validation: valid=%s, errors=%d, warnings=%d, cycles=%d, orphans=%d, rules=%d, conflicts=%d",
                valid, errors.size(), warnings.size(), circularDependencies.size(),
                orphanedRules.size(), statistics.totalRules(), statistics.totalConflicts());
    }
}
