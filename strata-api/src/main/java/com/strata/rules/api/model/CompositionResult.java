/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of merging a rule with its ancestors. Immutable once returned; two
 * results with the same content are equal whether or not they came from the cache.
 *
 * @param rulePath         the composed rule
 * @param success          false only for structural failures (cycle, unknown rule)
 * @param composedSections final merged sections, in fold order
 * @param composedMetadata final merged metadata
 * @param conflicts        conflicts in the order they were detected
 * @param warnings         human-readable non-fatal issues
 * @param sourceRules      the inheritance chain, root first
 * @param inheritanceTypes inheritance type applied at each non-root chain link, keyed by child path
 */
public record CompositionResult(
        String rulePath,
        boolean success,
        Map<String, String> composedSections,
        Map<String, MetadataValue> composedMetadata,
        List<CompositionConflict> conflicts,
        List<String> warnings,
        List<String> sourceRules,
        Map<String, InheritanceType> inheritanceTypes
) {
    public CompositionResult {
        Objects.requireNonNull(rulePath, "rulePath");
        composedSections = composedSections == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(composedSections));
        composedMetadata = composedMetadata == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(composedMetadata));
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        sourceRules = sourceRules == null ? List.of() : List.copyOf(sourceRules);
        inheritanceTypes = inheritanceTypes == null
                ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inheritanceTypes));
    }

    /**
     * Result for a path that is not part of the rule set.
     */
    public static CompositionResult notFound(String rulePath) {
        return new CompositionResult(rulePath, false, null, null, null,
                List.of("Rule not found: " + rulePath), null, null);
    }

    /**
     * Fatal result carrying no composed content.
     */
    public static CompositionResult failure(String rulePath, List<CompositionConflict> conflicts,
                                            List<String> warnings, List<String> sourceRules) {
        return new CompositionResult(rulePath, false, null, null, conflicts, warnings, sourceRules, null);
    }

    public boolean hasErrors() {
        return conflicts.stream().anyMatch(CompositionConflict::isError);
    }

    public boolean hasConflictsOf(ConflictSeverity severity) {
        return conflicts.stream().anyMatch(c -> c.severity() == severity);
    }

    /**
     * Copy with extra warnings appended.
     */
    public CompositionResult withWarnings(List<String> extraWarnings) {
        if (extraWarnings.isEmpty()) {
            return this;
        }
        List<String> merged = new ArrayList<>(warnings);
        merged.addAll(extraWarnings);
        return new CompositionResult(rulePath, success, composedSections, composedMetadata,
                conflicts, merged, sourceRules, inheritanceTypes);
    }
}
