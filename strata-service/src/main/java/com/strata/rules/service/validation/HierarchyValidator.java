/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.validation;

import com.strata.rules.api.ICompositionEngine;
import com.strata.rules.api.IHierarchyValidator;
import com.strata.rules.api.IInheritanceResolver;
import com.strata.rules.api.model.CompositionConflict;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ConflictSeverity;
import com.strata.rules.api.model.HierarchyStatistics;
import com.strata.rules.api.model.InheritanceEdge;
import com.strata.rules.api.model.InheritanceType;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.ValidationReport;
import com.strata.rules.service.analysis.CycleFinder;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates a whole rule set.
 *
 * <h2>Checks</h2>
 * <ol>
 *   <li>Resolves every rule's parent to build the child to parent edge set.</li>
 *   <li>Cycle detection over the edges (errors).</li>
 *   <li>Orphans: explicit {@code inherit} targets that do not exist (warnings). Rules
 *       without a parent by convention are roots, not orphans.</li>
 *   <li>Composes every rule through the engine (and its cache) to collect conflicts.
 *       Failed compositions are errors; WARNING-level conflicts produce a warning.</li>
 * </ol>
 * The report is valid iff it has no errors. Rules are processed in path order so
 * the report is deterministic.
 */
public class HierarchyValidator implements IHierarchyValidator {

    private static final Logger logger = Logger.getLogger(HierarchyValidator.class.getName());

    private final IInheritanceResolver resolver;
    private final ICompositionEngine engine;

    public HierarchyValidator(IInheritanceResolver resolver, ICompositionEngine engine) {
        this.resolver = resolver;
        this.engine = engine;
    }

    @Override
    public ValidationReport validate(Map<String, ParsedRule> allRules) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<String> orphans = new ArrayList<>();
        Set<String> paths = new TreeSet<>(allRules.keySet());

        // 1. edges and orphans
        Map<String, String> parentOf = new LinkedHashMap<>();
        Map<InheritanceType, Integer> types = new EnumMap<>(InheritanceType.class);
        for (String path : paths) {
            ParsedRule rule = allRules.get(path);
            Optional<InheritanceEdge> edge = resolver.resolveEdge(rule, allRules);
            if (edge.isPresent()) {
                parentOf.put(path, edge.get().parentPath());
                types.merge(edge.get().inheritanceType(), 1, Integer::sum);
            }
            Optional<String> missing = resolver.missingParent(rule, allRules);
            if (missing.isPresent()) {
                orphans.add(path);
                warnings.add(String.format("Missing parent rule for %s: %s", path, missing.get()));
            }
        }

        // 2. cycles
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (String path : paths) {
            String parent = parentOf.get(path);
            edges.put(path, parent == null ? List.of() : List.of(parent));
        }
        List<List<String>> cycles = CycleFinder.findCycles(edges);
        Set<String> inCycle = new HashSet<>();
        for (List<String> cycle : cycles) {
            inCycle.addAll(cycle);
            errors.add("Circular inheritance: " + CycleFinder.describe(cycle));
        }

        // 3. conflicts
        Map<String, List<CompositionConflict>> ruleConflicts = new LinkedHashMap<>();
        int totalConflicts = 0;
        for (String path : paths) {
            CompositionResult result = engine.compose(path, allRules);
            if (!result.success()) {
                errors.add(String.format("Composition failed for %s: %s", path, String.join("; ", result.warnings())));
            }
            if (!result.conflicts().isEmpty()) {
                ruleConflicts.put(path, result.conflicts());
                totalConflicts += result.conflicts().size();
            }
            if (result.hasConflictsOf(ConflictSeverity.WARNING)) {
                warnings.add("Inheritance conflicts in " + path);
            }
        }

        // 4. depth, counted in distinct rules up to the first repeat; cycle members are skipped
        int maxDepth = 0;
        for (String path : paths) {
            if (!inCycle.contains(path)) {
                maxDepth = Math.max(maxDepth, depth(path, parentOf));
            }
        }

        HierarchyStatistics statistics = new HierarchyStatistics(
                allRules.size(), parentOf.size(), maxDepth, totalConflicts, types);
        ValidationReport report = new ValidationReport(errors.isEmpty(), errors, warnings, cycles,
                orphans, ruleConflicts, statistics);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(report.summary());
        }
        return report;
    }

    private static int depth(String path, Map<String, String> parentOf) {
        Set<String> seen = new HashSet<>();
        String current = path;
        while (current != null && seen.add(current)) {
            current = parentOf.get(current);
        }
        return seen.size();
    }
}
