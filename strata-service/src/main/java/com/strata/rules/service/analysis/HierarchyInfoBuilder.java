/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.analysis;

import com.strata.rules.api.IInheritanceResolver;
import com.strata.rules.api.model.HierarchyInfo;
import com.strata.rules.api.model.InheritanceType;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RulePaths;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Summarizes the shape of a rule set: directory layout, references and inheritance.
 */
public class HierarchyInfoBuilder {

    private final IInheritanceResolver resolver;

    public HierarchyInfoBuilder(IInheritanceResolver resolver) {
        this.resolver = resolver;
    }

    public HierarchyInfo build(Map<String, ParsedRule> allRules) {
        Set<String> directories = new HashSet<>();
        int maxDirectoryDepth = 0;
        Map<InheritanceType, Integer> types = new EnumMap<>(InheritanceType.class);
        int relationships = 0;

        for (ParsedRule rule : allRules.values()) {
            for (String dir : RulePaths.ancestorDirectories(rule.path())) {
                if (!dir.isEmpty()) {
                    directories.add(dir);
                }
            }
            maxDirectoryDepth = Math.max(maxDirectoryDepth, RulePaths.directoryDepth(rule.path()));

            var edge = resolver.resolveEdge(rule, allRules);
            if (edge.isPresent()) {
                relationships++;
                types.merge(edge.get().inheritanceType(), 1, Integer::sum);
            }
        }

        ReferenceGraph references = ReferenceGraph.build(allRules);
        return new HierarchyInfo(
                allRules.size(),
                directories.size(),
                (int) references.edges().values().stream().filter(targets -> !targets.isEmpty()).count(),
                relationships,
                maxDirectoryDepth,
                CycleFinder.findCycles(references.edges()),
                types);
    }
}
