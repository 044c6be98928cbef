/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.analysis;

import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RulePaths;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Directed graph of resolvable references between rules.
 *
 * <p>A reference resolves when it names a rule exactly or relative to the referencing
 * rule's directory ({@code ./} and {@code ../} segments are normalized). References to
 * unknown rules and self references are dropped.
 */
public final class ReferenceGraph {

    private final Map<String, List<String>> edges;

    private ReferenceGraph(Map<String, List<String>> edges) {
        this.edges = edges;
    }

    public static ReferenceGraph build(Map<String, ParsedRule> allRules) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (ParsedRule rule : allRules.values()) {
            Set<String> targets = new LinkedHashSet<>();
            for (String reference : rule.references()) {
                resolve(rule, reference, allRules)
                        .filter(target -> !target.equals(rule.path()))
                        .ifPresent(targets::add);
            }
            edges.put(rule.path(), List.copyOf(targets));
        }
        return new ReferenceGraph(edges);
    }

    public Map<String, List<String>> edges() {
        return edges;
    }

    public List<String> dependenciesOf(String path) {
        return edges.getOrDefault(path, List.of());
    }

    static Optional<String> resolve(ParsedRule rule, String reference, Map<String, ParsedRule> allRules) {
        String exact = normalize(reference);
        if (allRules.containsKey(exact)) {
            return Optional.of(exact);
        }
        String relative = normalize(RulePaths.join(rule.directory(), reference));
        return allRules.containsKey(relative) ? Optional.of(relative) : Optional.empty();
    }

    static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (!segments.isEmpty()) {
                    segments.removeLast();
                }
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }
}
