/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.analysis;

import com.strata.rules.api.model.ParsedRule;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Orders the transitive references of a rule so that every dependency comes before
 * the rules that reference it, ending with the rule itself.
 *
 * <p>On a reference cycle the order is meaningless; the resolver logs a warning and
 * returns just the requested rule.
 */
public class DependencyResolver {

    private static final Logger logger = Logger.getLogger(DependencyResolver.class.getName());

    public List<String> resolve(String path, Map<String, ParsedRule> allRules) {
        if (!allRules.containsKey(path)) {
            if (logger.isLoggable(Level.FINE)) {
                logger.fine("No dependencies for unknown rule " + path);
            }
            return List.of();
        }

        ReferenceGraph graph = ReferenceGraph.build(allRules);
        Set<String> ordered = new LinkedHashSet<>();
        Set<String> visiting = new HashSet<>();
        Deque<String> pathStack = new ArrayDeque<>();
        Deque<Iterator<String>> iterators = new ArrayDeque<>();

        visiting.add(path);
        pathStack.push(path);
        iterators.push(graph.dependenciesOf(path).iterator());

        while (!iterators.isEmpty()) {
            Iterator<String> it = iterators.peek();
            if (it.hasNext()) {
                String dependency = it.next();
                if (visiting.contains(dependency)) {
                    logger.warning(String.format("Circular reference while resolving dependencies of %s: %s -> %s",
                            path, pathStack.peek(), dependency));
                    return List.of(path);
                }
                if (!ordered.contains(dependency)) {
                    visiting.add(dependency);
                    pathStack.push(dependency);
                    iterators.push(graph.dependenciesOf(dependency).iterator());
                }
            } else {
                iterators.pop();
                String done = pathStack.pop();
                visiting.remove(done);
                ordered.add(done);
            }
        }
        return new ArrayList<>(ordered);
    }
}
