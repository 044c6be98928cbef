/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered paths from the root ancestor to the queried rule, inclusive.
 *
 * <p>When the upward walk runs into a cycle the chain is cut at the first repeated
 * path, which then appears twice: once where the walk met it first and once at the
 * root end. {@link #isTruncated()} reports that case.
 */
public record InheritanceChain(List<String> paths) {

    public InheritanceChain {
        paths = List.copyOf(paths);
        if (paths.isEmpty()) {
            throw new IllegalArgumentException("Inheritance chain must contain at least one path");
        }
    }

    public static InheritanceChain of(String... paths) {
        return new InheritanceChain(List.of(paths));
    }

    public String root() {
        return paths.get(0);
    }

    /**
     * The queried rule.
     */
    public String leaf() {
        return paths.get(paths.size() - 1);
    }

    public int size() {
        return paths.size();
    }

    public boolean isTruncated() {
        return repeatedPath().isPresent();
    }

    public Optional<String> repeatedPath() {
        Set<String> seen = new HashSet<>();
        for (String path : paths) {
            if (!seen.add(path)) {
                return Optional.of(path);
            }
        }
        return Optional.empty();
    }

    /**
     * Number of distinct rules in the chain.
     */
    public int depth() {
        return new LinkedHashSet<>(paths).size();
    }

    public boolean contains(String path) {
        return paths.contains(path);
    }
}
