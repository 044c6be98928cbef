/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.resolution;

import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RulePaths;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Looks for well-known parent file names, first in the rule's own directory and then
 * in each enclosing directory up to the root.
 *
 * <p>Within the rule's own directory only stems ranked strictly before the rule's own
 * stem qualify, so {@code base.mdc} may inherit from {@code index.mdc} but
 * {@code index.mdc} never inherits from a sibling. Ordinary rules accept every stem.
 * For each stem the rule's own extension is tried first, then the other extensions of
 * its format family.
 *
 * <p>Example for {@code agents/coder/review.mdc} with the default stems:
 * <pre>
 * agents/coder/index.mdc, agents/coder/index.md, agents/coder/base.mdc, ...
 * agents/index.mdc, ...
 * index.mdc, ...
 * </pre>
 */
public final class ConventionParentNamingStrategy implements ParentNamingStrategy {

    public static final List<String> DEFAULT_STEMS = List.of("index", "base", "parent", "_base");

    private final List<String> stems;

    public ConventionParentNamingStrategy() {
        this(DEFAULT_STEMS);
    }

    /**
     * @param stems parent file stems in priority order
     */
    public ConventionParentNamingStrategy(List<String> stems) {
        Objects.requireNonNull(stems, "stems");
        if (stems.isEmpty()) {
            throw new IllegalArgumentException("At least one parent stem is required");
        }
        this.stems = List.copyOf(stems);
    }

    public List<String> stems() {
        return stems;
    }

    @Override
    public List<String> candidates(ParsedRule rule) {
        String path = rule.path();
        List<String> extensions = extensionsFor(rule);
        String ownStem = RulePaths.stem(path);
        int ownRank = stems.indexOf(ownStem);

        Set<String> candidates = new LinkedHashSet<>();
        boolean ownDirectory = true;
        for (String dir : RulePaths.ancestorDirectories(path)) {
            List<String> eligible = ownDirectory && ownRank >= 0 ? stems.subList(0, ownRank) : stems;
            for (String stem : eligible) {
                for (String ext : extensions) {
                    candidates.add(RulePaths.join(dir, stem + ext));
                }
            }
            ownDirectory = false;
        }
        candidates.remove(path);
        return new ArrayList<>(candidates);
    }

    private static List<String> extensionsFor(ParsedRule rule) {
        Set<String> extensions = new LinkedHashSet<>();
        extensions.add(RulePaths.extension(rule.path()));
        extensions.addAll(rule.format().familyExtensions());
        return new ArrayList<>(extensions);
    }
}
