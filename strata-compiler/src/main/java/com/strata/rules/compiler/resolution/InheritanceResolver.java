/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.resolution;

import com.strata.rules.api.IInheritanceResolver;
import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.InheritanceEdge;
import com.strata.rules.api.model.InheritanceType;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RulePaths;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Resolves parent links between rules.
 *
 * <p>Resolution order, first match wins:
 * <ol>
 *   <li>Explicit {@code inherit} metadata, matched as an exact path and then relative to
 *       the rule's directory. An explicit target that does not exist leaves the rule
 *       without a parent (an orphan); it never falls through to the convention.</li>
 *   <li>The configured {@link ParentNamingStrategy}.</li>
 *   <li>No parent: the rule is a root.</li>
 * </ol>
 * A rule naming itself as parent is treated as a root.
 *
 * <p>Stateless and thread-safe.
 */
public class InheritanceResolver implements IInheritanceResolver {

    private static final Logger logger = Logger.getLogger(InheritanceResolver.class.getName());

    private final ParentNamingStrategy namingStrategy;

    public InheritanceResolver() {
        this(new ConventionParentNamingStrategy());
    }

    public InheritanceResolver(ParentNamingStrategy namingStrategy) {
        this.namingStrategy = Objects.requireNonNull(namingStrategy, "namingStrategy");
    }

    @Override
    public Optional<String> resolveParent(ParsedRule rule, Map<String, ParsedRule> allRules) {
        Optional<String> declared = rule.metadataText(ParsedRule.KEY_INHERIT);
        if (declared.isPresent()) {
            Optional<String> target = explicitTargets(rule, declared.get()).stream()
                    .filter(allRules::containsKey)
                    .findFirst();
            if (target.isPresent() && target.get().equals(rule.path())) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Ignoring self-referencing inherit in " + rule.path());
                }
                return Optional.empty();
            }
            return target;
        }

        for (String candidate : namingStrategy.candidates(rule)) {
            if (!candidate.equals(rule.path()) && allRules.containsKey(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * {@code inherit_mode} wins when present (unknown modes mean FULL); otherwise a
     * non-empty {@code inherit_sections} list selects SELECTIVE; otherwise FULL.
     * The parent does not influence the policy.
     */
    @Override
    public InheritanceType inferInheritanceType(ParsedRule rule, ParsedRule parent) {
        Optional<String> mode = rule.metadataText(ParsedRule.KEY_INHERIT_MODE);
        if (mode.isPresent()) {
            Optional<InheritanceType> type = InheritanceType.fromMode(mode.get());
            if (type.isEmpty() && logger.isLoggable(Level.FINE)) {
                logger.fine(String.format("Unknown inherit_mode '%s' in %s, using FULL", mode.get(), rule.path()));
            }
            return type.orElse(InheritanceType.FULL);
        }
        if (!rule.metadataList(ParsedRule.KEY_INHERIT_SECTIONS).isEmpty()) {
            return InheritanceType.SELECTIVE;
        }
        return InheritanceType.FULL;
    }

    @Override
    public Optional<InheritanceEdge> resolveEdge(ParsedRule rule, Map<String, ParsedRule> allRules) {
        return resolveParent(rule, allRules)
                .map(parent -> new InheritanceEdge(rule.path(), parent,
                        inferInheritanceType(rule, allRules.get(parent))));
    }

    @Override
    public Optional<String> missingParent(ParsedRule rule, Map<String, ParsedRule> allRules) {
        Optional<String> declared = rule.metadataText(ParsedRule.KEY_INHERIT);
        if (declared.isEmpty()) {
            return Optional.empty();
        }
        List<String> targets = explicitTargets(rule, declared.get());
        boolean resolves = targets.contains(rule.path()) || targets.stream().anyMatch(allRules::containsKey);
        return resolves ? Optional.empty() : declared;
    }

    @Override
    public InheritanceChain buildChain(String path, Map<String, ParsedRule> allRules) {
        List<String> upward = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        String current = path;

        while (current != null) {
            upward.add(current);
            if (!seen.add(current)) {
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine(String.format("Cycle at %s while building chain for %s", current, path));
                }
                break;
            }
            ParsedRule rule = allRules.get(current);
            current = rule == null ? null : resolveParent(rule, allRules).orElse(null);
        }

        Collections.reverse(upward);
        return new InheritanceChain(upward);
    }

    private static List<String> explicitTargets(ParsedRule rule, String declared) {
        String relative = RulePaths.join(rule.directory(), declared);
        return relative.equals(declared) ? List.of(declared) : List.of(declared, relative);
    }
}
