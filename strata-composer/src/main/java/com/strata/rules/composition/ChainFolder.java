/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.composition;

import com.strata.rules.api.IInheritanceResolver;
import com.strata.rules.api.model.CompositionConflict;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.ConflictKind;
import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.InheritanceType;
import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Folds an acyclic inheritance chain root-to-leaf into a composed result.
 *
 * <p>The root's own sections and metadata seed the accumulator. Each following link
 * takes from the accumulator what its inheritance type allows, then applies the
 * child's own content on top:
 * <pre>
 *   type        sections from parent        metadata from parent
 *   FULL        all                         all
 *   CONTENT     all                         none
 *   METADATA    none                        all
 *   VARIABLES   none                        variable-flagged keys only
 *   SELECTIVE   listed in inherit_sections  none
 * </pre>
 * Directive keys are never taken from a parent. A child value that replaces a different
 * parent value is a conflict unless the child lists the name under {@code override}.
 */
final class ChainFolder {

    static final String OVERRIDE_RESOLUTION = "child override applied";

    private final IInheritanceResolver resolver;

    ChainFolder(IInheritanceResolver resolver) {
        this.resolver = resolver;
    }

    CompositionResult fold(InheritanceChain chain, Map<String, ParsedRule> allRules) {
        List<String> paths = chain.paths();
        ParsedRule root = allRules.get(paths.get(0));

        Map<String, String> sections = new LinkedHashMap<>(root.sections());
        Map<String, MetadataValue> metadata = new LinkedHashMap<>(root.metadata());
        Set<String> variables = new LinkedHashSet<>(root.variableKeys());

        List<CompositionConflict> conflicts = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Map<String, InheritanceType> types = new LinkedHashMap<>();

        for (int i = 1; i < paths.size(); i++) {
            ParsedRule parent = allRules.get(paths.get(i - 1));
            ParsedRule child = allRules.get(paths.get(i));
            InheritanceType type = resolver.inferInheritanceType(child, parent);
            types.put(child.path(), type);

            if (parent.ruleType() != child.ruleType()) {
                conflicts.add(CompositionConflict.of(ParsedRule.KEY_TYPE, parent.path(), child.path(),
                        ConflictKind.TYPE_MISMATCH,
                        String.format("child type %s kept over parent type %s", child.ruleType(), parent.ruleType())));
            }

            Set<String> overrides = new HashSet<>(child.metadataList(ParsedRule.KEY_OVERRIDE));

            Map<String, String> nextSections = inheritedSections(type, sections, child, parent, warnings);
            for (Map.Entry<String, String> own : child.sections().entrySet()) {
                String previous = nextSections.get(own.getKey());
                if (previous != null && !previous.equals(own.getValue()) && !overrides.contains(own.getKey())) {
                    conflicts.add(CompositionConflict.of(own.getKey(), parent.path(), child.path(),
                            ConflictKind.SECTION_OVERRIDE, OVERRIDE_RESOLUTION));
                }
                nextSections.put(own.getKey(), own.getValue());
            }

            Map<String, MetadataValue> nextMetadata = inheritedMetadata(type, metadata, variables);
            Set<String> nextVariables = new LinkedHashSet<>();
            for (String key : nextMetadata.keySet()) {
                if (variables.contains(key)) {
                    nextVariables.add(key);
                }
            }
            for (Map.Entry<String, MetadataValue> own : child.metadata().entrySet()) {
                MetadataValue previous = nextMetadata.get(own.getKey());
                if (previous != null && !previous.equals(own.getValue()) && !overrides.contains(own.getKey())) {
                    conflicts.add(CompositionConflict.of(own.getKey(), parent.path(), child.path(),
                            ConflictKind.VARIABLE_CONFLICT, OVERRIDE_RESOLUTION));
                }
                nextMetadata.put(own.getKey(), own.getValue());
            }
            nextVariables.addAll(child.variableKeys());

            sections = nextSections;
            metadata = nextMetadata;
            variables = nextVariables;
        }

        return new CompositionResult(chain.leaf(), true, sections, metadata, conflicts, warnings, paths, types);
    }

    private static Map<String, String> inheritedSections(InheritanceType type, Map<String, String> accumulated,
                                                         ParsedRule child, ParsedRule parent, List<String> warnings) {
        switch (type) {
            case FULL:
            case CONTENT:
                return new LinkedHashMap<>(accumulated);
            case SELECTIVE:
                Map<String, String> selected = new LinkedHashMap<>();
                for (String name : child.metadataList(ParsedRule.KEY_INHERIT_SECTIONS)) {
                    String text = accumulated.get(name);
                    if (text == null) {
                        warnings.add(String.format("Section '%s' selected by %s is not provided by %s",
                                name, child.path(), parent.path()));
                    } else {
                        selected.put(name, text);
                    }
                }
                return selected;
            default:
                return new LinkedHashMap<>();
        }
    }

    private static Map<String, MetadataValue> inheritedMetadata(InheritanceType type,
                                                                Map<String, MetadataValue> accumulated,
                                                                Set<String> variables) {
        Map<String, MetadataValue> inherited = new LinkedHashMap<>();
        if (type != InheritanceType.FULL && type != InheritanceType.METADATA && type != InheritanceType.VARIABLES) {
            return inherited;
        }
        for (Map.Entry<String, MetadataValue> entry : accumulated.entrySet()) {
            String key = entry.getKey();
            if (ParsedRule.isDirective(key)) {
                continue;
            }
            if (type == InheritanceType.VARIABLES && !variables.contains(key)) {
                continue;
            }
            inherited.put(key, entry.getValue());
        }
        return inherited;
    }
}
