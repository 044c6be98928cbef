/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One parsed rule document. Immutable; re-parsing a source produces a new instance
 * that replaces the old one under the same path.
 *
 * @param path          unique slash-delimited logical path
 * @param ruleType      declared or inferred rule type
 * @param typeDeclared  whether {@code ruleType} came from the {@code type} metadata key
 * @param format        document format detected from the extension
 * @param sections      section name to text, in document order
 * @param metadata      metadata key to typed value, in document order
 * @param variableKeys  metadata keys flagged as variables
 * @param references    referenced rule paths, first-seen order
 * @param rawContent    original text
 * @param checksum      SHA-256 hex of the raw content
 * @param parseWarnings non-fatal problems found while parsing
 */
public record ParsedRule(
        String path,
        RuleType ruleType,
        boolean typeDeclared,
        RuleFormat format,
        Map<String, String> sections,
        Map<String, MetadataValue> metadata,
        Set<String> variableKeys,
        List<String> references,
        String rawContent,
        String checksum,
        List<String> parseWarnings
) {

    public static final String KEY_INHERIT = "inherit";
    public static final String KEY_TYPE = "type";
    public static final String KEY_PRIORITY = "priority";
    public static final String KEY_INHERIT_MODE = "inherit_mode";
    public static final String KEY_INHERIT_SECTIONS = "inherit_sections";
    public static final String KEY_OVERRIDE = "override";
    public static final String KEY_VARIABLES = "variables";

    /**
     * Keys that steer inheritance for the rule that declares them. They are never
     * inherited by children.
     */
    public static final Set<String> DIRECTIVE_KEYS = Set.of(
            KEY_INHERIT, KEY_INHERIT_MODE, KEY_INHERIT_SECTIONS, KEY_OVERRIDE, KEY_TYPE);

    /**
     * Implicit section holding text that precedes any heading.
     */
    public static final String CONTENT_SECTION = "content";

    public ParsedRule {
        Objects.requireNonNull(path, "path");
        if (ruleType == null) ruleType = RuleType.GENERAL;
        if (format == null) format = RuleFormat.fromPath(path);
        sections = sections == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sections));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        variableKeys = variableKeys == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(variableKeys));
        references = references == null ? List.of() : List.copyOf(references);
        if (rawContent == null) rawContent = "";
        if (checksum == null) checksum = "";
        parseWarnings = parseWarnings == null ? List.of() : List.copyOf(parseWarnings);
    }

    public Optional<MetadataValue> metadataValue(String key) {
        return Optional.ofNullable(metadata.get(key));
    }

    /**
     * Text form of a scalar metadata value. Blank values are treated as absent.
     */
    public Optional<String> metadataText(String key) {
        MetadataValue value = metadata.get(key);
        if (value == null || value instanceof MetadataValue.ListValue) {
            return Optional.empty();
        }
        String text = value.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    /**
     * List form of a metadata value. A scalar is read as a comma-separated list.
     */
    public List<String> metadataList(String key) {
        MetadataValue value = metadata.get(key);
        if (value == null) {
            return List.of();
        }
        if (value instanceof MetadataValue.ListValue list) {
            return list.values();
        }
        return Arrays.stream(value.asText().split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }

    public static boolean isDirective(String key) {
        return DIRECTIVE_KEYS.contains(key);
    }

    public boolean isVariable(String key) {
        return variableKeys.contains(key);
    }

    public String directory() {
        return RulePaths.directory(path);
    }
}
