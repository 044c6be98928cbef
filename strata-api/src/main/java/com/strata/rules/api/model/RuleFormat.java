/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.List;
import java.util.Locale;

/**
 * Document format of a rule, detected from the file extension.
 */
public enum RuleFormat {
    MDC(List.of(".mdc", ".md")),
    MD(List.of(".md", ".mdc")),
    JSON(List.of(".json")),
    YAML(List.of(".yaml", ".yml")),
    TXT(List.of(".txt"));

    private final List<String> familyExtensions;

    RuleFormat(List<String> familyExtensions) {
        this.familyExtensions = familyExtensions;
    }

    /**
     * Extensions that belong to the same document family, preferred one first.
     */
    public List<String> familyExtensions() {
        return familyExtensions;
    }

    public boolean isMarkdown() {
        return this == MDC || this == MD;
    }

    public boolean isStructured() {
        return this == JSON || this == YAML;
    }

    /**
     * Detects the format of a rule path. Unknown or missing extensions map to {@link #TXT}.
     */
    public static RuleFormat fromPath(String path) {
        String ext = RulePaths.extension(path).toLowerCase(Locale.ROOT);
        return switch (ext) {
            case ".mdc" -> MDC;
            case ".md" -> MD;
            case ".json" -> JSON;
            case ".yaml", ".yml" -> YAML;
            default -> TXT;
        };
    }
}
