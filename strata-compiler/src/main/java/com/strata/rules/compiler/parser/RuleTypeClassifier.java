/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import com.strata.rules.api.model.RuleType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Infers a rule type from keywords in its path. First matching keyword group wins.
 */
final class RuleTypeClassifier {

    private static final Map<RuleType, List<String>> PATH_KEYWORDS = new LinkedHashMap<>();

    static {
        PATH_KEYWORDS.put(RuleType.CORE, List.of("core", "essential"));
        PATH_KEYWORDS.put(RuleType.WORKFLOW, List.of("workflow"));
        PATH_KEYWORDS.put(RuleType.AGENT, List.of("agent"));
        PATH_KEYWORDS.put(RuleType.PROJECT, List.of("project"));
        PATH_KEYWORDS.put(RuleType.CONTEXT, List.of("context"));
    }

    private RuleTypeClassifier() {
    }

    static RuleType infer(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (Map.Entry<RuleType, List<String>> entry : PATH_KEYWORDS.entrySet()) {
            for (String keyword : entry.getValue()) {
                if (lower.contains(keyword)) {
                    return entry.getKey();
                }
            }
        }
        return RuleType.GENERAL;
    }
}
