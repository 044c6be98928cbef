/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.composition;

import com.strata.rules.api.model.InheritanceChain;
import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.infra.hash.ContentHasher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cache keys for compositions: {@code <rulePath>|<sha256 of the chain's content>}.
 *
 * <p>The hash covers everything the fold reads from each chain link: path, rule type,
 * sections, metadata and variable keys. Editing any ancestor therefore changes the
 * key whether or not the rule carries a checksum of its source text.
 */
final class ChainFingerprint {

    private static final char SEPARATOR = '|';

    private ChainFingerprint() {
    }

    static String cacheKey(String rulePath, InheritanceChain chain, Map<String, ParsedRule> allRules) {
        List<String> parts = new ArrayList<>();
        for (String path : chain.paths()) {
            parts.add(path);
            ParsedRule rule = allRules.get(path);
            if (rule == null) {
                parts.add("-");
                continue;
            }
            parts.add(rule.ruleType().name());

            parts.add(Integer.toString(rule.sections().size()));
            rule.sections().forEach((name, text) -> {
                parts.add(name);
                parts.add(text);
            });

            parts.add(Integer.toString(rule.metadata().size()));
            rule.metadata().forEach((key, value) -> {
                parts.add(key);
                addValue(value, parts);
            });

            parts.add(Integer.toString(rule.variableKeys().size()));
            parts.addAll(rule.variableKeys());
        }
        return rulePath + SEPARATOR + ContentHasher.sha256(parts);
    }

    private static void addValue(MetadataValue value, List<String> parts) {
        parts.add(value.getClass().getSimpleName());
        if (value instanceof MetadataValue.ListValue list) {
            parts.add(Integer.toString(list.values().size()));
            parts.addAll(list.values());
        } else {
            parts.add(value.asText());
        }
    }
}
