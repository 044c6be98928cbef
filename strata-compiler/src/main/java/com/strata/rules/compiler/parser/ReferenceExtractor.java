/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts references to other rules from document text.
 *
 * <p>Recognized forms:
 * <ul>
 *   <li>{@code [label](target)} and {@code [label](mdc:target)} links</li>
 *   <li>{@code @import "target"}</li>
 *   <li>{@code include: target}</li>
 *   <li>{@code depends_on: [a, b]}</li>
 * </ul>
 * External links ({@code http}, {@code mailto}) and pure anchors are skipped.
 */
final class ReferenceExtractor {

    private static final Pattern LINK = Pattern.compile("\\[[^\\]]*\\]\\(([^)\\s]+)(?:\\s+\"[^\"]*\")?\\)");
    private static final Pattern IMPORT = Pattern.compile("@import\\s+\"([^\"]+)\"");
    private static final Pattern INCLUDE = Pattern.compile("include:[ \\t]*([^\\n]+)");
    private static final Pattern DEPENDS_ON = Pattern.compile("depends_on:[ \\t]*\\[([^\\]]+)\\]");

    private static final String MDC_PREFIX = "mdc:";

    private ReferenceExtractor() {
    }

    static List<String> extract(String text, List<String> declaredDependencies) {
        Set<String> refs = new LinkedHashSet<>();

        Matcher link = LINK.matcher(text);
        while (link.find()) {
            addLinkTarget(link.group(1), refs);
        }
        Matcher imports = IMPORT.matcher(text);
        while (imports.find()) {
            add(imports.group(1), refs);
        }
        Matcher include = INCLUDE.matcher(text);
        while (include.find()) {
            add(include.group(1), refs);
        }
        Matcher dependsOn = DEPENDS_ON.matcher(text);
        while (dependsOn.find()) {
            for (String dep : dependsOn.group(1).split(",")) {
                add(dep, refs);
            }
        }
        declaredDependencies.forEach(dep -> add(dep, refs));
        return List.copyOf(refs);
    }

    private static void addLinkTarget(String target, Set<String> refs) {
        String lower = target.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")
                || lower.startsWith("mailto:") || target.startsWith("#")) {
            return;
        }
        if (target.startsWith(MDC_PREFIX)) {
            target = target.substring(MDC_PREFIX.length());
        }
        int anchor = target.indexOf('#');
        if (anchor >= 0) {
            target = target.substring(0, anchor);
        }
        add(target, refs);
    }

    private static void add(String raw, Set<String> refs) {
        String ref = unquote(raw.trim());
        if (!ref.isEmpty()) {
            refs.add(ref);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' || first == '\'') && first == last) {
                return value.substring(1, value.length() - 1).trim();
            }
        }
        return value;
    }
}
