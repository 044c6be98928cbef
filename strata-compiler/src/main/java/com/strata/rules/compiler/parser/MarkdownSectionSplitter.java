/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import com.strata.rules.api.model.ParsedRule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a Markdown body into named sections at ATX headings.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code #} to {@code ######} followed by whitespace or end of line starts a section</li>
 *   <li>Section names are the heading text lower-cased, whitespace runs replaced by {@code _}</li>
 *   <li>Text before the first heading becomes the {@code content} section when non-blank</li>
 *   <li>Headings inside fenced code blocks are ordinary text</li>
 *   <li>A repeated heading appends to the existing section</li>
 * </ul>
 */
final class MarkdownSectionSplitter {

    private static final Pattern HEADING = Pattern.compile("^ {0,3}(#{1,6})(?:[ \\t]+(.*?))?[ \\t]*$");
    private static final Pattern CLOSING_HASHES = Pattern.compile("[ \\t]+#+$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,})");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private MarkdownSectionSplitter() {
    }

    static Map<String, String> split(String body) {
        Map<String, String> sections = new LinkedHashMap<>();
        String currentName = null;
        List<String> buffer = new ArrayList<>();
        String openFence = null;
        boolean sawHeading = false;

        for (String line : body.split("\n", -1)) {
            Matcher fence = FENCE.matcher(line);
            if (openFence == null && fence.find()) {
                openFence = fence.group(1);
            } else if (openFence != null && fence.find() && closesFence(openFence, fence.group(1))) {
                openFence = null;
            } else if (openFence == null) {
                String name = headingName(line);
                if (name != null) {
                    flush(sections, currentName, buffer, true);
                    currentName = name;
                    sawHeading = true;
                    buffer.clear();
                    continue;
                }
            }
            buffer.add(line);
        }
        flush(sections, currentName, buffer, sawHeading);
        return sections;
    }

    /**
     * Normalized section name for a heading line, or null when the line is not a heading.
     */
    static String headingName(String line) {
        Matcher m = HEADING.matcher(line);
        if (!m.matches() || m.group(2) == null) {
            return null;
        }
        String text = CLOSING_HASHES.matcher(m.group(2)).replaceFirst("").trim();
        if (text.isEmpty() || text.chars().allMatch(c -> c == '#')) {
            return null;
        }
        return normalize(text);
    }

    static String normalize(String headingText) {
        return WHITESPACE.matcher(headingText.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    private static boolean closesFence(String open, String candidate) {
        return candidate.charAt(0) == open.charAt(0) && candidate.length() >= open.length();
    }

    private static void flush(Map<String, String> sections, String name, List<String> lines, boolean hasHeadings) {
        String text = String.join("\n", lines).strip();
        if (name == null) {
            // implicit section: always present for heading-less documents, otherwise only when non-blank
            if (hasHeadings && text.isEmpty()) {
                return;
            }
            name = ParsedRule.CONTENT_SECTION;
        }
        sections.merge(name, text, MarkdownSectionSplitter::append);
    }

    private static String append(String existing, String addition) {
        if (existing.isEmpty()) return addition;
        if (addition.isEmpty()) return existing;
        return existing + "\n\n" + addition;
    }
}
