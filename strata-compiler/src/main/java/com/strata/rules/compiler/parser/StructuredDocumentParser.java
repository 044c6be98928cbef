/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.rules.api.model.ParsedRule;

import java.util.Iterator;
import java.util.Map;

/**
 * Reads JSON and YAML rule documents. The root must be a mapping:
 * <pre>
 * {
 *   "metadata":  { "inherit": "base.json", "type": "agent" },
 *   "variables": { "team": "core" },
 *   "sections":  { "intro": "...", "steps": ["a", "b"] },
 *   "priority":  3
 * }
 * </pre>
 * Other scalar or list keys become metadata; other mapping keys become sections
 * holding their JSON text.
 */
final class StructuredDocumentParser {

    private static final String KEY_SECTIONS = "sections";
    private static final String KEY_METADATA = "metadata";

    private final ObjectMapper mapper;
    private final MetadataConverter converter;

    StructuredDocumentParser(ObjectMapper mapper, MetadataConverter converter) {
        this.mapper = mapper;
        this.converter = converter;
    }

    void parse(String text, Map<String, String> sections, MetadataConverter.Metadata metadata) {
        JsonNode root;
        try {
            root = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RuleParseException("Invalid document: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return;
        }
        if (!root.isObject()) {
            throw new RuleParseException("Document root must be a mapping, found " + root.getNodeType());
        }

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (KEY_SECTIONS.equals(key) && value.isObject()) {
                value.fields().forEachRemaining(section ->
                        sections.put(section.getKey(), converter.toText(section.getValue())));
            } else if (KEY_METADATA.equals(key) && value.isObject()) {
                converter.addMapping(value, metadata);
            } else if (ParsedRule.KEY_VARIABLES.equals(key) && value.isObject()) {
                converter.addVariables(value, metadata);
            } else if (value.isObject()) {
                sections.put(key, converter.toText(value));
            } else {
                metadata.put(key, converter.toValue(value));
            }
        }
    }
}
