/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts Jackson trees (from JSON documents or YAML front matter) into typed metadata.
 *
 * <p>Scalars become text or number values, booleans and nulls become text, sequences
 * become lists of strings. Nested mappings are flattened with dotted keys, except a
 * {@code variables} mapping whose entries are added as variable-flagged keys.
 */
final class MetadataConverter {

    private final ObjectMapper jsonMapper;

    MetadataConverter(ObjectMapper jsonMapper) {
        this.jsonMapper = jsonMapper;
    }

    /**
     * Accumulates metadata in document order.
     */
    static final class Metadata {
        final Map<String, MetadataValue> values = new LinkedHashMap<>();
        final Set<String> variableKeys = new LinkedHashSet<>();

        void put(String key, MetadataValue value) {
            values.put(key, value);
        }

        void putVariable(String key, MetadataValue value) {
            values.put(key, value);
            variableKeys.add(key);
        }
    }

    /**
     * Adds every field of a mapping node to {@code out}.
     */
    void addMapping(JsonNode mapping, Metadata out) {
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (ParsedRule.KEY_VARIABLES.equals(field.getKey()) && field.getValue().isObject()) {
                addVariables(field.getValue(), out);
            } else {
                addValue(field.getKey(), field.getValue(), out, false);
            }
        }
    }

    void addVariables(JsonNode mapping, Metadata out) {
        Iterator<Map.Entry<String, JsonNode>> fields = mapping.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            addValue(field.getKey(), field.getValue(), out, true);
        }
    }

    private void addValue(String key, JsonNode node, Metadata out, boolean variable) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addValue(key + "." + field.getKey(), field.getValue(), out, variable);
            }
            return;
        }
        MetadataValue value = toValue(node);
        if (variable) {
            out.putVariable(key, value);
        } else {
            out.put(key, value);
        }
    }

    /**
     * Converts a non-object node.
     */
    MetadataValue toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return MetadataValue.text("");
        }
        if (node.isNumber()) {
            return MetadataValue.number(node.decimalValue());
        }
        if (node.isArray()) {
            List<String> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(toText(item));
            }
            return MetadataValue.list(items);
        }
        return MetadataValue.text(toText(node));
    }

    /**
     * Text form of any node: scalars as-is, containers as compact JSON.
     */
    String toText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return "";
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        try {
            return jsonMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new RuleParseException("Cannot serialise value: " + e.getOriginalMessage(), e);
        }
    }
}
