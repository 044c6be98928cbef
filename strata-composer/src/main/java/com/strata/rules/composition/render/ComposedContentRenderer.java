/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.composition.render;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.strata.rules.api.model.CompositionResult;
import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RuleFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a composed rule back into document text.
 *
 * <ul>
 *   <li>Markdown: a {@code # Variables} list, then one {@code # Title Case} heading per
 *       section. The implicit {@code content} section is written without a heading.</li>
 *   <li>JSON and YAML: {@code {"metadata": {...}, "sections": {...}}}.</li>
 *   <li>Plain text: section texts separated by blank lines.</li>
 * </ul>
 * Directive metadata ({@code inherit}, {@code override}, ...) is not rendered.
 */
public class ComposedContentRenderer {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public ComposedContentRenderer() {
        this.jsonMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES))
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public String render(CompositionResult result, RuleFormat format) {
        return switch (format) {
            case MDC, MD -> renderMarkdown(result);
            case JSON -> write(jsonMapper, result);
            case YAML -> write(yamlMapper, result);
            case TXT -> String.join("\n\n", result.composedSections().values());
        };
    }

    private String renderMarkdown(CompositionResult result) {
        List<String> blocks = new ArrayList<>();

        Map<String, MetadataValue> variables = renderableMetadata(result);
        if (!variables.isEmpty()) {
            StringBuilder sb = new StringBuilder("# Variables\n");
            variables.forEach((key, value) -> sb.append("\n- ").append(key).append(": ").append(value.asText()));
            blocks.add(sb.toString());
        }

        for (Map.Entry<String, String> section : result.composedSections().entrySet()) {
            if (ParsedRule.CONTENT_SECTION.equals(section.getKey())) {
                if (!section.getValue().isEmpty()) {
                    blocks.add(section.getValue());
                }
            } else {
                String heading = "# " + titleCase(section.getKey());
                blocks.add(section.getValue().isEmpty() ? heading : heading + "\n\n" + section.getValue());
            }
        }
        return blocks.isEmpty() ? "" : String.join("\n\n", blocks) + "\n";
    }

    private String write(ObjectMapper mapper, CompositionResult result) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        renderableMetadata(result).forEach((key, value) -> metadata.put(key, value.toPlain()));

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("metadata", metadata);
        document.put("sections", result.composedSections());
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render composition of " + result.rulePath(), e);
        }
    }

    private static Map<String, MetadataValue> renderableMetadata(CompositionResult result) {
        Map<String, MetadataValue> renderable = new LinkedHashMap<>();
        result.composedMetadata().forEach((key, value) -> {
            if (!ParsedRule.isDirective(key)) {
                renderable.put(key, value);
            }
        });
        return renderable;
    }

    /**
     * {@code code_style} becomes {@code Code Style}.
     */
    static String titleCase(String sectionName) {
        StringBuilder sb = new StringBuilder();
        for (String word : sectionName.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }
}
