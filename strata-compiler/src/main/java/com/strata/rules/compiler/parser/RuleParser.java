/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.strata.rules.api.IRuleParser;
import com.strata.rules.api.model.MetadataValue;
import com.strata.rules.api.model.ParsedRule;
import com.strata.rules.api.model.RuleFormat;
import com.strata.rules.api.model.RuleType;
import com.strata.rules.infra.hash.ContentHasher;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses rule documents in Markdown (with optional YAML front matter), JSON, YAML
 * or plain text.
 *
 * <p><b>Leniency:</b> parsing never throws for malformed content. A document that
 * cannot be read in its format becomes a rule with a single {@code content} section
 * holding the raw text, no metadata, and a parse warning. One bad file therefore
 * never blocks a hierarchy build.
 *
 * <p>Thread-safe: the parser holds only immutable configuration and thread-safe
 * Jackson mappers.
 */
public class RuleParser implements IRuleParser {

    private static final Logger logger = Logger.getLogger(RuleParser.class.getName());

    private static final String KEY_DEPENDS_ON = "depends_on";
    private static final String KEY_INCLUDE = "include";

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;
    private final MetadataConverter converter;

    public RuleParser() {
        this(new ObjectMapper(), new ObjectMapper(new YAMLFactory()));
    }

    RuleParser(ObjectMapper jsonMapper, ObjectMapper yamlMapper) {
        this.jsonMapper = jsonMapper;
        this.yamlMapper = yamlMapper;
        this.converter = new MetadataConverter(jsonMapper);
    }

    @Override
    public ParsedRule parse(String path, String rawContent) {
        Objects.requireNonNull(path, "path");
        String raw = rawContent == null ? "" : rawContent;
        String text = normalizeLineEndings(raw);
        RuleFormat format = RuleFormat.fromPath(path);

        Map<String, String> sections = new LinkedHashMap<>();
        MetadataConverter.Metadata metadata = new MetadataConverter.Metadata();
        List<String> warnings = new ArrayList<>();

        try {
            switch (format) {
                case MDC, MD -> parseMarkdown(text, sections, metadata);
                case JSON -> new StructuredDocumentParser(jsonMapper, converter).parse(text, sections, metadata);
                case YAML -> new StructuredDocumentParser(yamlMapper, converter).parse(text, sections, metadata);
                case TXT -> parsePlainText(text, sections, metadata);
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, String.format(
                    "Could not parse %s as %s, falling back to raw content: %s", path, format, e.getMessage()));
            sections.clear();
            sections.put(ParsedRule.CONTENT_SECTION, raw);
            metadata = new MetadataConverter.Metadata();
            warnings.add(String.format("Failed to parse %s as %s: %s", path, format, e.getMessage()));
        }

        Optional<RuleType> declared = metadata.values.containsKey(ParsedRule.KEY_TYPE)
                ? RuleType.fromName(metadata.values.get(ParsedRule.KEY_TYPE).asText())
                : Optional.empty();
        RuleType ruleType = declared.orElseGet(() -> RuleTypeClassifier.infer(path));

        List<String> references = ReferenceExtractor.extract(text, declaredReferences(metadata));

        ParsedRule rule = new ParsedRule(
                path,
                ruleType,
                declared.isPresent(),
                format,
                sections,
                metadata.values,
                metadata.variableKeys,
                references,
                raw,
                ContentHasher.sha256(raw),
                warnings);

        if (logger.isLoggable(Level.FINE)) {
            logger.fine(String.format("Parsed %s: format=%s, type=%s, %d sections, %d metadata keys, %d references",
                    path, format, ruleType, sections.size(), metadata.values.size(), references.size()));
        }
        return rule;
    }

    private void parseMarkdown(String text, Map<String, String> sections, MetadataConverter.Metadata metadata) {
        FrontMatter frontMatter = FrontMatter.split(text);
        frontMatter.yaml().ifPresent(yaml -> readFrontMatter(yaml, metadata));
        sections.putAll(MarkdownSectionSplitter.split(frontMatter.body()));
    }

    private void parsePlainText(String text, Map<String, String> sections, MetadataConverter.Metadata metadata) {
        FrontMatter frontMatter = FrontMatter.split(text);
        frontMatter.yaml().ifPresent(yaml -> readFrontMatter(yaml, metadata));
        sections.put(ParsedRule.CONTENT_SECTION, frontMatter.body().strip());
    }

    private void readFrontMatter(String yaml, MetadataConverter.Metadata metadata) {
        JsonNode node;
        try {
            node = yamlMapper.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new RuleParseException("Malformed front matter: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode() || node.isNull()) {
            return;
        }
        if (!node.isObject()) {
            throw new RuleParseException("Front matter must be a mapping, found " + node.getNodeType());
        }
        converter.addMapping(node, metadata);
    }

    /**
     * References declared as metadata in block form, which the text patterns do not see.
     */
    private static List<String> declaredReferences(MetadataConverter.Metadata metadata) {
        List<String> refs = new ArrayList<>();
        for (String key : List.of(KEY_DEPENDS_ON, KEY_INCLUDE)) {
            MetadataValue value = metadata.values.get(key);
            if (value instanceof MetadataValue.ListValue list) {
                refs.addAll(list.values());
            }
        }
        return refs;
    }

    private static String normalizeLineEndings(String raw) {
        String text = raw.startsWith("\uFEFF") ? raw.substring(1) : raw;
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
