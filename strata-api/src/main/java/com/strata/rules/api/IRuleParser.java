/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api;

import com.strata.rules.api.model.ParsedRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns raw rule documents into {@link ParsedRule} records.
 */
public interface IRuleParser {

    /**
     * Parses one document. Never throws for malformed content: a document that
     * cannot be parsed degrades to a single {@code content} section.
     *
     * @param path       logical rule path, also used for format detection
     * @param rawContent document text, null treated as empty
     * @return parsed rule
     */
    ParsedRule parse(String path, String rawContent);

    /**
     * Parses a batch of documents. One bad document never aborts the batch.
     *
     * @param rawDocuments path to raw content
     * @return path to parsed rule, in input order
     */
    default Map<String, ParsedRule> parseAll(Map<String, String> rawDocuments) {
        Map<String, ParsedRule> rules = new LinkedHashMap<>();
        rawDocuments.forEach((path, content) -> rules.put(path, parse(path, content)));
        return Collections.unmodifiableMap(rules);
    }
}
