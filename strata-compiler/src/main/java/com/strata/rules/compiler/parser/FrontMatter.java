/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

import java.util.Arrays;
import java.util.Optional;

/**
 * Splits a leading {@code ---} delimited block off a document.
 *
 * @param yaml the block between the delimiters, if the document has one
 * @param body everything after the closing delimiter (or the whole document)
 */
record FrontMatter(Optional<String> yaml, String body) {

    private static final String DELIMITER = "---";

    /**
     * @param text document with {@code \n} line endings
     * @throws RuleParseException if the opening delimiter is never closed
     */
    static FrontMatter split(String text) {
        String[] lines = text.split("\n", -1);
        if (lines.length == 0 || !lines[0].stripTrailing().equals(DELIMITER)) {
            return new FrontMatter(Optional.empty(), text);
        }
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            if (line.equals(DELIMITER) || line.equals("...")) {
                String yaml = String.join("\n", Arrays.copyOfRange(lines, 1, i));
                String body = String.join("\n", Arrays.copyOfRange(lines, i + 1, lines.length));
                return new FrontMatter(Optional.of(yaml), body);
            }
        }
        throw new RuleParseException("Unterminated front matter block");
    }
}
