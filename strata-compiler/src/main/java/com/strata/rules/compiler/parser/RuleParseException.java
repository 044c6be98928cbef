/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.compiler.parser;

/**
 * Signals that a document cannot be parsed in its declared format.
 * Never escapes {@link RuleParser}: the parser catches it and degrades.
 */
class RuleParseException extends RuntimeException {

    RuleParseException(String message) {
        super(message);
    }

    RuleParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
