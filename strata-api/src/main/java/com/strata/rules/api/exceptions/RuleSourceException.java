/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.exceptions;

/**
 * Raised when a rule source cannot deliver its documents at all.
 * Individual unreadable documents are skipped by the source and never raise this.
 */
public class RuleSourceException extends RuntimeException {

    public RuleSourceException(String message) {
        super(message);
    }

    public RuleSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
