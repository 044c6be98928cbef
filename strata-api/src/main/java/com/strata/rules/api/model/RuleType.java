/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of rule categories. A rule either declares its type through the
 * {@code type} metadata key or has it inferred from its path.
 */
public enum RuleType {
    CORE,
    WORKFLOW,
    AGENT,
    PROJECT,
    CONTEXT,
    GENERAL;

    /**
     * Case-insensitive lookup.
     *
     * @param name declared type name, may be null
     * @return the matching type, or empty when the name is blank or unknown
     */
    public static Optional<RuleType> fromName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
