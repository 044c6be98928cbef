/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Policy that decides which parts of a parent a child absorbs.
 */
public enum InheritanceType {
    /** Sections and metadata merge, child wins. */
    FULL,
    /** Sections merge; metadata is the child's own. */
    CONTENT,
    /** Metadata merges; sections are the child's own. */
    METADATA,
    /** Only variable-flagged metadata is inherited. */
    VARIABLES,
    /** Only the sections listed in {@code inherit_sections} are inherited. */
    SELECTIVE;

    /**
     * Parses an {@code inherit_mode} value, case-insensitively.
     */
    public static Optional<InheritanceType> fromMode(String mode) {
        if (mode == null || mode.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(mode.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
