/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

/**
 * Kind of disagreement found while folding an inheritance chain.
 */
public enum ConflictKind {
    /** A child section replaced a different parent section. */
    SECTION_OVERRIDE(ConflictSeverity.INFO),
    /** A child metadata value replaced a different parent value. */
    VARIABLE_CONFLICT(ConflictSeverity.INFO),
    /** Parent and child declare different rule types. */
    TYPE_MISMATCH(ConflictSeverity.WARNING),
    /** The chain loops back on itself; composition is impossible. */
    CIRCULAR_INHERITANCE(ConflictSeverity.ERROR);

    private final ConflictSeverity defaultSeverity;

    ConflictKind(ConflictSeverity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public ConflictSeverity defaultSeverity() {
        return defaultSeverity;
    }
}
