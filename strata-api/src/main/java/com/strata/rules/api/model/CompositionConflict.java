/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A non-fatal (or, for cycles, fatal) disagreement recorded during composition.
 *
 * @param target     section name, metadata key, or {@code type} for type mismatches
 * @param parentPath rule that provided the overwritten value
 * @param childPath  rule whose value won
 * @param kind       conflict kind
 * @param severity   severity, defaulting to the kind's own
 * @param resolution best-effort description of how the conflict was resolved
 */
public record CompositionConflict(
        @JsonProperty("target") String target,
        @JsonProperty("parent_path") String parentPath,
        @JsonProperty("child_path") String childPath,
        @JsonProperty("kind") ConflictKind kind,
        @JsonProperty("severity") ConflictSeverity severity,
        @JsonProperty("resolution") String resolution
) {
    public CompositionConflict {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(kind, "kind");
        if (severity == null) severity = kind.defaultSeverity();
        if (resolution == null) resolution = "";
    }

    public static CompositionConflict of(String target, String parentPath, String childPath,
                                         ConflictKind kind, String resolution) {
        return new CompositionConflict(target, parentPath, childPath, kind, null, resolution);
    }

    public boolean isError() {
        return severity == ConflictSeverity.ERROR;
    }

    public String describe() {
        return String.format("%s [%s] '%s' %s -> %s: %s",
                kind, severity, target, parentPath, childPath, resolution);
    }
}
