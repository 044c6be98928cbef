/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.Objects;

/**
 * Directed child to parent relationship. A child has at most one direct parent.
 */
public record InheritanceEdge(
        String childPath,
        String parentPath,
        InheritanceType inheritanceType
) {
    public InheritanceEdge {
        Objects.requireNonNull(childPath, "childPath");
        Objects.requireNonNull(parentPath, "parentPath");
        if (inheritanceType == null) inheritanceType = InheritanceType.FULL;
    }
}
