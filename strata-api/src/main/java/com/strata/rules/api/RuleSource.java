/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api;

import java.io.IOException;
import java.util.Map;

/**
 * Supplies raw rule documents. The engine never touches storage itself; a source
 * may read a directory tree, a database or anything else.
 */
public interface RuleSource {

    /**
     * Loads every available document.
     *
     * @return logical path ({@code /}-separated) to raw content, in a stable order
     * @throws IOException if the source as a whole is unavailable
     */
    Map<String, String> loadDocuments() throws IOException;

    /**
     * Short description for logs and span attributes.
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
