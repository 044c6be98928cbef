/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for slash-delimited logical rule paths such as {@code agents/coder/base.mdc}.
 */
public final class RulePaths {

    private RulePaths() {
        throw new AssertionError("No instances");
    }

    /**
     * Directory part of a path, without trailing slash. Empty for top-level rules.
     */
    public static String directory(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? "" : path.substring(0, idx);
    }

    public static String fileName(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    /**
     * File extension including the leading dot, or an empty string.
     */
    public static String extension(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "" : name.substring(dot);
    }

    public static String stem(String path) {
        String name = fileName(path);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? name : name.substring(0, dot);
    }

    /**
     * Joins a directory and a relative name. An empty directory yields the name itself.
     */
    public static String join(String directory, String name) {
        return directory.isEmpty() ? name : directory + "/" + name;
    }

    /**
     * Enclosing directories from the direct one up to the root (the root is the empty string).
     */
    public static List<String> ancestorDirectories(String path) {
        List<String> dirs = new ArrayList<>();
        String dir = directory(path);
        while (true) {
            dirs.add(dir);
            if (dir.isEmpty()) {
                return dirs;
            }
            dir = directory(dir);
        }
    }

    /**
     * Number of directory segments in a path ({@code a/b/c.md} has depth 2).
     */
    public static int directoryDepth(String path) {
        String dir = directory(path);
        if (dir.isEmpty()) {
            return 0;
        }
        return (int) dir.chars().filter(c -> c == '/').count() + 1;
    }
}
