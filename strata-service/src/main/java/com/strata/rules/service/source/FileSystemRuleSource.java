/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.service.source;

import com.strata.rules.api.RuleSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads rule documents from a directory tree.
 *
 * <p>Every regular file with a rule extension is loaded, keyed by its path relative to
 * the root with {@code /} separators ({@code agents/coder.mdc}). Files that cannot be
 * read are skipped with a warning; a missing root fails the whole load. Invalid UTF-8
 * sequences decode to U+FFFD.
 */
public class FileSystemRuleSource implements RuleSource {

    private static final Logger logger = Logger.getLogger(FileSystemRuleSource.class.getName());

    public static final Set<String> RULE_EXTENSIONS = Set.of(".mdc", ".md", ".json", ".yaml", ".yml", ".txt");

    private final Path root;

    public FileSystemRuleSource(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public Map<String, String> loadDocuments() throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(FileSystemRuleSource::isRuleFile)
                    .sorted()
                    .collect(Collectors.toList());
        }

        Map<String, String> documents = new LinkedHashMap<>();
        for (Path file : files) {
            String key = toLogicalPath(root.relativize(file));
            try {
                // invalid bytes decode to U+FFFD
                documents.put(key, new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
            } catch (IOException e) {
                logger.log(Level.WARNING, "Skipping unreadable rule file " + file, e);
            }
        }

        logger.info(String.format("Loaded %d rule documents from %s", documents.size(), root));
        return documents;
    }

    @Override
    public String describe() {
        return "filesystem:" + root;
    }

    private static boolean isRuleFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 && RULE_EXTENSIONS.contains(name.substring(dot));
    }

    private static String toLogicalPath(Path relative) {
        StringBuilder sb = new StringBuilder();
        for (Path part : relative) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
