/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.infra.hash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 content hashing used for rule checksums and cache fingerprints.
 */
public final class ContentHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final HexFormat HEX = HexFormat.of();

    private ContentHasher() {
        throw new AssertionError("No instances");
    }

    /**
     * Lower-case hex SHA-256 of the UTF-8 bytes of {@code content}. Null hashes as empty.
     */
    public static String sha256(String content) {
        MessageDigest digest = newDigest();
        digest.update((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(digest.digest());
    }

    /**
     * Hash of an ordered sequence of parts. Each part is length-prefixed so that
     * {@code ["ab", "c"]} and {@code ["a", "bc"]} hash differently.
     */
    public static String sha256(Iterable<String> parts) {
        MessageDigest digest = newDigest();
        for (String part : parts) {
            byte[] bytes = (part == null ? "" : part).getBytes(StandardCharsets.UTF_8);
            digest.update(Integer.toString(bytes.length).getBytes(StandardCharsets.US_ASCII));
            digest.update((byte) ':');
            digest.update(bytes);
        }
        return HEX.formatHex(digest.digest());
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE is required to ship SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
