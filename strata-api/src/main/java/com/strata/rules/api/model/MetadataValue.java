/*
 * Copyright (c) 2025 Strata Rule Engine
 * Licensed under the Apache License, Version 2.0
 */
package com.strata.rules.api.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Typed metadata value: text, number or list of strings.
 *
 * <p>Merge logic dispatches on the concrete record type, so two values compare
 * equal only when both kind and content match ({@code "1"} differs from {@code 1}).
 */
public interface MetadataValue {

    /**
     * Human-readable rendering used in composed output and conflict messages.
     */
    String asText();

    /**
     * Plain Java representation ({@link String}, {@link BigDecimal} or {@code List<String>})
     * suitable for serialization.
     */
    Object toPlain();

    static MetadataValue text(String value) {
        return new TextValue(value);
    }

    static MetadataValue number(BigDecimal value) {
        return new NumberValue(value);
    }

    static MetadataValue number(long value) {
        return new NumberValue(BigDecimal.valueOf(value));
    }

    static MetadataValue list(List<String> values) {
        return new ListValue(values);
    }

    record TextValue(String value) implements MetadataValue {
        public TextValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record NumberValue(BigDecimal value) implements MetadataValue {
        public NumberValue {
            Objects.requireNonNull(value, "value");
            // 1.0 and 1 must compare equal
            value = value.stripTrailingZeros();
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record ListValue(List<String> values) implements MetadataValue {
        public ListValue {
            values = List.copyOf(values);
        }

        @Override
        public String asText() {
            return String.join(", ", values);
        }

        @Override
        public Object toPlain() {
            return values;
        }
    }
}
