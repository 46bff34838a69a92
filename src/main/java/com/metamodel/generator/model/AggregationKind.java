package com.metamodel.generator.model;

import java.util.Locale;

/**
 * Aggregation kind of an attribute or association end.
 */
public enum AggregationKind {
    NONE,
    SHARED,
    COMPOSITE;

    /**
     * Parses the textual aggregation kind. Null or blank means {@link #NONE}.
     */
    public static AggregationKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "none" -> NONE;
            case "shared" -> SHARED;
            case "composite" -> COMPOSITE;
            default -> throw new IllegalArgumentException("Unknown aggregation kind: " + value);
        };
    }
}
