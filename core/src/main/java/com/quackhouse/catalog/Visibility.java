package com.quackhouse.catalog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who besides the owner and administrators may read a catalog entry.
 */
public enum Visibility {
    PRIVATE,
    PUBLIC;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Parse a visibility name (case-insensitive); null means private.
     */
    @JsonCreator
    public static Visibility parse(String value) {
        if (value == null || value.isBlank()) {
            return PRIVATE;
        }
        return switch (value.trim().toLowerCase()) {
            case "private" -> PRIVATE;
            case "public" -> PUBLIC;
            default -> throw new IllegalArgumentException(
                "Unknown visibility: '%s'. Valid values: private, public".formatted(value));
        };
    }
}
