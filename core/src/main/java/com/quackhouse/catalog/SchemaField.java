package com.quackhouse.catalog;

import java.util.Objects;

/**
 * A declared column of a catalog entry, or a column reported by the engine
 * when describing a bound view.
 */
public record SchemaField(String name, String type, boolean nullable) {

    public SchemaField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
    }

    @Override
    public String toString() {
        return name + ": " + type + (nullable ? "" : " NOT NULL");
    }
}
