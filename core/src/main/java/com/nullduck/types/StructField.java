package com.nullduck.types;

import java.util.Objects;

/**
 * Represents a named column in a {@link Schema}.
 */
public record StructField(String name, DataType dataType) {

    /**
     * Creates a struct field.
     *
     * @param name the field name
     * @param dataType the field data type
     */
    public StructField {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
    }

    @Override
    public String toString() {
        return name + ": " + dataType;
    }
}
