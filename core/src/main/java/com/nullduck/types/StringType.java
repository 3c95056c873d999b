package com.nullduck.types;

/**
 * UTF-8 text. Slots hold {@link String}. Only compatible with itself and null.
 */
public final class StringType implements DataType {

    private static final StringType INSTANCE = new StringType();

    private StringType() {}

    public static StringType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "utf8";
    }

    @Override
    public Class<?> valueClass() {
        return String.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
