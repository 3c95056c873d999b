package com.nullduck.types;

/**
 * Single-precision IEEE 754 float. Slots hold {@link Float}, NaN included;
 * a NaN slot is valid, not null.
 */
public final class FloatType implements DataType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    public static FloatType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float32";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public Class<?> valueClass() {
        return Float.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
