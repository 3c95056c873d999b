package com.nullduck.types;

/**
 * Boolean type. Slots hold {@link Boolean}; Arrow stores them as a bit vector.
 */
public final class BooleanType implements DataType {

    private static final BooleanType INSTANCE = new BooleanType();

    private BooleanType() {}

    public static BooleanType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "boolean";
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public Class<?> valueClass() {
        return Boolean.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
