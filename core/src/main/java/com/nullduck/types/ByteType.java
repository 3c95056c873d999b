package com.nullduck.types;

/**
 * 8-bit signed integer, the narrowest rung of the integer ladder. Slots hold {@link Byte}.
 */
public final class ByteType implements DataType {

    private static final ByteType INSTANCE = new ByteType();

    private ByteType() {}

    public static ByteType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int8";
    }

    @Override
    public int defaultSize() {
        return 1;
    }

    @Override
    public Class<?> valueClass() {
        return Byte.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
