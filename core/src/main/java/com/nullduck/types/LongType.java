package com.nullduck.types;

/**
 * 64-bit signed integer, the widest integer type. Slots hold {@link Long}.
 */
public final class LongType implements DataType {

    private static final LongType INSTANCE = new LongType();

    private LongType() {}

    public static LongType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int64";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public Class<?> valueClass() {
        return Long.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
