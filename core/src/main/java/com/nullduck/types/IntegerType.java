package com.nullduck.types;

/**
 * 32-bit signed integer. Slots hold {@link Integer}.
 *
 * <p>Paired with float32 it widens to float64, since float32 cannot hold every int32.
 */
public final class IntegerType implements DataType {

    private static final IntegerType INSTANCE = new IntegerType();

    private IntegerType() {}

    public static IntegerType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int32";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public Class<?> valueClass() {
        return Integer.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
