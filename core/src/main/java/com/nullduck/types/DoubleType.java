package com.nullduck.types;

/**
 * Double-precision IEEE 754 float. Slots hold {@link Double}, NaN included.
 *
 * <p>Top of the numeric part of the lattice: every integer and float32 widens to it.
 */
public final class DoubleType implements DataType {

    private static final DoubleType INSTANCE = new DoubleType();

    private DoubleType() {}

    public static DoubleType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "float64";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public Class<?> valueClass() {
        return Double.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
