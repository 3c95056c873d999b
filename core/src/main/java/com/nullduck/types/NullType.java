package com.nullduck.types;

/**
 * Type of a column that holds only nulls.
 *
 * <p>Bottom of the {@link TypeLattice}: paired with any other type it yields that
 * other type. It has no value class, so every slot of a null-typed array is null.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public int defaultSize() {
        return 0;
    }

    @Override
    public Class<?> valueClass() {
        return null;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
