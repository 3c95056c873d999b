package com.nullduck.types;

/**
 * Raw bytes. Slots hold {@code byte[]}, compared by content.
 */
public final class BinaryType implements DataType {

    private static final BinaryType INSTANCE = new BinaryType();

    private BinaryType() {}

    public static BinaryType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "binary";
    }

    @Override
    public Class<?> valueClass() {
        return byte[].class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
