package com.nullduck.types;

/**
 * 16-bit signed integer. Slots hold {@link Short}.
 */
public final class ShortType implements DataType {

    private static final ShortType INSTANCE = new ShortType();

    private ShortType() {}

    public static ShortType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "int16";
    }

    @Override
    public int defaultSize() {
        return 2;
    }

    @Override
    public Class<?> valueClass() {
        return Short.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
