package com.nullduck.types;

import java.time.LocalDateTime;

/**
 * Timestamp without a time zone, microsecond precision. Slots hold {@link LocalDateTime};
 * Arrow stores microseconds since the epoch.
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "timestamp";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public Class<?> valueClass() {
        return LocalDateTime.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
