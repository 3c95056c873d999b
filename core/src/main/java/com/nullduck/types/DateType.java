package com.nullduck.types;

import java.time.LocalDate;

/**
 * Calendar date without a time zone. Slots hold {@link LocalDate}; Arrow stores days
 * since the epoch.
 *
 * <p>Widens to timestamp at midnight.
 */
public final class DateType implements DataType {

    private static final DateType INSTANCE = new DateType();

    private DateType() {}

    public static DateType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public Class<?> valueClass() {
        return LocalDate.class;
    }

    @Override
    public String toString() {
        return typeName();
    }
}
