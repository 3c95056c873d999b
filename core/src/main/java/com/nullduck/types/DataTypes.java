package com.nullduck.types;

import java.util.List;
import java.util.Locale;

/**
 * Catalog of the supported data types and category predicates over them.
 *
 * <p>Every type in the catalog is a singleton, so the constants here can be compared
 * with either {@code ==} or {@code equals}.
 */
public final class DataTypes {

    public static final NullType NULL = NullType.get();
    public static final BooleanType BOOLEAN = BooleanType.get();
    public static final ByteType INT8 = ByteType.get();
    public static final ShortType INT16 = ShortType.get();
    public static final IntegerType INT32 = IntegerType.get();
    public static final LongType INT64 = LongType.get();
    public static final FloatType FLOAT32 = FloatType.get();
    public static final DoubleType FLOAT64 = DoubleType.get();
    public static final StringType UTF8 = StringType.get();
    public static final BinaryType BINARY = BinaryType.get();
    public static final DateType DATE = DateType.get();
    public static final TimestampType TIMESTAMP = TimestampType.get();

    private static final List<DataType> ALL = List.of(
        NULL, BOOLEAN, INT8, INT16, INT32, INT64, FLOAT32, FLOAT64,
        UTF8, BINARY, DATE, TIMESTAMP);

    private DataTypes() {} // Utility class

    /**
     * Returns every type in the catalog.
     *
     * @return the catalog, bottom type first
     */
    public static List<DataType> all() {
        return ALL;
    }

    /**
     * Looks up a type by its {@link DataType#typeName() name} (case-insensitive).
     *
     * @param name the type name, e.g. "int64" or "utf8"
     * @return the data type
     * @throws IllegalArgumentException if no type has that name
     */
    public static DataType fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("type name must not be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DataType type : ALL) {
            if (type.typeName().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data type: '" + name + "'");
    }

    public static boolean isIntegral(DataType type) {
        return type instanceof ByteType || type instanceof ShortType
            || type instanceof IntegerType || type instanceof LongType;
    }

    public static boolean isFloating(DataType type) {
        return type instanceof FloatType || type instanceof DoubleType;
    }

    public static boolean isNumeric(DataType type) {
        return isIntegral(type) || isFloating(type);
    }

    public static boolean isTemporal(DataType type) {
        return type instanceof DateType || type instanceof TimestampType;
    }

    /**
     * Returns the Java class that valid values of the given type must have.
     *
     * @param type the data type
     * @return the value class, or {@code null} for {@link NullType} which has no valid values
     */
    public static Class<?> valueClass(DataType type) {
        return type.valueClass();
    }

    /**
     * Checks whether a non-null value is a legal instance of the given type.
     *
     * @param type the data type
     * @param value the value (must not be null)
     * @return true if the value may be stored in a valid slot of that type
     */
    public static boolean isLegalValue(DataType type, Object value) {
        return type.accepts(value);
    }

    /**
     * Infers the data type of a Java value, used for literals.
     *
     * @param value the value, may be null
     * @return the inferred type; {@link NullType} for null
     * @throws IllegalArgumentException if the value's class is not in the catalog
     */
    public static DataType inferType(Object value) {
        if (value == null) {
            return NULL;
        }
        for (DataType type : ALL) {
            if (isLegalValue(type, value)) {
                return type;
            }
        }
        throw new IllegalArgumentException(
            "No data type for value of class " + value.getClass().getName());
    }
}
