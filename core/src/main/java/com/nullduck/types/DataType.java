package com.nullduck.types;

/**
 * Sealed interface for all data types in the nullduck type system.
 *
 * <p>This represents the data type of a column, a literal or an expression result.
 * The catalog is fixed and closed; compatibility between two types is decided by
 * {@link TypeLattice}, never by the types themselves.
 *
 * <p>The catalog contains:
 * <ul>
 *   <li>The bottom type: NullType</li>
 *   <li>Primitive types: BooleanType, ByteType, ShortType, IntegerType, LongType,
 *       FloatType, DoubleType</li>
 *   <li>Variable-length types: StringType, BinaryType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 * </ul>
 */
public sealed interface DataType
    permits NullType, BooleanType, ByteType, ShortType, IntegerType, LongType,
            FloatType, DoubleType, StringType, BinaryType, DateType, TimestampType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, Binary).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }

    /**
     * Returns the Java class that valid slots of this type hold.
     *
     * @return the value class, or {@code null} for {@link NullType}
     */
    Class<?> valueClass();

    /**
     * Checks whether a non-null value may be stored in a valid slot of this type.
     *
     * @param value the value
     * @return true if the value is an instance of {@link #valueClass()}
     */
    default boolean accepts(Object value) {
        Class<?> valueClass = valueClass();
        return valueClass != null && valueClass.isInstance(value);
    }
}
