package com.nullduck.expression;

import com.nullduck.types.DataType;
import com.nullduck.types.DataTypes;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a constant value.
 *
 * <p>A literal evaluates to a length-1 array, which broadcasts against the other
 * operand of a binary kernel. A {@code null} value with {@link com.nullduck.types.NullType}
 * is the untyped null literal.
 *
 * <p>Examples:
 * <pre>
 *   Literal.of(999L)         -- int64
 *   Literal.of(2.0)          -- float64
 *   Literal.of("a")          -- utf8
 *   Literal.nullValue()      -- null
 * </pre>
 */
public final class Literal implements Expression {

    private final Object value;
    private final DataType dataType;

    /**
     * Creates a literal expression.
     *
     * @param value the literal value (may be null)
     * @param dataType the data type of the literal
     * @throws IllegalArgumentException if a non-null value is not legal for the type
     */
    public Literal(Object value, DataType dataType) {
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        if (value != null && !DataTypes.isLegalValue(dataType, value)) {
            throw new IllegalArgumentException(String.format(
                "Literal %s is not a legal %s value", value, dataType.typeName()));
        }
        this.value = value;
    }

    /**
     * Returns the literal value.
     *
     * @return the value, or null for NULL literals
     */
    public Object value() {
        return value;
    }

    public DataType dataType() {
        return dataType;
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String outputName() {
        return "literal";
    }

    @Override
    public String toString() {
        if (value == null) {
            return "lit(null)";
        }
        if (value instanceof byte[]) {
            return "lit(" + Arrays.toString((byte[]) value) + ")";
        }
        if (value instanceof String) {
            return "lit('" + value + "')";
        }
        return "lit(" + value + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Literal)) return false;
        Literal that = (Literal) obj;
        return dataType.equals(that.dataType) &&
               Objects.deepEquals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, Arrays.deepHashCode(new Object[] {value}));
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a literal, inferring its type from the value's class.
     *
     * @param value the value, or null for the untyped null literal
     * @return the literal
     * @throws IllegalArgumentException if the value's class is not in the type catalog
     */
    public static Literal of(Object value) {
        return new Literal(value, DataTypes.inferType(value));
    }

    /**
     * Creates the untyped null literal.
     *
     * @return the literal
     */
    public static Literal nullValue() {
        return new Literal(null, DataTypes.NULL);
    }

    /**
     * Creates a typed null literal.
     *
     * @param dataType the literal's type
     * @return the literal
     */
    public static Literal nullValue(DataType dataType) {
        return new Literal(null, dataType);
    }
}
