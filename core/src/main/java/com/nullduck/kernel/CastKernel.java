package com.nullduck.kernel;

import com.nullduck.array.ValidityArray;
import com.nullduck.exception.EvaluationException;
import com.nullduck.types.ByteType;
import com.nullduck.types.DataType;
import com.nullduck.types.DataTypes;
import com.nullduck.types.DoubleType;
import com.nullduck.types.FloatType;
import com.nullduck.types.IntegerType;
import com.nullduck.types.LongType;
import com.nullduck.types.NullType;
import com.nullduck.types.ShortType;
import com.nullduck.types.TimestampType;
import com.nullduck.types.TypeLattice;

import java.time.LocalDate;

/**
 * Promotes arrays along the edges of the {@link TypeLattice}.
 *
 * <p>Only widening is supported: an array of type {@code a} can be cast to {@code b}
 * exactly when {@code supertype(a, b) == b}. Null slots stay null.
 */
public final class CastKernel {

    private CastKernel() {} // Utility class

    /**
     * Promotes an array to a wider type.
     *
     * @param array the array
     * @param target the target type
     * @return the promoted array, or {@code array} itself if it already has the target type
     * @throws EvaluationException if {@code target} is not a supertype of the array's type
     */
    public static ValidityArray widen(ValidityArray array, DataType target) {
        DataType source = array.dataType();
        if (source.equals(target)) {
            return array;
        }
        if (!TypeLattice.canWiden(source, target)) {
            throw new EvaluationException("cast", String.format(
                "cannot promote %s to %s", source.typeName(), target.typeName()));
        }
        if (source instanceof NullType) {
            return ValidityArray.nulls(target, array.length());
        }

        ValidityArray.Builder builder = ValidityArray.builder(target, array.length());
        for (int i = 0; i < array.length(); i++) {
            builder.append(array.isValid(i) ? convert(array.get(i), target) : null);
        }
        return builder.build();
    }

    private static Object convert(Object value, DataType target) {
        if (target instanceof TimestampType) {
            return ((LocalDate) value).atStartOfDay();
        }
        if (!DataTypes.isNumeric(target) || value instanceof Boolean) {
            throw new IllegalStateException("No conversion of " + value + " to " + target);
        }
        Number number = (Number) value;
        if (target instanceof ShortType) {
            return number.shortValue();
        } else if (target instanceof IntegerType) {
            return number.intValue();
        } else if (target instanceof LongType) {
            return number.longValue();
        } else if (target instanceof FloatType) {
            return number.floatValue();
        } else if (target instanceof DoubleType) {
            return number.doubleValue();
        } else if (target instanceof ByteType) {
            return number.byteValue();
        }
        throw new IllegalStateException("Unhandled numeric target " + target);
    }
}
