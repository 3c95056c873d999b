package com.nullduck.kernel;

import com.nullduck.array.ValidityArray;
import com.nullduck.exception.EvaluationException;
import com.nullduck.types.DataTypes;

/**
 * Predicate kernels over the validity bitmap and over NaN slots.
 *
 * <p>{@link #isNull} and {@link #notNull} return arrays with no null slots.
 * {@link #isNan} and {@link #notNan} keep null slots null, since a null float
 * is neither NaN nor a number.
 */
public final class NullKernels {

    private NullKernels() {} // Utility class

    public static ValidityArray isNull(ValidityArray array) {
        ValidityArray.Builder builder = ValidityArray.builder(DataTypes.BOOLEAN, array.length());
        for (int i = 0; i < array.length(); i++) {
            builder.append(array.isNull(i));
        }
        return builder.build();
    }

    public static ValidityArray notNull(ValidityArray array) {
        ValidityArray.Builder builder = ValidityArray.builder(DataTypes.BOOLEAN, array.length());
        for (int i = 0; i < array.length(); i++) {
            builder.append(array.isValid(i));
        }
        return builder.build();
    }

    /**
     * Marks NaN slots of a float array.
     *
     * @param array a float32 or float64 array
     * @return a boolean array, null where the input is null
     * @throws EvaluationException if the array is not floating point
     */
    public static ValidityArray isNan(ValidityArray array) {
        return nanPredicate("is_nan", array, true);
    }

    /**
     * Marks non-NaN slots of a float array.
     *
     * @param array a float32 or float64 array
     * @return a boolean array, null where the input is null
     * @throws EvaluationException if the array is not floating point
     */
    public static ValidityArray notNan(ValidityArray array) {
        return nanPredicate("not_nan", array, false);
    }

    /**
     * Returns whether a valid float slot holds the NaN bit pattern.
     */
    static boolean isNanValue(Object value) {
        if (value instanceof Double) {
            return ((Double) value).isNaN();
        }
        return value instanceof Float && ((Float) value).isNaN();
    }

    private static ValidityArray nanPredicate(String operator, ValidityArray array, boolean whenNan) {
        if (!DataTypes.isFloating(array.dataType())) {
            throw new EvaluationException(operator,
                "expected a floating point array but got " + array.dataType().typeName());
        }
        ValidityArray.Builder builder = ValidityArray.builder(DataTypes.BOOLEAN, array.length());
        for (int i = 0; i < array.length(); i++) {
            if (array.isNull(i)) {
                builder.appendNull();
            } else {
                builder.append(isNanValue(array.get(i)) == whenNan);
            }
        }
        return builder.build();
    }
}
