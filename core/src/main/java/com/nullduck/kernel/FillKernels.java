package com.nullduck.kernel;

import com.nullduck.array.ValidityArray;
import com.nullduck.exception.EvaluationException;
import com.nullduck.types.DataType;
import com.nullduck.types.DataTypes;
import com.nullduck.types.FloatType;
import com.nullduck.types.NullType;
import com.nullduck.types.TypeLattice;

import java.util.Objects;

/**
 * Null and NaN replacement kernels.
 *
 * <p>All kernels are pure: they never modify their inputs and always return a new
 * array (or an input unchanged when nothing needs replacing). They hold no state
 * between calls and are safe to run concurrently on any arrays.
 *
 * <h2>Kernels</h2>
 * <ul>
 *   <li>{@link #fillValue}: replace nulls with the matching slot of a fill array,
 *       broadcasting length-1 operands; the result has the operands' supertype</li>
 *   <li>{@link #fillForward} / {@link #fillBackward}: replace nulls with the nearest
 *       valid value in the scan direction; the result keeps the input type</li>
 *   <li>{@link #fillNan}: replace NaN slots of a float array; null slots are untouched</li>
 * </ul>
 *
 * <p>Example:
 * <pre>
 *   fillValue([null, 1, null], [999])           → [999, 1, 999]
 *   fillForward([null, null, 1, null, 2, null])  → [null, null, 1, 1, 2, 2]
 *   fillBackward([null, null, 1, null, 2, null]) → [1, 1, 1, 2, 2, null]
 * </pre>
 */
public final class FillKernels {

    private FillKernels() {} // Utility class

    /**
     * Replaces null slots of {@code data} with the corresponding slot of {@code fill}.
     *
     * <p>If {@code fill} has length 1 it is used for every slot; if {@code data} has
     * length 1 and {@code fill} is longer, {@code data} is broadcast first. A null fill
     * slot leaves the result slot null.
     *
     * @param data the array to fill
     * @param fill the fill values
     * @return the filled array, typed as {@code supertype(data, fill)}
     * @throws EvaluationException if the operand types have no supertype
     * @throws com.nullduck.exception.LengthMismatchException if the lengths are incompatible
     */
    public static ValidityArray fillValue(ValidityArray data, ValidityArray fill) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(fill, "fill must not be null");

        DataType target = TypeLattice.supertype(data.dataType(), fill.dataType())
            .orElseThrow(() -> new EvaluationException("fill_null", String.format(
                "no common supertype for %s and %s",
                data.dataType().typeName(), fill.dataType().typeName())));
        int length = Broadcast.resultLength("fill_null", data.length(), fill.length());

        ValidityArray lhs = CastKernel.widen(data, target);
        ValidityArray rhs = CastKernel.widen(fill, target);

        ValidityArray.Builder builder = ValidityArray.builder(target, length);
        for (int i = 0; i < length; i++) {
            int di = Broadcast.sourceIndex(lhs.length(), i);
            if (lhs.isValid(di)) {
                builder.appendFrom(lhs, di);
            } else {
                builder.appendFrom(rhs, Broadcast.sourceIndex(rhs.length(), i));
            }
        }
        return builder.build();
    }

    /**
     * Dispatches to {@link #fillForward} or {@link #fillBackward}.
     *
     * @param data the array to fill
     * @param strategy the scan direction
     * @return the filled array, with the input's type
     */
    public static ValidityArray fillWithStrategy(ValidityArray data, FillStrategy strategy) {
        Objects.requireNonNull(strategy, "strategy must not be null");
        return strategy == FillStrategy.FORWARD ? fillForward(data) : fillBackward(data);
    }

    /**
     * Replaces each null with the most recent valid value to its left.
     *
     * <p>Leading nulls stay null.
     *
     * @param data the array to fill
     * @return the filled array, with the input's type
     */
    public static ValidityArray fillForward(ValidityArray data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.nullCount() == 0 || data.nullCount() == data.length()) {
            return data;
        }

        ValidityArray.Builder builder = ValidityArray.builder(data.dataType(), data.length());
        int lastValid = -1;
        for (int i = 0; i < data.length(); i++) {
            if (data.isValid(i)) {
                lastValid = i;
            }
            if (lastValid >= 0) {
                builder.appendFrom(data, lastValid);
            } else {
                builder.appendNull();
            }
        }
        return builder.build();
    }

    /**
     * Replaces each null with the nearest valid value to its right.
     *
     * <p>Trailing nulls stay null.
     *
     * @param data the array to fill
     * @return the filled array, with the input's type
     */
    public static ValidityArray fillBackward(ValidityArray data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.nullCount() == 0 || data.nullCount() == data.length()) {
            return data;
        }

        Object[] filled = new Object[data.length()];
        Object nextValid = null;
        for (int i = data.length() - 1; i >= 0; i--) {
            if (data.isValid(i)) {
                nextValid = data.get(i);
            }
            filled[i] = nextValid;
        }

        ValidityArray.Builder builder = ValidityArray.builder(data.dataType(), data.length());
        for (Object value : filled) {
            builder.append(value);
        }
        return builder.build();
    }

    /**
     * Replaces NaN slots of a float array with the corresponding slot of {@code fill}.
     *
     * <p>Null slots are not NaN and are left null. Broadcasting follows
     * {@link #fillValue}. Integer fill values are converted to the data's float type.
     *
     * @param data a float32 or float64 array
     * @param fill numeric (or all-null) fill values
     * @return the filled array, with the input's type
     * @throws EvaluationException if {@code data} is not floating point or {@code fill}
     *         is not numeric
     */
    public static ValidityArray fillNan(ValidityArray data, ValidityArray fill) {
        Objects.requireNonNull(data, "data must not be null");
        Objects.requireNonNull(fill, "fill must not be null");

        DataType type = data.dataType();
        if (!DataTypes.isFloating(type)) {
            throw new EvaluationException("fill_nan",
                "expected a floating point array but got " + type.typeName());
        }
        if (!DataTypes.isNumeric(fill.dataType()) && !(fill.dataType() instanceof NullType)) {
            throw new EvaluationException("fill_nan",
                "expected a numeric fill value but got " + fill.dataType().typeName());
        }
        int length = Broadcast.resultLength("fill_nan", data.length(), fill.length());

        ValidityArray.Builder builder = ValidityArray.builder(type, length);
        for (int i = 0; i < length; i++) {
            int di = Broadcast.sourceIndex(data.length(), i);
            if (data.isNull(di)) {
                builder.appendNull();
                continue;
            }
            Object value = data.get(di);
            if (!NullKernels.isNanValue(value)) {
                builder.append(value);
                continue;
            }
            int fi = Broadcast.sourceIndex(fill.length(), i);
            builder.append(fill.isValid(fi) ? toFloating((Number) fill.get(fi), type) : null);
        }
        return builder.build();
    }

    /**
     * Convenience overload of {@link #fillNan(ValidityArray, ValidityArray)} for a scalar fill.
     */
    public static ValidityArray fillNan(ValidityArray data, double fill) {
        return fillNan(data, ValidityArray.scalar(DataTypes.FLOAT64, fill));
    }

    private static Object toFloating(Number value, DataType type) {
        return type instanceof FloatType ? (Object) value.floatValue() : (Object) value.doubleValue();
    }
}
