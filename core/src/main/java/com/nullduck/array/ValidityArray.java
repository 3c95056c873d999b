package com.nullduck.array;

import com.nullduck.types.DataType;
import com.nullduck.types.DataTypes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, fixed-length typed array whose slots are each valid or null.
 *
 * <p>This is the uniform data structure every kernel reads and produces. Values are
 * held boxed, one Java object per slot, with a separate validity bitmap; a slot is
 * valid exactly when its bit is set. Every valid value is a legal instance of the
 * array's {@link DataType} (see {@link DataTypes#valueClass(DataType)}).
 *
 * <p>An array of length 1 may stand for a broadcastable scalar when it is paired with
 * a longer array in a binary kernel.
 *
 * <p>Example usage:
 * <pre>
 *   ValidityArray a = ValidityArray.of(DataTypes.INT64, null, 1L, null);
 *   a.nullCount();   // 2
 *   a.toList();      // [null, 1, null]
 * </pre>
 */
public final class ValidityArray {

    private final DataType dataType;
    private final Object[] values;
    private final BitSet validity;

    private ValidityArray(DataType dataType, Object[] values, BitSet validity) {
        this.dataType = dataType;
        this.values = values;
        this.validity = validity;
    }

    // ==================== Factory Methods ====================

    /**
     * Creates an array from an ordered list of values, where {@code null} marks a null slot.
     *
     * @param dataType the array's data type
     * @param values the slot values
     * @return the array
     * @throws IllegalArgumentException if a non-null value is not legal for the type
     */
    public static ValidityArray fromList(DataType dataType, List<?> values) {
        Objects.requireNonNull(values, "values must not be null");
        Builder builder = builder(dataType, values.size());
        for (Object value : values) {
            builder.append(value);
        }
        return builder.build();
    }

    /**
     * Creates an array from values, where {@code null} marks a null slot.
     *
     * @param dataType the array's data type
     * @param values the slot values
     * @return the array
     */
    public static ValidityArray of(DataType dataType, Object... values) {
        return fromList(dataType, Arrays.asList(values));
    }

    /**
     * Creates an array of the given length with every slot null.
     *
     * @param dataType the array's data type
     * @param length the length
     * @return the all-null array
     */
    public static ValidityArray nulls(DataType dataType, int length) {
        Objects.requireNonNull(dataType, "dataType must not be null");
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative, got: " + length);
        }
        return new ValidityArray(dataType, new Object[length], new BitSet(length));
    }

    /**
     * Creates a length-1 array holding a single value (or a single null).
     *
     * @param dataType the array's data type
     * @param value the value, or null
     * @return the scalar array
     */
    public static ValidityArray scalar(DataType dataType, Object value) {
        return builder(dataType, 1).append(value).build();
    }

    /**
     * Creates an empty array of the given type.
     *
     * @param dataType the array's data type
     * @return the empty array
     */
    public static ValidityArray empty(DataType dataType) {
        return nulls(dataType, 0);
    }

    public static Builder builder(DataType dataType, int capacity) {
        return new Builder(dataType, capacity);
    }

    // ==================== Accessors ====================

    public DataType dataType() {
        return dataType;
    }

    public int length() {
        return values.length;
    }

    public boolean isEmpty() {
        return values.length == 0;
    }

    /**
     * Returns whether slot {@code index} holds a value.
     *
     * @param index the slot index
     * @return true if valid, false if null
     */
    public boolean isValid(int index) {
        Objects.checkIndex(index, values.length);
        return validity.get(index);
    }

    public boolean isNull(int index) {
        return !isValid(index);
    }

    /**
     * Returns the value at {@code index}.
     *
     * @param index the slot index
     * @return the value, or null if the slot is null
     */
    public Object get(int index) {
        Objects.checkIndex(index, values.length);
        return copyIfBinary(values[index]);
    }

    /**
     * Returns the number of null slots.
     *
     * @return the null count
     */
    public int nullCount() {
        return values.length - validity.cardinality();
    }

    /**
     * Returns a copy of the validity bitmap; bit {@code i} is set when slot {@code i} is valid.
     *
     * @return the validity bitmap
     */
    public BitSet validity() {
        return (BitSet) validity.clone();
    }

    /**
     * Converts this array to an ordered list of values with {@code null} for null slots.
     *
     * @return an unmodifiable list of values
     */
    public List<Object> toList() {
        List<Object> list = new ArrayList<>(values.length);
        for (Object value : values) {
            list.add(copyIfBinary(value));
        }
        return Collections.unmodifiableList(list);
    }

    // ==================== Transforms ====================

    /**
     * Returns a new array with the slots in reverse order.
     *
     * @return the reversed array
     */
    public ValidityArray reverse() {
        Builder builder = builder(dataType, values.length);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.appendFrom(this, i);
        }
        return builder.build();
    }

    /**
     * Returns a new array with the slots {@code [offset, offset + length)}.
     *
     * @param offset the first slot
     * @param length the number of slots
     * @return the slice
     */
    public ValidityArray slice(int offset, int length) {
        Objects.checkFromIndexSize(offset, length, values.length);
        Builder builder = builder(dataType, length);
        for (int i = offset; i < offset + length; i++) {
            builder.appendFrom(this, i);
        }
        return builder.build();
    }

    /**
     * Repeats a length-1 array to the given length.
     *
     * @param length the target length
     * @return the broadcast array, or this array if it already has that length
     * @throws IllegalStateException if this array's length is neither 1 nor {@code length}
     */
    public ValidityArray broadcast(int length) {
        if (values.length == length) {
            return this;
        }
        if (values.length != 1) {
            throw new IllegalStateException(
                "Only length-1 arrays can be broadcast, got length " + values.length);
        }
        Builder builder = builder(dataType, length);
        for (int i = 0; i < length; i++) {
            builder.appendFrom(this, 0);
        }
        return builder.build();
    }

    // byte[] slots are the only mutable values; they never cross the array boundary uncopied
    private static Object copyIfBinary(Object value) {
        return value instanceof byte[] ? ((byte[]) value).clone() : value;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ValidityArray)) return false;
        ValidityArray that = (ValidityArray) obj;
        return dataType.equals(that.dataType) &&
               validity.equals(that.validity) &&
               Arrays.deepEquals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, validity, Arrays.deepHashCode(values));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(dataType.typeName()).append("[");
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            Object value = values[i];
            if (value instanceof byte[]) {
                sb.append(Arrays.toString((byte[]) value));
            } else {
                sb.append(value);
            }
        }
        return sb.append("]").toString();
    }

    /**
     * Append-only builder; each {@link #build()} snapshot is independent of later appends.
     */
    public static final class Builder {

        private final DataType dataType;
        private Object[] values;
        private final BitSet validity;
        private int size;

        private Builder(DataType dataType, int capacity) {
            this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
            if (capacity < 0) {
                throw new IllegalArgumentException("capacity must be non-negative, got: " + capacity);
            }
            this.values = new Object[capacity];
            this.validity = new BitSet(capacity);
        }

        /**
         * Appends a value, or a null slot if {@code value} is null.
         *
         * @param value the value
         * @return this builder
         * @throws IllegalArgumentException if the value is not legal for the builder's type
         */
        public Builder append(Object value) {
            if (value == null) {
                return appendNull();
            }
            if (!DataTypes.isLegalValue(dataType, value)) {
                throw new IllegalArgumentException(String.format(
                    "Value %s of class %s is not a legal %s value",
                    value, value.getClass().getSimpleName(), dataType.typeName()));
            }
            ensureCapacity();
            validity.set(size);
            values[size++] = copyIfBinary(value);
            return this;
        }

        public Builder appendNull() {
            ensureCapacity();
            values[size++] = null;
            return this;
        }

        /**
         * Copies slot {@code index} of another array of the same type.
         *
         * @param source the source array
         * @param index the source slot
         * @return this builder
         */
        public Builder appendFrom(ValidityArray source, int index) {
            if (!source.dataType.equals(dataType)) {
                throw new IllegalArgumentException(String.format(
                    "Cannot copy a %s slot into a %s array",
                    source.dataType.typeName(), dataType.typeName()));
            }
            return source.isValid(index) ? append(source.values[index]) : appendNull();
        }

        public int size() {
            return size;
        }

        public ValidityArray build() {
            return new ValidityArray(dataType, Arrays.copyOf(values, size), (BitSet) validity.clone());
        }

        private void ensureCapacity() {
            if (size == values.length) {
                values = Arrays.copyOf(values, Math.max(8, values.length * 2));
            }
        }
    }
}
