package com.nullduck.runtime;

import com.nullduck.array.ValidityArray;
import com.nullduck.types.DataType;
import com.nullduck.types.TypeMapper;

import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.NullVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampMicroVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarBinaryVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Arrow data interchange for validity arrays.
 *
 * <p>Converts {@link ValidityArray}s and {@link RecordBatch}es to Arrow vectors and back,
 * carrying the validity bitmap across unchanged. Type correspondence is defined by
 * {@link TypeMapper}; temporal values use Arrow's day and microsecond encodings.
 *
 * <p>Vectors returned from this class are owned by the caller and must be closed.
 *
 * <p>Example usage:
 * <pre>
 *   try (BufferAllocator allocator = new RootAllocator();
 *        VectorSchemaRoot root = ArrowInterchange.toVectorSchemaRoot(batch, allocator)) {
 *       RecordBatch copy = ArrowInterchange.fromVectorSchemaRoot(root);
 *   }
 * </pre>
 */
public final class ArrowInterchange {

    private ArrowInterchange() {} // Utility class

    /**
     * Copies an array into a new Arrow vector.
     *
     * @param array the array
     * @param name the vector's field name
     * @param allocator the allocator backing the vector
     * @return the vector, owned by the caller
     */
    public static FieldVector toVector(ValidityArray array, String name, BufferAllocator allocator) {
        Objects.requireNonNull(array, "array must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");

        Field field = new Field(name, FieldType.nullable(TypeMapper.toArrowType(array.dataType())), null);
        FieldVector vector = field.createVector(allocator);
        try {
            vector.setInitialCapacity(array.length());
            vector.allocateNew();
            for (int i = 0; i < array.length(); i++) {
                if (array.isValid(i)) {
                    setVectorValue(vector, i, array.get(i));
                } else {
                    setVectorNull(vector, i);
                }
            }
            vector.setValueCount(array.length());
            return vector;
        } catch (RuntimeException e) {
            vector.close();
            throw e;
        }
    }

    /**
     * Copies an Arrow vector into a new array.
     *
     * @param vector the vector
     * @return the array
     * @throws UnsupportedOperationException if the vector's type has no nullduck counterpart
     */
    public static ValidityArray fromVector(FieldVector vector) {
        Objects.requireNonNull(vector, "vector must not be null");

        DataType type = TypeMapper.fromArrowType(vector.getField().getType());
        int count = vector.getValueCount();
        ValidityArray.Builder builder = ValidityArray.builder(type, count);
        for (int i = 0; i < count; i++) {
            builder.append(getVectorValue(vector, i));
        }
        return builder.build();
    }

    /**
     * Copies a batch into a new Arrow {@link VectorSchemaRoot}.
     *
     * @param batch the batch
     * @param allocator the allocator backing the vectors
     * @return the root, owned by the caller
     */
    public static VectorSchemaRoot toVectorSchemaRoot(RecordBatch batch, BufferAllocator allocator) {
        Objects.requireNonNull(batch, "batch must not be null");

        List<FieldVector> vectors = new ArrayList<>();
        try {
            batch.columns().forEach((name, column) -> vectors.add(toVector(column, name, allocator)));
        } catch (RuntimeException e) {
            vectors.forEach(FieldVector::close);
            throw e;
        }

        List<Field> fields = new ArrayList<>(vectors.size());
        for (FieldVector vector : vectors) {
            fields.add(vector.getField());
        }
        return new VectorSchemaRoot(fields, vectors, batch.length());
    }

    /**
     * Copies an Arrow {@link VectorSchemaRoot} into a new batch.
     *
     * @param root the root
     * @return the batch
     */
    public static RecordBatch fromVectorSchemaRoot(VectorSchemaRoot root) {
        Objects.requireNonNull(root, "root must not be null");

        RecordBatch.Builder builder = RecordBatch.builder();
        for (FieldVector vector : root.getFieldVectors()) {
            builder.column(vector.getName(), fromVector(vector));
        }
        return builder.build();
    }

    /**
     * Gets a value from an Arrow vector at the specified index.
     *
     * @param vector the vector to read from
     * @param index the row index
     * @return the value, or null for a null slot
     */
    private static Object getVectorValue(FieldVector vector, int index) {
        if (vector.isNull(index)) {
            return null;
        }

        if (vector instanceof BitVector) {
            return ((BitVector) vector).get(index) != 0;
        } else if (vector instanceof TinyIntVector) {
            return ((TinyIntVector) vector).get(index);
        } else if (vector instanceof SmallIntVector) {
            return ((SmallIntVector) vector).get(index);
        } else if (vector instanceof IntVector) {
            return ((IntVector) vector).get(index);
        } else if (vector instanceof BigIntVector) {
            return ((BigIntVector) vector).get(index);
        } else if (vector instanceof Float4Vector) {
            return ((Float4Vector) vector).get(index);
        } else if (vector instanceof Float8Vector) {
            return ((Float8Vector) vector).get(index);
        } else if (vector instanceof VarCharVector) {
            byte[] bytes = ((VarCharVector) vector).get(index);
            return new String(bytes, StandardCharsets.UTF_8);
        } else if (vector instanceof VarBinaryVector) {
            return ((VarBinaryVector) vector).get(index);
        } else if (vector instanceof DateDayVector) {
            return LocalDate.ofEpochDay(((DateDayVector) vector).get(index));
        } else if (vector instanceof TimeStampMicroVector) {
            return fromEpochMicros(((TimeStampMicroVector) vector).get(index));
        }

        throw new UnsupportedOperationException(
            "Unsupported vector " + vector.getClass().getSimpleName());
    }

    private static void setVectorValue(FieldVector vector, int index, Object value) {
        if (vector instanceof BitVector) {
            ((BitVector) vector).setSafe(index, (Boolean) value ? 1 : 0);
        } else if (vector instanceof TinyIntVector) {
            ((TinyIntVector) vector).setSafe(index, (Byte) value);
        } else if (vector instanceof SmallIntVector) {
            ((SmallIntVector) vector).setSafe(index, (Short) value);
        } else if (vector instanceof IntVector) {
            ((IntVector) vector).setSafe(index, (Integer) value);
        } else if (vector instanceof BigIntVector) {
            ((BigIntVector) vector).setSafe(index, (Long) value);
        } else if (vector instanceof Float4Vector) {
            ((Float4Vector) vector).setSafe(index, (Float) value);
        } else if (vector instanceof Float8Vector) {
            ((Float8Vector) vector).setSafe(index, (Double) value);
        } else if (vector instanceof VarCharVector) {
            ((VarCharVector) vector).setSafe(index, ((String) value).getBytes(StandardCharsets.UTF_8));
        } else if (vector instanceof VarBinaryVector) {
            ((VarBinaryVector) vector).setSafe(index, (byte[]) value);
        } else if (vector instanceof DateDayVector) {
            ((DateDayVector) vector).setSafe(index, Math.toIntExact(((LocalDate) value).toEpochDay()));
        } else if (vector instanceof TimeStampMicroVector) {
            ((TimeStampMicroVector) vector).setSafe(index, toEpochMicros((LocalDateTime) value));
        } else {
            throw new UnsupportedOperationException(
                "Unsupported vector " + vector.getClass().getSimpleName());
        }
    }

    private static void setVectorNull(FieldVector vector, int index) {
        if (vector instanceof BaseFixedWidthVector) {
            ((BaseFixedWidthVector) vector).setNull(index);
        } else if (vector instanceof BaseVariableWidthVector) {
            ((BaseVariableWidthVector) vector).setNull(index);
        } else if (!(vector instanceof NullVector)) {
            throw new UnsupportedOperationException(
                "Unsupported vector " + vector.getClass().getSimpleName());
        }
    }

    private static long toEpochMicros(LocalDateTime value) {
        long seconds = value.toEpochSecond(ZoneOffset.UTC);
        return Math.addExact(Math.multiplyExact(seconds, 1_000_000L), value.getNano() / 1_000L);
    }

    private static LocalDateTime fromEpochMicros(long micros) {
        long seconds = Math.floorDiv(micros, 1_000_000L);
        int nanos = (int) Math.floorMod(micros, 1_000_000L) * 1_000;
        return LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC);
    }
}
