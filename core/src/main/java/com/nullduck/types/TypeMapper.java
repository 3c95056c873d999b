package com.nullduck.types;

import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Maps nullduck DataTypes to Apache Arrow types and back.
 *
 * <p>Examples:
 * <pre>
 *   LongType      → Int(64, signed)
 *   FloatType     → FloatingPoint(SINGLE)
 *   StringType    → Utf8
 *   TimestampType → Timestamp(MICROSECOND, no zone)
 * </pre>
 *
 * @see com.nullduck.runtime.ArrowInterchange
 */
public final class TypeMapper {

    private TypeMapper() {} // Utility class

    /**
     * Converts a nullduck DataType to an Arrow type.
     *
     * @param type the nullduck data type
     * @return the Arrow type
     */
    public static ArrowType toArrowType(DataType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }

        if (type instanceof NullType) {
            return ArrowType.Null.INSTANCE;
        } else if (type instanceof BooleanType) {
            return ArrowType.Bool.INSTANCE;
        } else if (type instanceof ByteType) {
            return new ArrowType.Int(8, true);
        } else if (type instanceof ShortType) {
            return new ArrowType.Int(16, true);
        } else if (type instanceof IntegerType) {
            return new ArrowType.Int(32, true);
        } else if (type instanceof LongType) {
            return new ArrowType.Int(64, true);
        } else if (type instanceof FloatType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
        } else if (type instanceof DoubleType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        } else if (type instanceof StringType) {
            return ArrowType.Utf8.INSTANCE;
        } else if (type instanceof BinaryType) {
            return ArrowType.Binary.INSTANCE;
        } else if (type instanceof DateType) {
            return new ArrowType.Date(DateUnit.DAY);
        } else {
            return new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
        }
    }

    /**
     * Converts an Arrow type to a nullduck DataType.
     *
     * <p>This is the reverse operation of {@link #toArrowType(DataType)}.
     *
     * @param arrowType the Arrow type
     * @return the nullduck data type
     * @throws UnsupportedOperationException if the Arrow type has no counterpart
     */
    public static DataType fromArrowType(ArrowType arrowType) {
        if (arrowType == null) {
            throw new IllegalArgumentException("arrowType must not be null");
        }

        switch (arrowType.getTypeID()) {
            case Null: return DataTypes.NULL;
            case Bool: return DataTypes.BOOLEAN;
            case Int:
                ArrowType.Int intType = (ArrowType.Int) arrowType;
                if (!intType.getIsSigned()) {
                    throw new UnsupportedOperationException("Unsigned integers are not supported: " + arrowType);
                }
                switch (intType.getBitWidth()) {
                    case 8: return DataTypes.INT8;
                    case 16: return DataTypes.INT16;
                    case 32: return DataTypes.INT32;
                    case 64: return DataTypes.INT64;
                    default:
                        throw new UnsupportedOperationException("Unsupported integer width: " + arrowType);
                }
            case FloatingPoint:
                ArrowType.FloatingPoint fpType = (ArrowType.FloatingPoint) arrowType;
                switch (fpType.getPrecision()) {
                    case SINGLE: return DataTypes.FLOAT32;
                    case DOUBLE: return DataTypes.FLOAT64;
                    default:
                        throw new UnsupportedOperationException("Unsupported float precision: " + arrowType);
                }
            case Utf8: return DataTypes.UTF8;
            case Binary: return DataTypes.BINARY;
            case Date:
                if (((ArrowType.Date) arrowType).getUnit() != DateUnit.DAY) {
                    throw new UnsupportedOperationException("Only DAY dates are supported: " + arrowType);
                }
                return DataTypes.DATE;
            case Timestamp:
                ArrowType.Timestamp tsType = (ArrowType.Timestamp) arrowType;
                if (tsType.getUnit() != TimeUnit.MICROSECOND || tsType.getTimezone() != null) {
                    throw new UnsupportedOperationException(
                        "Only zone-less MICROSECOND timestamps are supported: " + arrowType);
                }
                return DataTypes.TIMESTAMP;
            default:
                throw new UnsupportedOperationException("Unsupported Arrow type: " + arrowType);
        }
    }
}
