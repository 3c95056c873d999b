package com.nullduck.types;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Supertype lattice over the {@link DataTypes} catalog.
 *
 * <p>The lattice is a closed lookup table built once at class initialization. It is
 * the only cross-type compatibility rule the null-fill subsystem consults: value-based
 * {@code fill_null} is legal exactly when {@link #supertype(DataType, DataType)} is present.
 *
 * <h2>Rules</h2>
 * <ul>
 *   <li>Reflexive: {@code supertype(a, a) = a}</li>
 *   <li>Null is bottom: {@code supertype(null, a) = a}</li>
 *   <li>Integers widen: int8 &lt; int16 &lt; int32 &lt; int64</li>
 *   <li>Floats widen: float32 &lt; float64</li>
 *   <li>Integer and float: int8/int16 with float32 gives float32; int32/int64 with
 *       float32 gives float64; any integer with float64 gives float64</li>
 *   <li>Temporal: date with timestamp gives timestamp</li>
 *   <li>Everything else (e.g. binary with boolean, utf8 with int64) has no supertype</li>
 * </ul>
 *
 * <p>Every rule is registered in both directions, so the table is commutative by
 * construction.
 */
public final class TypeLattice {

    private static final List<DataType> INTEGRALS = List.of(
        DataTypes.INT8, DataTypes.INT16, DataTypes.INT32, DataTypes.INT64);

    private static final Map<DataType, Map<DataType, DataType>> SUPERTYPES = buildTable();

    private TypeLattice() {} // Utility class

    /**
     * Returns the minimal type both operands can be promoted to.
     *
     * @param a the first type
     * @param b the second type
     * @return the supertype, or empty if the types are incompatible
     */
    public static Optional<DataType> supertype(DataType a, DataType b) {
        if (a == null || b == null) {
            throw new IllegalArgumentException("types must not be null");
        }
        Map<DataType, DataType> row = SUPERTYPES.get(a);
        return row != null ? Optional.ofNullable(row.get(b)) : Optional.empty();
    }

    /**
     * Returns whether two types have a common supertype.
     *
     * @param a the first type
     * @param b the second type
     * @return true if {@link #supertype(DataType, DataType)} is present
     */
    public static boolean hasSupertype(DataType a, DataType b) {
        return supertype(a, b).isPresent();
    }

    /**
     * Returns whether values of {@code from} can be promoted to {@code to}, i.e. whether
     * {@code to} is the supertype of the pair.
     *
     * @param from the source type
     * @param to the target type
     * @return true if {@code supertype(from, to) == to}
     */
    public static boolean canWiden(DataType from, DataType to) {
        return supertype(from, to).map(to::equals).orElse(false);
    }

    private static Map<DataType, Map<DataType, DataType>> buildTable() {
        Map<DataType, Map<DataType, DataType>> table = new HashMap<>();

        for (DataType type : DataTypes.all()) {
            register(table, type, type, type);
            register(table, DataTypes.NULL, type, type);
        }

        // Integer ladder: the wider of the two wins
        for (int i = 0; i < INTEGRALS.size(); i++) {
            for (int j = i + 1; j < INTEGRALS.size(); j++) {
                register(table, INTEGRALS.get(i), INTEGRALS.get(j), INTEGRALS.get(j));
            }
        }

        register(table, DataTypes.FLOAT32, DataTypes.FLOAT64, DataTypes.FLOAT64);

        // float32 only holds int8/int16 exactly; wider integers go to float64
        register(table, DataTypes.INT8, DataTypes.FLOAT32, DataTypes.FLOAT32);
        register(table, DataTypes.INT16, DataTypes.FLOAT32, DataTypes.FLOAT32);
        register(table, DataTypes.INT32, DataTypes.FLOAT32, DataTypes.FLOAT64);
        register(table, DataTypes.INT64, DataTypes.FLOAT32, DataTypes.FLOAT64);
        for (DataType integral : INTEGRALS) {
            register(table, integral, DataTypes.FLOAT64, DataTypes.FLOAT64);
        }

        register(table, DataTypes.DATE, DataTypes.TIMESTAMP, DataTypes.TIMESTAMP);

        return table;
    }

    private static void register(Map<DataType, Map<DataType, DataType>> table,
                                 DataType a, DataType b, DataType result) {
        table.computeIfAbsent(a, k -> new HashMap<>()).put(b, result);
        table.computeIfAbsent(b, k -> new HashMap<>()).put(a, result);
    }
}
