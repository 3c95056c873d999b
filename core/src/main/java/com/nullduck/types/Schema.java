package com.nullduck.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered set of named, typed columns.
 *
 * <p>The schema is the only input the type resolver needs: it maps each column name
 * to its {@link DataType}. Column names are unique and matched exactly.
 */
public final class Schema {

    /** Empty schema with no fields. */
    public static final Schema EMPTY = new Schema(Collections.emptyList());

    private final List<StructField> fields;
    private final Map<String, StructField> byName;

    /**
     * Creates a schema with the given fields.
     *
     * @param fields the fields, in column order
     * @throws IllegalArgumentException if two fields share a name
     */
    public Schema(List<StructField> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        this.byName = new LinkedHashMap<>();
        for (StructField field : fields) {
            if (byName.put(field.name(), field) != null) {
                throw new IllegalArgumentException("duplicate column name: " + field.name());
            }
        }
    }

    /**
     * Creates a schema with the given fields.
     *
     * @param fields the fields, in column order
     */
    public Schema(StructField... fields) {
        this(Arrays.asList(fields));
    }

    /**
     * Returns the fields in this schema.
     *
     * @return an unmodifiable list of fields
     */
    public List<StructField> fields() {
        return fields;
    }

    /**
     * Returns the number of fields in this schema.
     *
     * @return the field count
     */
    public int size() {
        return fields.size();
    }

    /**
     * Looks up a column's type.
     *
     * @param name the column name
     * @return the column's data type, or empty if the schema has no such column
     */
    public Optional<DataType> lookup(String name) {
        StructField field = byName.get(name);
        return field != null ? Optional.of(field.dataType()) : Optional.empty();
    }

    /**
     * Returns the column names, in order.
     *
     * @return the field names
     */
    public List<String> fieldNames() {
        return new ArrayList<>(byName.keySet());
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Schema)) return false;
        Schema that = (Schema) obj;
        return fields.equals(that.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Schema(");
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(fields.get(i));
        }
        sb.append(")");
        return sb.toString();
    }
}
