package com.nullduck.runtime;

import com.nullduck.array.ValidityArray;
import com.nullduck.expression.Expression;
import com.nullduck.types.Schema;
import com.nullduck.types.StructField;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered set of named columns of equal length.
 *
 * <p>A batch is the unit expressions are evaluated over: its {@link #schema()} is what
 * expressions are resolved against, and its columns are what the kernels run on.
 *
 * <p>Example usage:
 * <pre>
 *   RecordBatch batch = RecordBatch.builder()
 *       .column("input", ValidityArray.of(DataTypes.INT64, null, 1L, null))
 *       .build();
 *   RecordBatch out = batch.evalExpressionList(List.of(fillNull(col("input"), "forward")));
 *   out.toMap();   // {input=[null, 1, 1]}
 * </pre>
 */
public final class RecordBatch {

    private final Map<String, ValidityArray> columns;
    private final Schema schema;
    private final int length;

    private RecordBatch(Map<String, ValidityArray> columns) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(columns));

        List<StructField> fields = new ArrayList<>();
        int rows = -1;
        for (Map.Entry<String, ValidityArray> entry : columns.entrySet()) {
            ValidityArray column = Objects.requireNonNull(entry.getValue(),
                "column '" + entry.getKey() + "' must not be null");
            if (rows >= 0 && column.length() != rows) {
                throw new IllegalArgumentException(String.format(
                    "column '%s' has length %d, expected %d",
                    entry.getKey(), column.length(), rows));
            }
            rows = column.length();
            fields.add(new StructField(entry.getKey(), column.dataType()));
        }
        this.schema = new Schema(fields);
        this.length = Math.max(rows, 0);
    }

    /**
     * Creates a batch from named columns, in map iteration order.
     *
     * @param columns the columns
     * @return the batch
     * @throws IllegalArgumentException if the columns differ in length
     */
    public static RecordBatch of(Map<String, ValidityArray> columns) {
        Objects.requireNonNull(columns, "columns must not be null");
        return new RecordBatch(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Schema schema() {
        return schema;
    }

    /**
     * Returns the number of rows.
     *
     * @return the row count, 0 for a batch without columns
     */
    public int length() {
        return length;
    }

    public List<String> columnNames() {
        return new ArrayList<>(columns.keySet());
    }

    /**
     * Returns the named columns, in order.
     *
     * @return an unmodifiable view of the columns
     */
    public Map<String, ValidityArray> columns() {
        return columns;
    }

    /**
     * Returns a column by name.
     *
     * @param name the column name
     * @return the column
     * @throws IllegalArgumentException if there is no such column
     */
    public ValidityArray column(String name) {
        ValidityArray column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException(
                "No column '" + name + "'; available columns: " + columns.keySet());
        }
        return column;
    }

    /**
     * Converts every column to a list of values, {@code null} marking null slots.
     *
     * @return column name to values, in column order
     */
    public Map<String, List<Object>> toMap() {
        Map<String, List<Object>> result = new LinkedHashMap<>();
        columns.forEach((name, column) -> result.put(name, column.toList()));
        return result;
    }

    /**
     * Resolves and evaluates each expression on the caller's thread.
     *
     * @param expressions the expressions; output columns are named by
     *        {@link Expression#outputName()}
     * @return a batch with one column per expression
     * @see ExpressionEvaluator#evaluateAll(List, RecordBatch)
     */
    public RecordBatch evalExpressionList(List<? extends Expression> expressions) {
        try (ExpressionEvaluator evaluator = new ExpressionEvaluator(EvaluationConfig.sequential())) {
            return evaluator.evaluateAll(expressions, this);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RecordBatch)) return false;
        RecordBatch that = (RecordBatch) obj;
        return columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return "RecordBatch(rows=" + length + ", " + schema + ")";
    }

    /**
     * Builder adding columns in order.
     */
    public static final class Builder {

        private final Map<String, ValidityArray> columns = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Adds a column.
         *
         * @param name the column name
         * @param column the column data
         * @return this builder
         * @throws IllegalArgumentException if a column with that name was already added
         */
        public Builder column(String name, ValidityArray column) {
            Objects.requireNonNull(name, "name must not be null");
            if (columns.putIfAbsent(name, Objects.requireNonNull(column, "column must not be null")) != null) {
                throw new IllegalArgumentException("duplicate column name: " + name);
            }
            return this;
        }

        public RecordBatch build() {
            return new RecordBatch(columns);
        }
    }
}
