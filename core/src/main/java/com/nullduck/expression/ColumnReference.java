package com.nullduck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a reference to a column by name.
 *
 * <p>The column's type is not known until the reference is resolved against a schema.
 */
public final class ColumnReference implements Expression {

    private final String columnName;

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     */
    public ColumnReference(String columnName) {
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
    }

    public String columnName() {
        return columnName;
    }

    @Override
    public List<Expression> children() {
        return Collections.emptyList();
    }

    @Override
    public String outputName() {
        return columnName;
    }

    @Override
    public String toString() {
        return "col(" + columnName + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnReference)) return false;
        ColumnReference that = (ColumnReference) obj;
        return columnName.equals(that.columnName);
    }

    @Override
    public int hashCode() {
        return columnName.hashCode();
    }

    /**
     * Creates a column reference.
     *
     * @param columnName the column name
     * @return the column reference
     */
    public static ColumnReference of(String columnName) {
        return new ColumnReference(columnName);
    }
}
