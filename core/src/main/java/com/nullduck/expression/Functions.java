package com.nullduck.expression;

import com.nullduck.kernel.FillStrategy;

/**
 * Static builders for null-semantics expressions.
 *
 * <p>Example usage:
 * <pre>
 *   import static com.nullduck.expression.Functions.*;
 *
 *   fillNull(col("price"), lit(0.0));
 *   fillNull(col("price"), "forward");
 *   fillNan(col("ratio"), lit(1.0));
 * </pre>
 */
public final class Functions {

    private Functions() {} // Utility class

    public static ColumnReference col(String name) {
        return ColumnReference.of(name);
    }

    /**
     * Creates a literal, inferring its type from the value's class.
     *
     * @param value the value; {@code null} gives the untyped null literal
     * @return the literal
     */
    public static Literal lit(Object value) {
        return Literal.of(value);
    }

    public static UnaryExpression isNull(Expression input) {
        return UnaryExpression.isNull(input);
    }

    public static UnaryExpression notNull(Expression input) {
        return UnaryExpression.notNull(input);
    }

    public static UnaryExpression isNan(Expression input) {
        return UnaryExpression.isNan(input);
    }

    public static UnaryExpression notNan(Expression input) {
        return UnaryExpression.notNan(input);
    }

    /**
     * Fills nulls with the values of another expression.
     *
     * @param input the expression to fill
     * @param value the fill value (a literal or a column)
     * @return the fill_null expression
     */
    public static FillNullExpression fillNull(Expression input, Expression value) {
        return new FillNullExpression(input, FillSpec.value(value));
    }

    /**
     * Fills nulls from the nearest valid neighbour.
     *
     * @param input the expression to fill
     * @param strategy the scan direction
     * @return the fill_null expression
     */
    public static FillNullExpression fillNull(Expression input, FillStrategy strategy) {
        return new FillNullExpression(input, FillSpec.strategy(strategy));
    }

    /**
     * Fills nulls from the nearest valid neighbour, with the strategy given as a literal.
     *
     * @param input the expression to fill
     * @param strategy "forward" or "backward"
     * @return the fill_null expression
     * @throws IllegalArgumentException if the strategy literal is not recognized
     */
    public static FillNullExpression fillNull(Expression input, String strategy) {
        return fillNull(input, FillStrategy.parse(strategy));
    }

    public static FillNanExpression fillNan(Expression input, Expression value) {
        return new FillNanExpression(input, value);
    }
}
