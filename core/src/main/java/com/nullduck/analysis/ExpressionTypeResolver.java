package com.nullduck.analysis;

import com.nullduck.exception.TypeResolutionException;
import com.nullduck.expression.ColumnReference;
import com.nullduck.expression.Expression;
import com.nullduck.expression.FillNanExpression;
import com.nullduck.expression.FillNullExpression;
import com.nullduck.expression.FillSpec;
import com.nullduck.expression.Literal;
import com.nullduck.expression.UnaryExpression;
import com.nullduck.types.DataType;
import com.nullduck.types.DataTypes;
import com.nullduck.types.NullType;
import com.nullduck.types.Schema;
import com.nullduck.types.TypeLattice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Static type resolution for null-semantics expressions.
 *
 * <p>Resolution looks only at operand types, never at data, and is referentially
 * transparent over (operator, operand types). Whatever it accepts evaluates without a
 * type error, and whatever it rejects would fail at evaluation.
 *
 * <h2>Type Resolution Rules</h2>
 * <ul>
 *   <li>Column reference: looked up in the schema; unknown columns fail</li>
 *   <li>Literal: its declared type</li>
 *   <li>{@code is_null(x)}, {@code not_null(x)}: boolean, for any x</li>
 *   <li>{@code is_nan(x)}, {@code not_nan(x)}: boolean, x must be float32/float64</li>
 *   <li>{@code fill_null(x, value=v)}: {@code supertype(x, v)}; fails if there is none</li>
 *   <li>{@code fill_null(x, strategy=s)}: exactly the type of x</li>
 *   <li>{@code fill_nan(x, v)}: the type of x; x must be float and v numeric or null</li>
 * </ul>
 */
public final class ExpressionTypeResolver {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionTypeResolver.class);

    private ExpressionTypeResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * Resolves an expression against a schema.
     *
     * @param expr the expression
     * @param schema the schema giving each column's type
     * @return the resolved expression tree
     * @throws TypeResolutionException if the expression is not legal for the schema's types
     */
    public static ResolvedExpression resolve(Expression expr, Schema schema) {
        if (expr == null) {
            throw new IllegalArgumentException("expr must not be null");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema must not be null");
        }

        ResolvedExpression resolved = resolveNode(expr, schema);
        logger.debug("Resolved {} to {}", expr, resolved.dataType());
        return resolved;
    }

    /**
     * Resolves an expression and returns only its output type.
     *
     * @param expr the expression
     * @param schema the schema giving each column's type
     * @return the output type
     * @throws TypeResolutionException if the expression is not legal for the schema's types
     */
    public static DataType resolveType(Expression expr, Schema schema) {
        return resolve(expr, schema).dataType();
    }

    // ========================================================================
    // Node Resolution
    // ========================================================================

    private static ResolvedExpression resolveNode(Expression expr, Schema schema) {
        if (expr instanceof ColumnReference) {
            return resolveColumn((ColumnReference) expr, schema);
        }

        if (expr instanceof Literal) {
            return leaf(expr, ((Literal) expr).dataType());
        }

        if (expr instanceof UnaryExpression) {
            return resolveUnary((UnaryExpression) expr, schema);
        }

        if (expr instanceof FillNullExpression) {
            return resolveFillNull((FillNullExpression) expr, schema);
        }

        if (expr instanceof FillNanExpression) {
            return resolveFillNan((FillNanExpression) expr, schema);
        }

        throw new TypeResolutionException(expr.getClass().getSimpleName(), null,
            "unsupported expression " + expr);
    }

    private static ResolvedExpression resolveColumn(ColumnReference column, Schema schema) {
        DataType type = schema.lookup(column.columnName())
            .orElseThrow(() -> new TypeResolutionException("col", null, String.format(
                "column '%s' not found in schema; available columns: %s",
                column.columnName(), schema.fieldNames())));
        return leaf(column, type);
    }

    private static ResolvedExpression resolveUnary(UnaryExpression expr, Schema schema) {
        ResolvedExpression operand = resolveNode(expr.operand(), schema);
        UnaryExpression.Operator operator = expr.operator();

        if (operator.requiresFloat() && !DataTypes.isFloating(operand.dataType())) {
            throw new TypeResolutionException(operator.functionName(),
                List.of(operand.dataType()),
                "operand must be float32 or float64");
        }
        return new ResolvedExpression(expr, DataTypes.BOOLEAN, List.of(operand));
    }

    private static ResolvedExpression resolveFillNull(FillNullExpression expr, Schema schema) {
        ResolvedExpression input = resolveNode(expr.input(), schema);
        FillSpec spec = expr.spec();

        if (spec instanceof FillSpec.ByStrategy) {
            // Strategy fills never change the type, not even to widen it
            return new ResolvedExpression(expr, input.dataType(), List.of(input));
        }

        ResolvedExpression value = resolveNode(((FillSpec.ByValue) spec).value(), schema);
        DataType supertype = TypeLattice.supertype(input.dataType(), value.dataType())
            .orElseThrow(() -> new TypeResolutionException("fill_null",
                Arrays.asList(input.dataType(), value.dataType()),
                "no common supertype"));
        return new ResolvedExpression(expr, supertype, List.of(input, value));
    }

    private static ResolvedExpression resolveFillNan(FillNanExpression expr, Schema schema) {
        ResolvedExpression input = resolveNode(expr.input(), schema);
        ResolvedExpression value = resolveNode(expr.value(), schema);
        List<DataType> operandTypes = Arrays.asList(input.dataType(), value.dataType());

        if (!DataTypes.isFloating(input.dataType())) {
            throw new TypeResolutionException("fill_nan", operandTypes,
                "input must be float32 or float64");
        }
        if (!DataTypes.isNumeric(value.dataType()) && !(value.dataType() instanceof NullType)) {
            throw new TypeResolutionException("fill_nan", operandTypes,
                "fill value must be numeric");
        }
        return new ResolvedExpression(expr, input.dataType(), List.of(input, value));
    }

    private static ResolvedExpression leaf(Expression expr, DataType type) {
        return new ResolvedExpression(expr, type, Collections.emptyList());
    }
}
