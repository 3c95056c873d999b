package com.nullduck.expression;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a null or NaN predicate over one operand.
 *
 * <p>Unary expressions include:
 * <ul>
 *   <li>IS NULL: {@code is_null(a)}</li>
 *   <li>NOT NULL: {@code not_null(a)}</li>
 *   <li>IS NAN: {@code is_nan(a)}, floats only</li>
 *   <li>NOT NAN: {@code not_nan(a)}, floats only</li>
 * </ul>
 *
 * <p>All four produce booleans.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        IS_NULL("is_null"),
        NOT_NULL("not_null"),
        IS_NAN("is_nan"),
        NOT_NAN("not_nan");

        private final String functionName;

        Operator(String functionName) {
            this.functionName = functionName;
        }

        public String functionName() {
            return functionName;
        }

        /**
         * Returns whether the operator only accepts floating point operands.
         */
        public boolean requiresFloat() {
            return this == IS_NAN || this == NOT_NAN;
        }
    }

    private final Operator operator;
    private final Expression operand;

    /**
     * Creates a unary expression.
     *
     * @param operator the operator
     * @param operand the operand
     */
    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public List<Expression> children() {
        return Collections.singletonList(operand);
    }

    @Override
    public String outputName() {
        return operand.outputName();
    }

    @Override
    public String toString() {
        return operator.functionName() + "(" + operand + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator &&
               Objects.equals(operand, that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    // ==================== Factory Methods ====================

    public static UnaryExpression isNull(Expression operand) {
        return new UnaryExpression(Operator.IS_NULL, operand);
    }

    public static UnaryExpression notNull(Expression operand) {
        return new UnaryExpression(Operator.NOT_NULL, operand);
    }

    public static UnaryExpression isNan(Expression operand) {
        return new UnaryExpression(Operator.IS_NAN, operand);
    }

    public static UnaryExpression notNan(Expression operand) {
        return new UnaryExpression(Operator.NOT_NAN, operand);
    }
}
