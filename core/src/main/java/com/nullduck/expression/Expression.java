package com.nullduck.expression;

import java.util.List;

/**
 * Base interface for all expressions handled by the null-semantics subsystem.
 *
 * <p>Expressions are built by the surrounding engine (see {@link Functions}) and carry
 * no type of their own: a column reference only knows its name. Types are assigned by
 * {@link com.nullduck.analysis.ExpressionTypeResolver} against a schema, producing a
 * {@link com.nullduck.analysis.ResolvedExpression}.
 *
 * <p>Expressions are immutable value objects; all concrete implementations in this
 * package are {@code final}.
 */
public interface Expression {

    /**
     * Returns the direct operands of this expression.
     *
     * @return the children, empty for leaves
     */
    List<Expression> children();

    /**
     * Returns the name of the column this expression produces when evaluated over a batch.
     *
     * <p>Derived expressions keep the name of their leftmost input.
     *
     * @return the output column name
     */
    String outputName();
}
