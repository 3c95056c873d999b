package com.nullduck.analysis;

import com.nullduck.expression.Expression;
import com.nullduck.types.DataType;

import java.util.List;
import java.util.Objects;

/**
 * An expression annotated with its statically resolved output type.
 *
 * <p>Each child is itself resolved, in the order of {@link Expression#children()}, so an
 * evaluator can check every intermediate result against the type the resolver
 * predicted. Instances are immutable; resolving again produces a new tree.
 *
 * @param expression the resolved expression
 * @param dataType the type the expression produces
 * @param children the resolved operands
 */
public record ResolvedExpression(Expression expression, DataType dataType,
                                 List<ResolvedExpression> children) {

    public ResolvedExpression {
        Objects.requireNonNull(expression, "expression must not be null");
        Objects.requireNonNull(dataType, "dataType must not be null");
        children = List.copyOf(children);
    }

    /**
     * Returns the resolved operand at {@code index}.
     *
     * @param index the operand position
     * @return the resolved child
     */
    public ResolvedExpression child(int index) {
        return children.get(index);
    }

    /**
     * Returns the name of the column this expression produces.
     *
     * @return the output name
     */
    public String outputName() {
        return expression.outputName();
    }

    @Override
    public String toString() {
        return expression + ": " + dataType;
    }
}
