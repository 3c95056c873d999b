package com.nullduck.expression;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Expression replacing the nulls of its input, by value or by strategy.
 *
 * <p>Examples:
 * <pre>
 *   fill_null(col(a), lit(999))
 *   fill_null(col(a), col(b))
 *   fill_null(col(a), strategy=forward)
 * </pre>
 */
public final class FillNullExpression implements Expression {

    private final Expression input;
    private final FillSpec spec;

    /**
     * Creates a fill_null expression.
     *
     * @param input the expression whose nulls are replaced
     * @param spec the fill value or strategy
     */
    public FillNullExpression(Expression input, FillSpec spec) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.spec = Objects.requireNonNull(spec, "spec must not be null");
    }

    public Expression input() {
        return input;
    }

    public FillSpec spec() {
        return spec;
    }

    @Override
    public List<Expression> children() {
        if (spec instanceof FillSpec.ByValue) {
            return Arrays.asList(input, ((FillSpec.ByValue) spec).value());
        }
        return Collections.singletonList(input);
    }

    @Override
    public String outputName() {
        return input.outputName();
    }

    @Override
    public String toString() {
        return "fill_null(" + input + ", " + spec + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FillNullExpression)) return false;
        FillNullExpression that = (FillNullExpression) obj;
        return input.equals(that.input) && spec.equals(that.spec);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, spec);
    }
}
