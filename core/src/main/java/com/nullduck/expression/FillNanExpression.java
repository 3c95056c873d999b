package com.nullduck.expression;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Expression replacing the NaN slots of a float input with a numeric value.
 *
 * <p>Null slots of the input are not NaN and stay null.
 */
public final class FillNanExpression implements Expression {

    private final Expression input;
    private final Expression value;

    public FillNanExpression(Expression input, Expression value) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public Expression input() {
        return input;
    }

    public Expression value() {
        return value;
    }

    @Override
    public List<Expression> children() {
        return Arrays.asList(input, value);
    }

    @Override
    public String outputName() {
        return input.outputName();
    }

    @Override
    public String toString() {
        return "fill_nan(" + input + ", " + value + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FillNanExpression)) return false;
        FillNanExpression that = (FillNanExpression) obj;
        return input.equals(that.input) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(input, value);
    }
}
