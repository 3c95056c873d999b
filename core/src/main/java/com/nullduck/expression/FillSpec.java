package com.nullduck.expression;

import com.nullduck.kernel.FillStrategy;

import java.util.Objects;

/**
 * How {@code fill_null} replaces nulls: either by a value or by a strategy, never both.
 *
 * <p>Value fills may widen the result to the supertype of the input and the value.
 * Strategy fills always keep the input's type.
 */
public sealed interface FillSpec permits FillSpec.ByValue, FillSpec.ByStrategy {

    /**
     * Fill nulls with the value of another expression (a literal or a column).
     *
     * @param value the fill expression
     */
    record ByValue(Expression value) implements FillSpec {
        public ByValue {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Fill nulls from the nearest valid neighbour in a scan direction.
     *
     * @param strategy the scan direction
     */
    record ByStrategy(FillStrategy strategy) implements FillSpec {
        public ByStrategy {
            Objects.requireNonNull(strategy, "strategy must not be null");
        }

        @Override
        public String toString() {
            return "strategy=" + strategy.literal();
        }
    }

    static FillSpec value(Expression value) {
        return new ByValue(value);
    }

    static FillSpec strategy(FillStrategy strategy) {
        return new ByStrategy(strategy);
    }
}
