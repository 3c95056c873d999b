package com.nullduck.exception;

/**
 * Thrown when an operand is bound to something that is not an array, e.g. a plain
 * {@link java.util.List} where a {@link com.nullduck.array.ValidityArray} is required.
 */
public class OperandKindException extends EvaluationException {

    private final String expectedKind;
    private final String actualKind;

    public OperandKindException(String operator, String expectedKind, String actualKind) {
        super(operator, String.format("expected %s but got %s", expectedKind, actualKind));
        this.expectedKind = expectedKind;
        this.actualKind = actualKind;
    }

    public String getExpectedKind() {
        return expectedKind;
    }

    public String getActualKind() {
        return actualKind;
    }
}
