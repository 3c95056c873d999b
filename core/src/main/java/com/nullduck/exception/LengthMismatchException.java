package com.nullduck.exception;

/**
 * Thrown when two operand arrays have different lengths and neither is a
 * broadcastable length-1 array.
 */
public class LengthMismatchException extends EvaluationException {

    private final int leftLength;
    private final int rightLength;

    public LengthMismatchException(String operator, int leftLength, int rightLength) {
        super(operator, String.format(
            "operand lengths %d and %d do not match and neither can be broadcast",
            leftLength, rightLength));
        this.leftLength = leftLength;
        this.rightLength = rightLength;
    }

    public int getLeftLength() {
        return leftLength;
    }

    public int getRightLength() {
        return rightLength;
    }
}
