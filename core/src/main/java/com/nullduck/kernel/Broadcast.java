package com.nullduck.kernel;

import com.nullduck.exception.LengthMismatchException;

/**
 * Length rules shared by binary kernels.
 *
 * <p>Two operands are compatible when their lengths are equal or when one of them has
 * length 1; the length-1 side is then repeated to the other's length. A length-1 right
 * operand against an empty left operand yields an empty result, but an empty right operand
 * never broadcasts a length-1 left operand down to nothing.
 */
final class Broadcast {

    private Broadcast() {} // Utility class

    /**
     * Returns the length of the result of a binary kernel.
     *
     * @param operator the operator name, for error reporting
     * @param leftLength the left operand's length
     * @param rightLength the right operand's length
     * @return the result length
     * @throws LengthMismatchException if the lengths are not compatible
     */
    static int resultLength(String operator, int leftLength, int rightLength) {
        if (leftLength == rightLength || rightLength == 1) {
            return leftLength;
        }
        if (leftLength == 1 && rightLength > 1) {
            return rightLength;
        }
        throw new LengthMismatchException(operator, leftLength, rightLength);
    }

    /**
     * Maps a result slot to the operand slot it reads from.
     *
     * @param operandLength the operand's length
     * @param index the result slot
     * @return {@code 0} for a broadcast operand, {@code index} otherwise
     */
    static int sourceIndex(int operandLength, int index) {
        return operandLength == 1 ? 0 : index;
    }
}
