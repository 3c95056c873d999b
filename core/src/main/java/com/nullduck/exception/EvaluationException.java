package com.nullduck.exception;

/**
 * Exception thrown when evaluating an expression or running a kernel fails.
 *
 * <p>Evaluation failures are dynamic: they depend on the concrete operands bound at
 * run time, not on their types. A resolved expression evaluated over well-typed,
 * well-shaped columns never raises this exception. Kernels invoked directly with
 * operands the resolver would have rejected also fail with it.
 *
 * @see OperandKindException
 * @see LengthMismatchException
 */
public class EvaluationException extends RuntimeException {

    private final String operator;

    /**
     * Creates an evaluation exception.
     *
     * @param operator the operator being evaluated
     * @param message the error message
     */
    public EvaluationException(String operator, String message) {
        super(operator + ": " + message);
        this.operator = operator;
    }

    /**
     * Returns the name of the operator being evaluated.
     *
     * @return the operator name
     */
    public String getOperator() {
        return operator;
    }
}
