package com.nullduck.exception;

import com.nullduck.types.DataType;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Exception thrown when an expression cannot be resolved against a schema.
 *
 * <p>Resolution failures are static: they are raised from operand types alone,
 * before any kernel touches data. Common causes:
 * <ul>
 *   <li>{@code fill_null} with a fill value that has no common supertype with the input</li>
 *   <li>{@code fill_nan}, {@code is_nan} or {@code not_nan} on a non-float input</li>
 *   <li>A column reference that is not in the schema</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       ResolvedExpression resolved = ExpressionTypeResolver.resolve(expr, schema);
 *   } catch (TypeResolutionException e) {
 *       System.err.println(e.getOperator() + ": " + e.getOperandTypes());
 *   }
 * </pre>
 *
 * @see com.nullduck.analysis.ExpressionTypeResolver
 */
public class TypeResolutionException extends RuntimeException {

    private final String operator;
    private final List<DataType> operandTypes;

    /**
     * Creates a type resolution exception.
     *
     * @param operator the operator that failed to resolve
     * @param operandTypes the operand types it was given
     * @param message the error message
     */
    public TypeResolutionException(String operator, List<DataType> operandTypes, String message) {
        super(formatMessage(operator, operandTypes, message));
        this.operator = operator;
        this.operandTypes = operandTypes == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(operandTypes);
    }

    /**
     * Returns the name of the operator that failed to resolve.
     *
     * @return the operator name, e.g. "fill_null"
     */
    public String getOperator() {
        return operator;
    }

    /**
     * Returns the operand types the operator was resolved with.
     *
     * @return the operand types, empty when resolution failed before any type was known
     */
    public List<DataType> getOperandTypes() {
        return operandTypes;
    }

    private static String formatMessage(String operator, List<DataType> operandTypes, String message) {
        if (operandTypes == null || operandTypes.isEmpty()) {
            return String.format("Cannot resolve %s: %s", operator, message);
        }
        String types = operandTypes.stream()
            .map(DataType::typeName)
            .collect(Collectors.joining(", "));
        return String.format("Cannot resolve %s(%s): %s", operator, types, message);
    }
}
