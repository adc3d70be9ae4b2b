package com.vidnyan.lre.domain.expression;

/**
 * Raised for malformed expressions, type mismatches and unknown functions.
 * Never escapes {@link ExpressionEvaluator#evaluate(String)}.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
