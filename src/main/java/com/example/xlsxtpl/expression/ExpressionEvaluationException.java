package com.example.xlsxtpl.expression;

/**
 * Failure to parse or evaluate an expression, or to apply one of its filters.
 */
public class ExpressionEvaluationException extends RuntimeException {

    public ExpressionEvaluationException(String message) {
        super(message);
    }

    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
