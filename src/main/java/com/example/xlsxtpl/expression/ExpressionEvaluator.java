package com.example.xlsxtpl.expression;

import com.example.xlsxtpl.core.ContextScope;

/**
 * Expression and text-template service used by the expansion engines.
 */
public interface ExpressionEvaluator {

    /**
     * Evaluates a single expression, returning its native value (numbers,
     * booleans, collections and nulls are not converted to text).
     */
    Object evaluate(String expression, ContextScope scope);

    /**
     * Renders text mixing literals and {@code {{ expr }}} tags into one string.
     */
    String render(String template, ContextScope scope);
}
