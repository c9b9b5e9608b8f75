package com.example.xlsxtpl.exception;

/**
 * Raised when an iterable, condition or cell expression fails to evaluate.
 * The message names the expression and the grid coordinate it came from.
 */
public class TemplateRenderException extends XlsxTemplateException {

    public TemplateRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
