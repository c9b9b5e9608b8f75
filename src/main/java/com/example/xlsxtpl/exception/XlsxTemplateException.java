package com.example.xlsxtpl.exception;

/**
 * Base type for every failure raised while loading or rendering a template.
 */
public class XlsxTemplateException extends RuntimeException {

    public XlsxTemplateException(String message) {
        super(message);
    }

    public XlsxTemplateException(String message, Throwable cause) {
        super(message, cause);
    }
}
