package com.example.xlsxtpl.exception;

/**
 * Raised when the block structure of a sheet is invalid: a closing tag that does
 * not match its opener, or an opener that is never closed.
 */
public class TemplateSyntaxException extends XlsxTemplateException {

    public TemplateSyntaxException(String message) {
        super(message);
    }
}
