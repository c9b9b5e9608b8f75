package com.example.xlsxtpl.exception;

import lombok.Getter;

/**
 * Failure to read a template workbook or its render data, or to write the output.
 * Carries a machine readable code alongside the description.
 */
@Getter
public class TemplateLoadingException extends XlsxTemplateException {

    private final String code;
    private final String description;

    public TemplateLoadingException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public TemplateLoadingException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }
}
