package com.example.xlsxtpl.expression;

import java.util.List;

/**
 * Named transform applied with the pipe syntax {@code value | name(args)}.
 */
@FunctionalInterface
public interface TemplateFilter {

    Object apply(Object value, List<Object> arguments);
}
