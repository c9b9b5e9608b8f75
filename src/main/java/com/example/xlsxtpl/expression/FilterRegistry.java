package com.example.xlsxtpl.expression;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Filters available to expressions, keyed by name. Registering an existing
 * name replaces the previous filter.
 */
public class FilterRegistry {

    private final Map<String, TemplateFilter> filters = new ConcurrentHashMap<>();

    public FilterRegistry register(String name, TemplateFilter filter) {
        filters.put(name, filter);
        return this;
    }

    public TemplateFilter get(String name) {
        TemplateFilter filter = filters.get(name);
        if (filter == null) {
            throw new ExpressionEvaluationException("No filter named '" + name + "'");
        }
        return filter;
    }

    public boolean contains(String name) {
        return filters.containsKey(name);
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(filters.keySet());
    }
}
