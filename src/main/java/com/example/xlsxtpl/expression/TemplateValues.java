package com.example.xlsxtpl.expression;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Truthiness and iteration rules shared by conditions and loops.
 */
public final class TemplateValues {

    private TemplateValues() {
    }

    /**
     * Null, false, numeric zero and empty strings, collections, maps and arrays
     * are false; everything else is true.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).signum() != 0;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0d;
        }
        if (value instanceof CharSequence) {
            return ((CharSequence) value).length() > 0;
        }
        if (value instanceof Collection) {
            return !((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return !((Map<?, ?>) value).isEmpty();
        }
        if (value.getClass().isArray()) {
            return Array.getLength(value) > 0;
        }
        return true;
    }

    /**
     * Materialises a loop source: collections and iterables in their order,
     * arrays element by element, maps by key and strings by character.
     *
     * @throws ExpressionEvaluationException for null and any other type
     */
    public static List<Object> toItems(Object value) {
        if (value == null) {
            throw new ExpressionEvaluationException("Value is null, which is not iterable");
        }
        List<Object> items = new ArrayList<>();
        if (value instanceof Map) {
            items.addAll(((Map<?, ?>) value).keySet());
        } else if (value instanceof Iterable) {
            for (Object item : (Iterable<?>) value) {
                items.add(item);
            }
        } else if (value.getClass().isArray()) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
        } else if (value instanceof CharSequence) {
            ((CharSequence) value).codePoints().forEach(cp -> items.add(new String(Character.toChars(cp))));
        } else {
            throw new ExpressionEvaluationException(value.getClass().getSimpleName() + " is not iterable");
        }
        return items;
    }
}
