package com.example.xlsxtpl.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognisers for the tag shapes a cell can carry.
 */
public final class CellTags {

    // whole cell is a single {{ expression }}; the lookahead keeps it from spanning two tags
    private static final Pattern PURE_EXPRESSION =
            Pattern.compile("^\\s*\\{\\{-?\\s*((?:(?!\\}\\}).)+?)\\s*-?\\}\\}\\s*$", Pattern.DOTALL);

    private static final Pattern ANY_TAG = Pattern.compile("\\{\\{.*?\\}\\}|\\{%.*?%\\}", Pattern.DOTALL);

    static final Pattern ROW_BLOCK =
            Pattern.compile("^\\s*\\{%[-\\s]*((?:(?!%\\}|\\{%).)*?)[-\\s]*%\\}\\s*$", Pattern.DOTALL);

    static final Pattern COLUMN_BLOCK =
            Pattern.compile("^\\s*\\{%col[-\\s]+((?:(?!%\\}|\\{%).)*?)[-\\s]*%\\}\\s*$", Pattern.DOTALL);

    private CellTags() {
    }

    /**
     * Inner expression when the whole value is exactly one {@code {{ expr }}}.
     */
    public static Optional<String> pureExpression(Object value) {
        if (!(value instanceof String)) {
            return Optional.empty();
        }
        Matcher m = PURE_EXPRESSION.matcher((String) value);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }

    public static boolean hasTemplateTag(Object value) {
        return value instanceof String && ANY_TAG.matcher((String) value).find();
    }

    /**
     * True when the value is a lone row or column block tag, whether or not its
     * keyword is recognised. Such cells are never rendered as expressions.
     */
    public static boolean isBlockTag(Object value) {
        if (!(value instanceof String)) {
            return false;
        }
        String text = (String) value;
        return ROW_BLOCK.matcher(text).matches() || COLUMN_BLOCK.matcher(text).matches();
    }
}
