package com.example.xlsxtpl.expression;

import java.util.Locale;
import java.util.Set;

/**
 * Rewrites pipe filters into SpEL function calls.
 *
 * A filter binds to the term directly on its left, so {@code items|length > 1}
 * compares the filtered length and {@code name|upper + '!'} concatenates after
 * filtering. {@code term|name(a, b)} becomes
 * {@code #filter(#filters, 'name', term, {a, b})}; {@code ||} stays the logical
 * or. Text without filters comes back unchanged.
 */
final class FilterTranslator {

    static final String FUNCTION_VARIABLE = "filter";
    static final String REGISTRY_VARIABLE = "filters";

    // textual SpEL operators are read like identifiers but never start a term
    private static final Set<String> OPERATOR_WORDS = Set.of(
            "and", "or", "not", "eq", "ne", "lt", "gt", "le", "ge",
            "div", "mod", "instanceof", "matches", "between");

    private final String source;
    private int pos;

    private FilterTranslator(String source) {
        this.source = source;
    }

    static String translate(String expression) {
        if (expression.isBlank()) {
            throw new ExpressionEvaluationException("Empty expression");
        }
        FilterTranslator translator = new FilterTranslator(expression);
        String translated = translator.sequence();
        if (translator.pos < expression.length()) {
            throw new ExpressionEvaluationException("Unbalanced '" + expression.charAt(translator.pos)
                    + "' at position " + translator.pos + " in '" + expression + "'");
        }
        return translated;
    }

    /**
     * Operands and operators up to the end of input or the closing bracket of
     * the enclosing group, which is left unconsumed.
     */
    private String sequence() {
        StringBuilder out = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (isClosing(c)) {
                break;
            }
            if (c == '|') {
                if (!at(pos + 1, '|')) {
                    throw new ExpressionEvaluationException(
                            "Filter without a value at position " + pos + " in '" + source + "'");
                }
                out.append("||");
                pos += 2;
            } else if (isIdentifierStart(c)) {
                int start = pos;
                String word = identifier();
                if (OPERATOR_WORDS.contains(word.toLowerCase(Locale.ROOT))) {
                    out.append(word);
                } else {
                    pos = start;
                    out.append(filters(term()));
                }
            } else if (c == '\'' || c == '"' || Character.isDigit(c) || isOpening(c)) {
                out.append(filters(term()));
            } else {
                out.append(c);
                pos++;
            }
        }
        return out.toString();
    }

    private String term() {
        StringBuilder out = new StringBuilder();
        char c = source.charAt(pos);
        if (c == '\'' || c == '"') {
            out.append(quoted());
        } else if (isOpening(c)) {
            out.append(group());
        } else if (Character.isDigit(c)) {
            out.append(number());
        } else {
            out.append(identifier());
        }
        // property, safe navigation, selection / projection, index and call suffixes
        while (pos < source.length()) {
            int save = pos;
            skipWhitespace();
            if (at(pos, '.') || (at(pos, '?') && at(pos + 1, '.'))) {
                out.append(source, save, pos);
                int dot = at(pos, '?') ? 2 : 1;
                out.append(source, pos, pos + dot);
                pos += dot;
                if (pos < source.length() && "?!^$".indexOf(source.charAt(pos)) >= 0 && at(pos + 1, '[')) {
                    out.append(source.charAt(pos++));
                    out.append(group());
                } else if (pos < source.length() && isIdentifierStart(source.charAt(pos))) {
                    out.append(identifier());
                }
            } else if (pos == save && (at(pos, '[') || at(pos, '('))) {
                out.append(group());
            } else {
                pos = save;
                break;
            }
        }
        return out.toString();
    }

    private String filters(String term) {
        String value = term;
        while (true) {
            int save = pos;
            skipWhitespace();
            if (!at(pos, '|') || at(pos + 1, '|')) {
                pos = save;
                return value;
            }
            pos++;
            skipWhitespace();
            if (pos >= source.length() || !isIdentifierStart(source.charAt(pos)) || source.charAt(pos) == '#') {
                throw new ExpressionEvaluationException("Malformed filter at position " + pos + " in '" + source + "'");
            }
            String name = identifier();
            String arguments = "";
            int beforeArguments = pos;
            skipWhitespace();
            if (at(pos, '(')) {
                pos++;
                arguments = sequence();
                expect(')');
            } else {
                pos = beforeArguments;
            }
            value = "#" + FUNCTION_VARIABLE + "(#" + REGISTRY_VARIABLE + ", '" + name + "', "
                    + value + ", {" + arguments + "})";
        }
    }

    private String group() {
        char open = source.charAt(pos++);
        String inner = sequence();
        char close = open == '(' ? ')' : open == '[' ? ']' : '}';
        expect(close);
        return open + inner + close;
    }

    private void expect(char close) {
        if (!at(pos, close)) {
            throw new ExpressionEvaluationException("Missing '" + close + "' in '" + source + "'");
        }
        pos++;
    }

    // SpEL doubles the quote character to escape it
    private String quoted() {
        char quote = source.charAt(pos);
        int start = pos++;
        while (pos < source.length()) {
            if (source.charAt(pos) == quote) {
                if (at(pos + 1, quote)) {
                    pos += 2;
                    continue;
                }
                pos++;
                return source.substring(start, pos);
            }
            pos++;
        }
        return source.substring(start);
    }

    private String number() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isLetterOrDigit(c) || c == '_'
                    || (c == '.' && pos + 1 < source.length() && Character.isDigit(source.charAt(pos + 1)))) {
                pos++;
            } else {
                break;
            }
        }
        return source.substring(start, pos);
    }

    private String identifier() {
        int start = pos++;
        while (pos < source.length()
                && (Character.isLetterOrDigit(source.charAt(pos)) || source.charAt(pos) == '_' || source.charAt(pos) == '$')) {
            pos++;
        }
        return source.substring(start, pos);
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
    }

    private boolean at(int index, char c) {
        return index < source.length() && source.charAt(index) == c;
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$' || c == '#' || c == '@';
    }

    private static boolean isOpening(char c) {
        return c == '(' || c == '[' || c == '{';
    }

    private static boolean isClosing(char c) {
        return c == ')' || c == ']' || c == '}';
    }
}
