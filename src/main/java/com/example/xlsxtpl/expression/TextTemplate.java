package com.example.xlsxtpl.expression;

import com.example.xlsxtpl.core.ContextScope;
import com.example.xlsxtpl.core.LoopRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed text of a mixed cell: literals, {@code {{ expr }}} substitutions and
 * inline {@code if / elif / else / endif} and {@code for / else / endfor} tags.
 *
 * A {@code -} next to a delimiter trims the whitespace of the adjacent literal.
 */
final class TextTemplate {

    private static final Pattern TAG =
            Pattern.compile("\\{\\{(-?)(.*?)(-?)\\}\\}|\\{%(-?)(.*?)(-?)%\\}", Pattern.DOTALL);
    private static final Pattern FOR = Pattern.compile("^for\\s+(\\w+)\\s+in\\s+(.+)$", Pattern.DOTALL);
    private static final Pattern CONDITION = Pattern.compile("^(if|elif)\\s+(.+)$", Pattern.DOTALL);

    /** Renders one node into the output */
    interface Node {
        void render(Renderer renderer, ContextScope scope, StringBuilder out);
    }

    /** What the nodes need from the evaluator */
    interface Renderer {
        Object evaluate(String expression, ContextScope scope);

        String loopVariable();
    }

    private final List<Node> nodes;

    private TextTemplate(List<Node> nodes) {
        this.nodes = nodes;
    }

    String render(Renderer renderer, ContextScope scope) {
        StringBuilder out = new StringBuilder();
        renderAll(nodes, renderer, scope, out);
        return out.toString();
    }

    static TextTemplate parse(String template) {
        return new TextTemplate(new Parser(template, tokenize(template)).nodes(Collections.emptySet()));
    }

    private static void renderAll(List<Node> nodes, Renderer renderer, ContextScope scope, StringBuilder out) {
        for (Node node : nodes) {
            node.render(renderer, scope, out);
        }
    }

    private static List<Token> tokenize(String template) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = TAG.matcher(template);
        int last = 0;
        boolean stripLeading = false;
        while (m.find()) {
            boolean expression = m.group(2) != null;
            String literal = template.substring(last, m.start());
            if (stripLeading) {
                literal = literal.stripLeading();
            }
            if (!(expression ? m.group(1) : m.group(4)).isEmpty()) {
                literal = literal.stripTrailing();
            }
            if (!literal.isEmpty()) {
                tokens.add(new Token(TokenType.TEXT, literal));
            }
            if (expression) {
                tokens.add(new Token(TokenType.EXPRESSION, m.group(2).trim()));
            } else {
                tokens.add(new Token(TokenType.STATEMENT, m.group(5).trim()));
            }
            stripLeading = !(expression ? m.group(3) : m.group(6)).isEmpty();
            last = m.end();
        }
        String tail = template.substring(last);
        if (stripLeading) {
            tail = tail.stripLeading();
        }
        if (!tail.isEmpty()) {
            tokens.add(new Token(TokenType.TEXT, tail));
        }
        return tokens;
    }

    private enum TokenType {
        TEXT, EXPRESSION, STATEMENT
    }

    private static final class Token {
        final TokenType type;
        final String text;

        Token(TokenType type, String text) {
            this.type = type;
            this.text = text;
        }

        String keyword() {
            int space = 0;
            while (space < text.length() && !Character.isWhitespace(text.charAt(space))) {
                space++;
            }
            return text.substring(0, space);
        }
    }

    private static final class Parser {
        private final String template;
        private final List<Token> tokens;
        private int next;

        Parser(String template, List<Token> tokens) {
            this.template = template;
            this.tokens = tokens;
        }

        boolean hasNext() {
            return next < tokens.size();
        }

        Token peek() {
            return tokens.get(next);
        }

        /**
         * Nodes up to, not including, a statement whose keyword is in
         * {@code terminators}.
         */
        List<Node> nodes(Set<String> terminators) {
            List<Node> nodes = new ArrayList<>();
            while (hasNext()) {
                Token token = peek();
                if (token.type == TokenType.STATEMENT && terminators.contains(token.keyword())) {
                    break;
                }
                next++;
                switch (token.type) {
                    case TEXT:
                        nodes.add((renderer, scope, out) -> out.append(token.text));
                        break;
                    case EXPRESSION:
                        nodes.add(expression(token.text));
                        break;
                    default:
                        nodes.add(statement(token));
                        break;
                }
            }
            return nodes;
        }

        private Node statement(Token token) {
            switch (token.keyword()) {
                case "if":
                    return conditional(token);
                case "for":
                    return loop(token);
                default:
                    throw new ExpressionEvaluationException(
                            "Unexpected '{% " + token.text + " %}' in '" + template + "'");
            }
        }

        private Node conditional(Token opening) {
            List<String> conditions = new ArrayList<>();
            List<List<Node>> branches = new ArrayList<>();
            Token current = opening;
            while (true) {
                Matcher m = CONDITION.matcher(current.text);
                if (current.keyword().equals("else")) {
                    requireBare(current);
                    conditions.add(null);
                } else if (m.matches()) {
                    conditions.add(m.group(2).trim());
                } else {
                    throw new ExpressionEvaluationException(
                            "Malformed '{% " + current.text + " %}' in '" + template + "'");
                }
                boolean last = current.keyword().equals("else");
                branches.add(nodes(last ? Set.of("endif") : Set.of("elif", "else", "endif")));
                current = closing(opening);
                if (current.keyword().equals("endif")) {
                    requireBare(current);
                    break;
                }
            }
            return (renderer, scope, out) -> {
                for (int i = 0; i < conditions.size(); i++) {
                    String condition = conditions.get(i);
                    if (condition == null || TemplateValues.isTruthy(renderer.evaluate(condition, scope))) {
                        renderAll(branches.get(i), renderer, scope, out);
                        return;
                    }
                }
            };
        }

        private Node loop(Token opening) {
            Matcher m = FOR.matcher(opening.text);
            if (!m.matches()) {
                throw new ExpressionEvaluationException(
                        "Malformed '{% " + opening.text + " %}' in '" + template + "'");
            }
            String variable = m.group(1);
            String iterable = m.group(2).trim();
            List<Node> body = nodes(Set.of("else", "endfor"));
            List<Node> otherwise = Collections.emptyList();
            Token current = closing(opening);
            if (current.keyword().equals("else")) {
                requireBare(current);
                otherwise = nodes(Set.of("endfor"));
                current = closing(opening);
            }
            if (!current.keyword().equals("endfor")) {
                throw new ExpressionEvaluationException(
                        "Unexpected '{% " + current.text + " %}' in '" + template + "'");
            }
            requireBare(current);
            List<Node> emptyBody = otherwise;
            return (renderer, scope, out) -> {
                List<Object> items = TemplateValues.toItems(renderer.evaluate(iterable, scope));
                if (items.isEmpty()) {
                    renderAll(emptyBody, renderer, scope, out);
                    return;
                }
                for (int i = 0; i < items.size(); i++) {
                    Map<String, Object> layer = new LinkedHashMap<>();
                    layer.put(variable, items.get(i));
                    layer.put(renderer.loopVariable(), LoopRecord.of(i, items.size()));
                    renderAll(body, renderer, scope.with(layer), out);
                }
            };
        }

        private Token closing(Token opening) {
            if (!hasNext()) {
                throw new ExpressionEvaluationException(
                        "Unclosed '{% " + opening.text + " %}' in '" + template + "'");
            }
            return tokens.get(next++);
        }

        private void requireBare(Token token) {
            if (!token.text.equals(token.keyword())) {
                throw new ExpressionEvaluationException(
                        "Malformed '{% " + token.text + " %}' in '" + template + "'");
            }
        }
    }

    private static Node expression(String expression) {
        return (renderer, scope, out) -> {
            Object value = renderer.evaluate(expression, scope);
            if (value != null) {
                out.append(value);
            }
        };
    }
}
