package com.profitrate.reconciliation.identity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An arithmetic formula over named variables, e.g. {@code SP / (K * u)}.
 *
 * <p>Grammar:</p>
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := '-' factor | number | identifier | '(' expr ')'
 * </pre>
 *
 * <p>Identifiers match {@code [A-Za-z_][A-Za-z0-9_]*}. Evaluation uses IEEE double
 * arithmetic, so division by zero yields an infinite or NaN result that callers must
 * check.</p>
 */
public final class Formula {
    private final String text;
    private final Expression root;
    private final List<String> variables;

    private Formula(String text, Expression root, List<String> variables) {
        this.text = text;
        this.root = root;
        this.variables = List.copyOf(variables);
    }

    /**
     * Parses a formula.
     *
     * @throws FormulaParseException on a syntax error
     */
    public static Formula parse(String text) {
        Objects.requireNonNull(text, "formula text is required");
        Parser parser = new Parser(text);
        Expression root = parser.parse();
        return new Formula(text.trim(), root, new ArrayList<>(parser.variables));
    }

    /**
     * Evaluates the formula.
     *
     * @param values value of every variable in {@link #getVariables()}
     * @throws IllegalArgumentException if a variable has no value
     */
    public double evaluate(Map<String, Double> values) {
        return root.evaluate(values);
    }

    public String getText() {
        return text;
    }

    /**
     * Variables referenced by the formula, in order of first appearance.
     */
    public List<String> getVariables() {
        return variables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Formula that)) return false;
        return text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }

    private interface Expression {
        double evaluate(Map<String, Double> values);
    }

    private record Constant(double value) implements Expression {
        @Override
        public double evaluate(Map<String, Double> values) {
            return value;
        }
    }

    private record Variable(String name) implements Expression {
        @Override
        public double evaluate(Map<String, Double> values) {
            Double value = values.get(name);
            if (value == null) {
                throw new IllegalArgumentException("No value for variable '" + name + "'");
            }
            return value;
        }
    }

    private record Negation(Expression operand) implements Expression {
        @Override
        public double evaluate(Map<String, Double> values) {
            return -operand.evaluate(values);
        }
    }

    private record Binary(char operator, Expression left, Expression right) implements Expression {
        @Override
        public double evaluate(Map<String, Double> values) {
            double l = left.evaluate(values);
            double r = right.evaluate(values);
            return switch (operator) {
                case '+' -> l + r;
                case '-' -> l - r;
                case '*' -> l * r;
                case '/' -> l / r;
                default -> throw new IllegalStateException("Unknown operator " + operator);
            };
        }
    }

    private static final class Parser {
        private final String text;
        private final Set<String> variables = new LinkedHashSet<>();
        private int pos;

        Parser(String text) {
            this.text = text;
        }

        Expression parse() {
            skipWhitespace();
            if (pos >= text.length()) {
                throw error("empty formula");
            }
            Expression expr = parseExpression();
            skipWhitespace();
            if (pos < text.length()) {
                throw error("unexpected '" + text.charAt(pos) + "'");
            }
            return expr;
        }

        private Expression parseExpression() {
            Expression left = parseTerm();
            while (true) {
                skipWhitespace();
                if (peek('+') || peek('-')) {
                    char op = text.charAt(pos++);
                    left = new Binary(op, left, parseTerm());
                } else {
                    return left;
                }
            }
        }

        private Expression parseTerm() {
            Expression left = parseFactor();
            while (true) {
                skipWhitespace();
                if (peek('*') || peek('/')) {
                    char op = text.charAt(pos++);
                    left = new Binary(op, left, parseFactor());
                } else {
                    return left;
                }
            }
        }

        private Expression parseFactor() {
            skipWhitespace();
            if (pos >= text.length()) {
                throw error("unexpected end of formula");
            }
            char c = text.charAt(pos);
            if (c == '-') {
                pos++;
                return new Negation(parseFactor());
            }
            if (c == '(') {
                pos++;
                Expression inner = parseExpression();
                skipWhitespace();
                if (!peek(')')) {
                    throw error("expected ')'");
                }
                pos++;
                return inner;
            }
            if (isDigit(c) || c == '.') {
                return parseNumber();
            }
            if (isIdentifierStart(c)) {
                int start = pos;
                while (pos < text.length()
                        && (isIdentifierStart(text.charAt(pos)) || isDigit(text.charAt(pos)))) {
                    pos++;
                }
                String name = text.substring(start, pos);
                variables.add(name);
                return new Variable(name);
            }
            throw error("unexpected '" + c + "'");
        }

        private static boolean isIdentifierStart(char c) {
            return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
        }

        private static boolean isDigit(char c) {
            return c >= '0' && c <= '9';
        }

        private Expression parseNumber() {
            int start = pos;
            while (pos < text.length() && (isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
                pos++;
            }
            if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
                pos++;
                if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                    pos++;
                }
                while (pos < text.length() && isDigit(text.charAt(pos))) {
                    pos++;
                }
            }
            String literal = text.substring(start, pos);
            try {
                return new Constant(Double.parseDouble(literal));
            } catch (NumberFormatException e) {
                throw new FormulaParseException(text, start, "bad number '" + literal + "'");
            }
        }

        private boolean peek(char c) {
            return pos < text.length() && text.charAt(pos) == c;
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        private FormulaParseException error(String message) {
            return new FormulaParseException(text, pos, message);
        }
    }
}
