package org.nodebook.compiler.evaluation;

import org.nodebook.graph.Identifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Recursive-descent parser for function expressions.
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := '-' unary | power
 * power      := primary ('^' unary)?
 * primary    := number | name | name '(' arguments ')' | '"' text '"' | '(' expression ')'
 * </pre>
 * Names and quoted names are normalized like attribute names, so {@code body_mass}
 * and {@code "body mass"} refer to the same attribute.
 */
public final class ExpressionParser {

    /** Supported functions and their arity; -1 means one or more, -2 means one or two. */
    private static final Map<String, Integer> FUNCTIONS = Map.of(
            "abs", 1, "sqrt", 1, "floor", 1, "ceil", 1, "pow", 2,
            "round", -2, "min", -1, "max", -1);

    private final String text;
    private int pos;

    private ExpressionParser(String text) {
        this.text = text;
    }

    /**
     * Parses an expression.
     *
     * @param text The expression text.
     * @return The expression tree.
     * @throws ExpressionException if the text is not a valid expression.
     */
    public static Expression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ExpressionException("Empty expression");
        }
        ExpressionParser parser = new ExpressionParser(text);
        Expression expression = parser.expression();
        parser.skipWhitespace();
        if (parser.pos < text.length()) {
            throw parser.error("Unexpected '" + text.charAt(parser.pos) + "'");
        }
        return expression;
    }

    private Expression expression() {
        Expression left = term();
        while (true) {
            char op = peek();
            if (op != '+' && op != '-') return left;
            pos++;
            left = new Expression.Binary(op, left, term());
        }
    }

    private Expression term() {
        Expression left = unary();
        while (true) {
            char op = peek();
            if (op != '*' && op != '/' && op != '%') return left;
            pos++;
            left = new Expression.Binary(op, left, unary());
        }
    }

    private Expression unary() {
        if (peek() == '-') {
            pos++;
            return new Expression.Negate(unary());
        }
        return power();
    }

    private Expression power() {
        Expression base = primary();
        if (peek() == '^') {
            pos++;
            return new Expression.Binary('^', base, unary());
        }
        return base;
    }

    private Expression primary() {
        char c = peek();
        if (c == '(') {
            pos++;
            Expression inner = expression();
            expect(')');
            return inner;
        }
        if (c == '"') {
            pos++;
            int end = text.indexOf('"', pos);
            if (end < 0) throw error("Unterminated quoted name");
            String name = text.substring(pos, end);
            pos = end + 1;
            if (name.isBlank()) throw error("Empty quoted name");
            return new Expression.Variable(Identifiers.normalize(name));
        }
        if (Character.isDigit(c) || c == '.') {
            return number();
        }
        if (Character.isLetter(c) || c == '_') {
            String name = name();
            if (peek() == '(') {
                pos++;
                return call(name);
            }
            return new Expression.Variable(Identifiers.normalize(name));
        }
        throw error(pos >= text.length() ? "Unexpected end of expression" : "Unexpected '" + c + "'");
    }

    private Expression call(String name) {
        String function = name.toLowerCase(Locale.ROOT);
        Integer arity = FUNCTIONS.get(function);
        if (arity == null) throw error("Unknown function '" + name + "'");
        List<Expression> arguments = new ArrayList<>();
        if (peek() != ')') {
            arguments.add(expression());
            while (peek() == ',') {
                pos++;
                arguments.add(expression());
            }
        }
        expect(')');
        int count = arguments.size();
        boolean ok = arity == -1 ? count >= 1 : arity == -2 ? count == 1 || count == 2 : count == arity;
        if (!ok) throw error("Wrong number of arguments for '" + function + "': " + count);
        return new Expression.Call(function, arguments);
    }

    private Expression number() {
        int start = pos;
        while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) pos++;
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) pos++;
            if (pos < text.length() && Character.isDigit(text.charAt(pos))) {
                while (pos < text.length() && Character.isDigit(text.charAt(pos))) pos++;
            } else {
                pos = mark;
            }
        }
        String literal = text.substring(start, pos);
        try {
            return new Expression.Constant(Double.parseDouble(literal));
        } catch (NumberFormatException e) {
            throw new ExpressionException("Malformed number '" + literal + "' at position " + start, e);
        }
    }

    private String name() {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_')) pos++;
        return text.substring(start, pos);
    }

    private void expect(char expected) {
        if (peek() != expected) throw error("Expected '" + expected + "'");
        pos++;
    }

    /** Skips whitespace and returns the next character, or 0 at the end. */
    private char peek() {
        skipWhitespace();
        return pos < text.length() ? text.charAt(pos) : 0;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) pos++;
    }

    private ExpressionException error(String message) {
        return new ExpressionException(message + " at position " + pos + " in '" + text + "'");
    }
}
