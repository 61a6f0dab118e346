package com.testflow.testflow_runner.variable;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Restricted expression language used by conditional nodes and Math actions.
 *
 * <pre>
 *   or      := and ('or' and)*
 *   and     := not ('and' not)*
 *   not     := 'not' not | compare
 *   compare := sum (('=='|'!='|'>'|'<'|'>='|'<=') sum)*
 *   sum     := term (('+'|'-') term)*
 *   term    := unary (('*'|'/'|'//'|'%') unary)*
 *   unary   := ('+'|'-') unary | power
 *   power   := atom ('**' unary)?
 *   atom    := number | 'True' | 'False' | '(' or ')'
 * </pre>
 *
 * Values are {@link Double} or {@link Boolean}. {@code and} / {@code or} return the deciding
 * operand; {@code //} and {@code %} floor towards negative infinity. Anything outside the
 * grammar (names, calls, strings, subscripts) is rejected.
 */
@Slf4j
public final class ExpressionEvaluator {

    /** Deepest nesting of parentheses, {@code not} and signs accepted by the parser. */
    static final int MAX_DEPTH = 200;

    static final int MAX_TOKENS = 4096;

    private ExpressionEvaluator() {
    }

    public static Object evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionEvaluationException("Empty expression");
        }
        Parser parser = new Parser(tokenize(expression));
        Expr parsed = parser.or();
        if (!parser.atEnd()) {
            throw new ExpressionEvaluationException("Unexpected '" + parser.peek().text + "' in: " + expression);
        }
        return parsed.eval();
    }

    /** Conditional form: any failure evaluates to {@code false}. */
    public static boolean evaluateBoolean(String expression) {
        try {
            return truthy(evaluate(expression));
        } catch (ExpressionEvaluationException e) {
            log.warn("Condition '{}' evaluated as false: {}", expression, e.getMessage());
            return false;
        }
    }

    public static boolean truthy(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        return ((Double) value) != 0.0;
    }

    // ── Tokenizer ─────────────────────────────────────────────────────────────

    private enum Kind { NUMBER, OPERATOR, KEYWORD, LPAREN, RPAREN, END }

    private record Token(Kind kind, String text) { }

    private static final List<String> OPERATORS = List.of(
            "**", "//", "==", "!=", ">=", "<=", ">", "<", "+", "-", "*", "/", "%");

    private static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = expression.length();
        while (i < n) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(expression.charAt(i + 1)))) {
                int start = i;
                while (i < n && (Character.isDigit(expression.charAt(i)) || expression.charAt(i) == '.')) i++;
                if (i < n && (expression.charAt(i) == 'e' || expression.charAt(i) == 'E')) {
                    int mark = i++;
                    if (i < n && (expression.charAt(i) == '+' || expression.charAt(i) == '-')) i++;
                    if (i < n && Character.isDigit(expression.charAt(i))) {
                        while (i < n && Character.isDigit(expression.charAt(i))) i++;
                    } else {
                        i = mark;
                    }
                }
                tokens.add(new Token(Kind.NUMBER, expression.substring(start, i)));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) i++;
                String word = expression.substring(start, i);
                switch (word) {
                    case "and", "or", "not", "True", "False" -> tokens.add(new Token(Kind.KEYWORD, word));
                    default -> throw new ExpressionEvaluationException("Names are not allowed: " + word);
                }
            } else if (c == '(') {
                tokens.add(new Token(Kind.LPAREN, "("));
                i++;
            } else if (c == ')') {
                tokens.add(new Token(Kind.RPAREN, ")"));
                i++;
            } else {
                String operator = null;
                for (String candidate : OPERATORS) {
                    if (expression.startsWith(candidate, i)) {
                        operator = candidate;
                        break;
                    }
                }
                if (operator == null) {
                    throw new ExpressionEvaluationException("Unsupported character '" + c + "' in: " + expression);
                }
                tokens.add(new Token(Kind.OPERATOR, operator));
                i += operator.length();
            }
        }
        if (tokens.size() > MAX_TOKENS) {
            throw new ExpressionEvaluationException("Expression longer than " + MAX_TOKENS + " tokens");
        }
        tokens.add(new Token(Kind.END, ""));
        return tokens;
    }

    // ── Parser ────────────────────────────────────────────────────────────────

    /** Parsed sub-expression; evaluation is deferred so {@code and} / {@code or} can short-circuit. */
    @FunctionalInterface
    private interface Expr {
        Object eval();
    }

    private static final class Parser {

        private final List<Token> tokens;
        private int pos;
        private int depth;

        Parser(List<Token> tokens) {
            this.tokens = tokens;
        }

        Token peek() {
            return tokens.get(pos);
        }

        boolean atEnd() {
            return peek().kind == Kind.END;
        }

        private boolean accept(Kind kind, String text) {
            Token token = peek();
            if (token.kind == kind && token.text.equals(text)) {
                pos++;
                return true;
            }
            return false;
        }

        Expr or() {
            Expr left = and();
            while (accept(Kind.KEYWORD, "or")) {
                Expr l = left;
                Expr r = and();
                left = () -> {
                    Object value = l.eval();
                    return truthy(value) ? value : r.eval();
                };
            }
            return left;
        }

        Expr and() {
            Expr left = not();
            while (accept(Kind.KEYWORD, "and")) {
                Expr l = left;
                Expr r = not();
                left = () -> {
                    Object value = l.eval();
                    return truthy(value) ? r.eval() : value;
                };
            }
            return left;
        }

        Expr not() {
            if (accept(Kind.KEYWORD, "not")) {
                Expr operand = nested(this::not);
                return () -> !truthy(operand.eval());
            }
            return compare();
        }

        Expr compare() {
            Expr first = sum();
            List<String> operators = new ArrayList<>();
            List<Expr> operands = new ArrayList<>();
            operands.add(first);
            while (peek().kind == Kind.OPERATOR && isComparison(peek().text)) {
                operators.add(tokens.get(pos++).text);
                operands.add(sum());
            }
            if (operators.isEmpty()) {
                return first;
            }
            return () -> {
                double left = number(operands.get(0).eval());
                for (int i = 0; i < operators.size(); i++) {
                    double right = number(operands.get(i + 1).eval());
                    if (!compare(operators.get(i), left, right)) {
                        return Boolean.FALSE;
                    }
                    left = right;
                }
                return Boolean.TRUE;
            };
        }

        Expr sum() {
            Expr left = term();
            while (true) {
                Expr l = left;
                if (accept(Kind.OPERATOR, "+")) {
                    Expr r = term();
                    left = () -> number(l.eval()) + number(r.eval());
                } else if (accept(Kind.OPERATOR, "-")) {
                    Expr r = term();
                    left = () -> number(l.eval()) - number(r.eval());
                } else {
                    return left;
                }
            }
        }

        Expr term() {
            Expr left = unary();
            while (true) {
                Expr l = left;
                if (accept(Kind.OPERATOR, "*")) {
                    Expr r = unary();
                    left = () -> number(l.eval()) * number(r.eval());
                } else if (accept(Kind.OPERATOR, "/")) {
                    Expr r = unary();
                    left = () -> number(l.eval()) / divisor(r.eval());
                } else if (accept(Kind.OPERATOR, "//")) {
                    Expr r = unary();
                    left = () -> Math.floor(number(l.eval()) / divisor(r.eval()));
                } else if (accept(Kind.OPERATOR, "%")) {
                    Expr r = unary();
                    left = () -> {
                        double a = number(l.eval());
                        double b = divisor(r.eval());
                        return a - b * Math.floor(a / b);
                    };
                } else {
                    return left;
                }
            }
        }

        Expr unary() {
            if (accept(Kind.OPERATOR, "+")) {
                Expr operand = nested(this::unary);
                return () -> number(operand.eval());
            }
            if (accept(Kind.OPERATOR, "-")) {
                Expr operand = nested(this::unary);
                return () -> -number(operand.eval());
            }
            return power();
        }

        Expr power() {
            Expr base = atom();
            if (accept(Kind.OPERATOR, "**")) {
                Expr exponent = nested(this::unary);
                return () -> Math.pow(number(base.eval()), number(exponent.eval()));
            }
            return base;
        }

        Expr atom() {
            Token token = tokens.get(pos++);
            switch (token.kind) {
                case NUMBER:
                    try {
                        Double value = Double.parseDouble(token.text);
                        return () -> value;
                    } catch (NumberFormatException e) {
                        throw new ExpressionEvaluationException("Malformed number: " + token.text);
                    }
                case KEYWORD:
                    if ("True".equals(token.text))  return () -> Boolean.TRUE;
                    if ("False".equals(token.text)) return () -> Boolean.FALSE;
                    break;
                case LPAREN:
                    Expr inner = nested(this::or);
                    if (!accept(Kind.RPAREN, ")")) {
                        throw new ExpressionEvaluationException("Missing ')'");
                    }
                    return inner;
                default:
                    break;
            }
            throw new ExpressionEvaluationException(token.kind == Kind.END
                    ? "Unexpected end of expression"
                    : "Unexpected '" + token.text + "'");
        }

        private Expr nested(Supplier<Expr> rule) {
            if (++depth > MAX_DEPTH) {
                throw new ExpressionEvaluationException("Expression nested deeper than " + MAX_DEPTH + " levels");
            }
            try {
                return rule.get();
            } finally {
                depth--;
            }
        }

        private static boolean isComparison(String operator) {
            return switch (operator) {
                case "==", "!=", ">", "<", ">=", "<=" -> true;
                default -> false;
            };
        }

        private static boolean compare(String operator, double a, double b) {
            return switch (operator) {
                case "==" -> a == b;
                case "!=" -> a != b;
                case ">"  -> a > b;
                case "<"  -> a < b;
                case ">=" -> a >= b;
                default   -> a <= b;
            };
        }

        private static double number(Object value) {
            if (value instanceof Boolean b) {
                return b ? 1.0 : 0.0;
            }
            return (Double) value;
        }

        private static double divisor(Object value) {
            double d = number(value);
            if (d == 0.0) {
                throw new ExpressionEvaluationException("Division by zero");
            }
            return d;
        }
    }
}
