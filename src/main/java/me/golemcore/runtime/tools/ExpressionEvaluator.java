package me.golemcore.runtime.tools;

import java.math.BigDecimal;

/**
 * Recursive-descent evaluator for arithmetic expressions.
 *
 * <p>
 * Grammar, lowest precedence first:
 *
 * <pre>
 * expression = term (('+' | '-') term)*
 * term       = factor (('*' | '/' | '%') factor)*
 * factor     = ('+' | '-') factor | power
 * power      = primary ('^' factor)?
 * primary    = number | '(' expression ')'
 * </pre>
 *
 * Exponentiation is right-associative and binds tighter than unary minus, so
 * {@code -2^2} is {@code -4}.
 */
final class ExpressionEvaluator {

    private static final int MAX_LENGTH = 500;

    private final String input;
    private int pos;

    private ExpressionEvaluator(String input) {
        this.input = input;
    }

    /**
     * @throws IllegalArgumentException
     *             if the expression is malformed
     * @throws ArithmeticException
     *             on division by zero or a non-finite result
     */
    static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("expression is empty");
        }
        if (expression.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("expression is longer than " + MAX_LENGTH + " characters");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
        double value = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.pos < expression.length()) {
            throw new IllegalArgumentException(
                    "unexpected '" + expression.charAt(evaluator.pos) + "' at position " + evaluator.pos);
        }
        if (!Double.isFinite(value)) {
            throw new ArithmeticException("result is not a finite number");
        }
        return value;
    }

    /**
     * Formats whole results without a fractional part ({@code 437}, not
     * {@code 437.0}).
     */
    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume('+')) {
                value += parseTerm();
            } else if (consume('-')) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseFactor();
        while (true) {
            if (consume('*')) {
                value *= parseFactor();
            } else if (consume('/')) {
                double divisor = parseFactor();
                if (divisor == 0.0) {
                    throw new ArithmeticException("division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                double divisor = parseFactor();
                if (divisor == 0.0) {
                    throw new ArithmeticException("division by zero");
                }
                value %= divisor;
            } else {
                return value;
            }
        }
    }

    private double parseFactor() {
        if (consume('+')) {
            return parseFactor();
        }
        if (consume('-')) {
            return -parseFactor();
        }
        return parsePower();
    }

    private double parsePower() {
        double base = parsePrimary();
        if (consume('^')) {
            return Math.pow(base, parseFactor());
        }
        return base;
    }

    private double parsePrimary() {
        if (consume('(')) {
            double value = parseExpression();
            if (!consume(')')) {
                throw new IllegalArgumentException("missing ')' at position " + pos);
            }
            return value;
        }
        skipWhitespace();
        int start = pos;
        while (pos < input.length() && (Character.isDigit(input.charAt(pos)) || input.charAt(pos) == '.')) {
            pos++;
        }
        if (start == pos) {
            if (pos >= input.length()) {
                throw new IllegalArgumentException("unexpected end of expression");
            }
            throw new IllegalArgumentException("unexpected '" + input.charAt(pos) + "' at position " + pos);
        }
        String number = input.substring(start, pos);
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid number '" + number + "' at position " + start, e);
        }
    }

    private boolean consume(char expected) {
        skipWhitespace();
        if (pos < input.length() && input.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
    }
}
