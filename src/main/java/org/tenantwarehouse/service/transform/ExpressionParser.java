package org.tenantwarehouse.service.transform;

import org.tenantwarehouse.exceptions.ConfigurationException;
import org.tenantwarehouse.exceptions.RecordException;
import org.tenantwarehouse.utils.NumericValues;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for map-step expressions:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := '-' unary | primary
 * primary    := number | field | function '(' expression (',' expression)* ')' | '(' expression ')'
 * </pre>
 * Functions: {@code abs(x)}, {@code round(x[, digits])}, {@code coalesce(x, ...)},
 * {@code min(x, ...)}, {@code max(x, ...)}. Arithmetic runs on {@link BigDecimal} with
 * {@link MathContext#DECIMAL64}.
 */
public final class ExpressionParser {

    private static final MathContext MATH = MathContext.DECIMAL64;
    static final int MAX_ROUND_DIGITS = 32;

    private final String source;
    private int position;

    private ExpressionParser(String source) {
        this.source = source;
    }

    public static Expression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ConfigurationException("Expression is empty");
        }
        ExpressionParser parser = new ExpressionParser(expression);
        Expression parsed = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.position < parser.source.length()) {
            throw parser.error("Unexpected '" + parser.source.charAt(parser.position) + "'");
        }
        return parsed;
    }

    private Expression parseExpression() {
        Expression left = parseTerm();
        while (true) {
            skipWhitespace();
            if (consume('+')) {
                left = new Binary('+', left, parseTerm());
            } else if (consume('-')) {
                left = new Binary('-', left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Expression parseTerm() {
        Expression left = parseUnary();
        while (true) {
            skipWhitespace();
            if (consume('*')) {
                left = new Binary('*', left, parseUnary());
            } else if (consume('/')) {
                left = new Binary('/', left, parseUnary());
            } else if (consume('%')) {
                left = new Binary('%', left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expression parseUnary() {
        skipWhitespace();
        if (consume('-')) {
            return new Negate(parseUnary());
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        skipWhitespace();
        if (position >= source.length()) {
            throw error("Unexpected end of expression");
        }
        char current = source.charAt(position);
        if (consume('(')) {
            Expression inner = parseExpression();
            expect(')');
            return inner;
        }
        if (Character.isDigit(current) || current == '.') {
            return parseNumber();
        }
        if (Character.isLetter(current) || current == '_') {
            String name = parseIdentifier();
            skipWhitespace();
            if (consume('(')) {
                return parseFunction(name);
            }
            return new Field(name);
        }
        throw error("Unexpected '" + current + "'");
    }

    private Expression parseNumber() {
        int start = position;
        while (position < source.length()
                && (Character.isDigit(source.charAt(position)) || source.charAt(position) == '.')) {
            position++;
        }
        String literal = source.substring(start, position);
        try {
            return new Literal(new BigDecimal(literal));
        } catch (NumberFormatException exception) {
            throw error("Invalid number '" + literal + "'");
        }
    }

    private String parseIdentifier() {
        int start = position;
        while (position < source.length()) {
            char c = source.charAt(position);
            if (Character.isLetterOrDigit(c) || c == '_' || c == '.') {
                position++;
            } else {
                break;
            }
        }
        return source.substring(start, position);
    }

    private Expression parseFunction(String name) {
        String function = name.toLowerCase(Locale.ROOT);
        List<Expression> arguments = new ArrayList<>();
        skipWhitespace();
        if (!consume(')')) {
            do {
                arguments.add(parseExpression());
                skipWhitespace();
            } while (consume(','));
            expect(')');
        }
        int count = arguments.size();
        boolean arityOk = switch (function) {
            case "abs" -> count == 1;
            case "round" -> count == 1 || count == 2;
            case "coalesce", "min", "max" -> count >= 1;
            default -> throw error("Unknown function '" + name + "'");
        };
        if (!arityOk) {
            throw error("Wrong number of arguments for " + function + ": " + count);
        }
        return new Call(function, List.copyOf(arguments));
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private boolean consume(char expected) {
        if (position < source.length() && source.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        skipWhitespace();
        if (!consume(expected)) {
            throw error("Expected '" + expected + "'");
        }
    }

    private ConfigurationException error(String message) {
        return new ConfigurationException(message + " at position " + position + " in expression: " + source);
    }

    private static BigDecimal require(BigDecimal value, String context) {
        if (value == null) {
            throw new RecordException("Null operand in " + context);
        }
        return value;
    }

    private record Literal(BigDecimal value) implements Expression {

        @Override
        public BigDecimal evaluate(Map<String, Object> record) {
            return value;
        }

        @Override
        public Set<String> fields() {
            return Set.of();
        }
    }

    private record Field(String name) implements Expression {

        @Override
        public BigDecimal evaluate(Map<String, Object> record) {
            if (!record.containsKey(name)) {
                throw new RecordException("Unknown field '" + name + "'");
            }
            return evaluateNullable(record);
        }

        BigDecimal evaluateNullable(Map<String, Object> record) {
            Object value = record.get(name);
            if (value == null) {
                return null;
            }
            return NumericValues.toBigDecimal(value)
                    .orElseThrow(() -> new RecordException("Field '" + name + "' is not numeric: " + value));
        }

        @Override
        public Set<String> fields() {
            return Set.of(name);
        }
    }

    private record Negate(Expression operand) implements Expression {

        @Override
        public BigDecimal evaluate(Map<String, Object> record) {
            return require(operand.evaluate(record), "negation").negate();
        }

        @Override
        public Set<String> fields() {
            return operand.fields();
        }
    }

    private record Binary(char operator, Expression left, Expression right) implements Expression {

        @Override
        public BigDecimal evaluate(Map<String, Object> record) {
            String context = "'" + operator + "'";
            BigDecimal a = require(left.evaluate(record), context);
            BigDecimal b = require(right.evaluate(record), context);
            switch (operator) {
                case '+':
                    return a.add(b, MATH);
                case '-':
                    return a.subtract(b, MATH);
                case '*':
                    return a.multiply(b, MATH);
                case '/':
                    if (b.signum() == 0) {
                        throw new RecordException("Division by zero");
                    }
                    return a.divide(b, MATH);
                default:
                    if (b.signum() == 0) {
                        throw new RecordException("Modulo by zero");
                    }
                    return a.remainder(b, MATH);
            }
        }

        @Override
        public Set<String> fields() {
            Set<String> fields = new LinkedHashSet<>(left.fields());
            fields.addAll(right.fields());
            return fields;
        }
    }

    private record Call(String function, List<Expression> arguments) implements Expression {

        @Override
        public BigDecimal evaluate(Map<String, Object> record) {
            switch (function) {
                case "abs":
                    return require(arguments.get(0).evaluate(record), "abs").abs();
                case "round":
                    int digits = 0;
                    if (arguments.size() == 2) {
                        BigDecimal requested = require(arguments.get(1).evaluate(record), "round");
                        if (requested.abs().compareTo(BigDecimal.valueOf(MAX_ROUND_DIGITS)) > 0) {
                            throw new RecordException("round() digits must be between -" + MAX_ROUND_DIGITS
                                    + " and " + MAX_ROUND_DIGITS + ", got " + requested.toPlainString());
                        }
                        digits = requested.intValue();
                    }
                    return require(arguments.get(0).evaluate(record), "round").setScale(digits, RoundingMode.HALF_UP);
                case "coalesce":
                    for (Expression argument : arguments) {
                        BigDecimal value = argument instanceof Field field
                                ? field.evaluateNullable(record)
                                : argument.evaluate(record);
                        if (value != null) {
                            return value;
                        }
                    }
                    return null;
                case "min":
                    return extreme(record, true);
                default:
                    return extreme(record, false);
            }
        }

        private BigDecimal extreme(Map<String, Object> record, boolean lowest) {
            BigDecimal result = null;
            for (Expression argument : arguments) {
                BigDecimal value = require(argument.evaluate(record), function);
                if (result == null || (lowest ? value.compareTo(result) < 0 : value.compareTo(result) > 0)) {
                    result = value;
                }
            }
            return result;
        }

        @Override
        public Set<String> fields() {
            Set<String> fields = new LinkedHashSet<>();
            arguments.forEach(argument -> fields.addAll(argument.fields()));
            return fields;
        }
    }
}
