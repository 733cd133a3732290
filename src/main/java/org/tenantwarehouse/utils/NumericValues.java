package org.tenantwarehouse.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Numeric coercion shared by the transformation steps. Numbers and numeric strings are accepted;
 * everything else is not a number.
 */
public final class NumericValues {

    private NumericValues() {
    }

    public static Optional<BigDecimal> toBigDecimal(Object value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value instanceof BigDecimal decimal) {
            return Optional.of(decimal);
        }
        if (value instanceof BigInteger integer) {
            return Optional.of(new BigDecimal(integer));
        }
        if (isIntegral(value)) {
            return Optional.of(BigDecimal.valueOf(((Number) value).longValue()));
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                return Optional.empty();
            }
            return Optional.of(BigDecimal.valueOf(number));
        }
        if (value instanceof Number number) {
            return parse(number.toString());
        }
        if (value instanceof CharSequence text) {
            return parse(text.toString().trim());
        }
        return Optional.empty();
    }

    public static boolean isNumeric(Object value) {
        return toBigDecimal(value).isPresent();
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer || value instanceof Short
                || value instanceof Byte || value instanceof BigInteger;
    }

    /**
     * True for integral Java numbers and for numeric strings without a fractional part.
     */
    public static boolean isWholeNumber(Object value) {
        if (isIntegral(value)) {
            return true;
        }
        return toBigDecimal(value)
                .map(decimal -> decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0)
                .orElse(false);
    }

    private static Optional<BigDecimal> parse(String text) {
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(text));
        } catch (NumberFormatException exception) {
            return Optional.empty();
        }
    }
}
