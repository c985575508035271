package io.github.yok.flexetl.util;

import java.math.BigDecimal;
import java.math.BigInteger;
import lombok.Generated;

/**
 * Numeric helpers used by the aggregation, type conversion and validation stages.
 *
 * @author Yasuharu.Okawauchi
 */
public final class NumericValues {

    // Digits before the decimal point of Double.MAX_VALUE
    private static final int MAX_INTEGER_DIGITS = 309;

    // Digits of Long.MAX_VALUE
    private static final int LONG_DIGITS = 19;

    @Generated
    private NumericValues() {}

    /**
     * Converts a number or numeric text to {@link BigDecimal}.
     *
     * @param value number or text
     * @return decimal value, or {@code null} if the value is not numeric
     */
    public static BigDecimal toBigDecimal(Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof BigInteger) {
            return new BigDecimal((BigInteger) value);
        }
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return BigDecimal.valueOf(d);
        }
        if (value instanceof String) {
            return parse((String) value);
        }
        return null;
    }

    /**
     * Parses numeric text.
     *
     * @param text text to parse (surrounding blanks are ignored)
     * @return decimal value, or {@code null} if the text is not a number or lies beyond the
     *         range of a {@code double}
     */
    public static BigDecimal parse(String text) {
        try {
            BigDecimal value = new BigDecimal(text.trim());
            return integerDigits(value) > MAX_INTEGER_DIGITS ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Returns whether the value is a whole number: an integral Java type, or numeric text or
     * {@link BigDecimal} without fractional digits.
     *
     * @param value number or numeric text
     * @return {@code true} for whole numbers
     */
    public static boolean isIntegral(Object value) {
        if (value instanceof Byte || value instanceof Short || value instanceof Integer
                || value instanceof Long || value instanceof BigInteger) {
            return true;
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).scale() <= 0;
        }
        if (value instanceof String) {
            BigDecimal parsed = parse((String) value);
            return parsed != null && parsed.scale() <= 0;
        }
        return false;
    }

    /**
     * Returns whether a whole decimal fits in a {@code long}.
     *
     * @param value whole decimal
     * @return {@code true} if {@link BigDecimal#longValueExact()} would succeed
     */
    public static boolean fitsLong(BigDecimal value) {
        // checked first so that a huge exponent never reaches toBigInteger()
        if (integerDigits(value) > LONG_DIGITS) {
            return false;
        }
        return value.toBigInteger().bitLength() < Long.SIZE;
    }

    private static long integerDigits(BigDecimal value) {
        return (long) value.precision() - value.scale();
    }
}
