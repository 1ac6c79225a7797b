package com.questrail.expectations.expr;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Numeric constant.
 *
 * <p>The literal keeps the text it was written with (e.g. {@code 64} or
 * {@code 10.0}) so that a table round-trips unchanged. Comparisons use the
 * numeric value, see {@link #numericValue()}.</p>
 */
public record NumberLiteral(String text) implements Expression
{
    public NumberLiteral {
        Objects.requireNonNull(text, "text");
        try {
            new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number literal: " + text, e);
        }
    }

    /**
     * Creates a literal for a descriptor value, written in plain notation
     * (never with an exponent).
     */
    public static NumberLiteral of(Number value) {
        return new NumberLiteral(decimalOf(value).toPlainString());
    }

    /**
     * Converts any {@link Number} to its exact decimal value. Floating-point
     * values go through their shortest decimal representation.
     *
     * @throws NumberFormatException if the value is NaN or infinite
     */
    public static BigDecimal decimalOf(Number n) {
        Objects.requireNonNull(n, "n");
        if (n instanceof BigDecimal d) {
            return d;
        }
        if (n instanceof Double || n instanceof Float) {
            return BigDecimal.valueOf(n.doubleValue());
        }
        return new BigDecimal(n.toString());
    }

    public BigDecimal numericValue() {
        return new BigDecimal(text);
    }
}
