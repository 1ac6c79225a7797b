package com.questrail.expectations.condition;

import com.questrail.expectations.expr.NumberLiteral;

import java.util.Objects;

/**
 * A single (property, value) pair drawn from an environment descriptor.
 *
 * <p>Numeric values are held as stripped {@link java.math.BigDecimal}s, so
 * bindings compare by numeric value whatever {@link Number} type the
 * descriptor carried, the same way conditions are evaluated.</p>
 */
public record PropertyBinding(String property, Object value)
{
    public PropertyBinding {
        Objects.requireNonNull(property, "property");
        Objects.requireNonNull(value, "value");
        if (value instanceof Number n) {
            value = NumberLiteral.decimalOf(n).stripTrailingZeros();
        }
    }
}
