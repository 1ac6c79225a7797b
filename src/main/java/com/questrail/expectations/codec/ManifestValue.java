package com.questrail.expectations.codec;

import com.questrail.expectations.expr.Expression;

import java.util.Objects;

/**
 * One value of an attribute.
 *
 * @param condition the {@code if} condition, or {@code null} for the default value
 * @param value     the value text
 */
public record ManifestValue(Expression condition, String value)
{
    public ManifestValue {
        Objects.requireNonNull(value, "value");
    }

    public static ManifestValue unconditional(String value) {
        return new ManifestValue(null, value);
    }

    public boolean isUnconditional() {
        return condition == null;
    }
}
