package com.questrail.expectations.expr;

import java.util.Objects;

/**
 * Reference to an environment property by name.
 */
public record Variable(String name) implements Expression
{
    public Variable {
        Objects.requireNonNull(name, "name");
    }
}
