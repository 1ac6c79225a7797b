package com.questrail.expectations.expr;

import java.util.Objects;

public record StringLiteral(String value) implements Expression
{
    public StringLiteral {
        Objects.requireNonNull(value, "value");
    }
}
