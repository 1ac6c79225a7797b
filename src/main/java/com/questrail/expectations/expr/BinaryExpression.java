package com.questrail.expectations.expr;

import java.util.Objects;

public record BinaryExpression(BinaryOperator operator,
                               Expression left,
                               Expression right) implements Expression
{
    public BinaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public static BinaryExpression equalTo(Expression left, Expression right) {
        return new BinaryExpression(BinaryOperator.EQUALS, left, right);
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(BinaryOperator.AND, left, right);
    }
}
