package com.questrail.expectations.expr;

import java.util.Objects;

public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression
{
    public UnaryExpression {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(UnaryOperator.NOT, operand);
    }
}
