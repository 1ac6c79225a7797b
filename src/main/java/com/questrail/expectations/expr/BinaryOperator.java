package com.questrail.expectations.expr;

/**
 * Binary operators of the condition language, with their textual symbols.
 */
public enum BinaryOperator {
    EQUALS("=="),
    NOT_EQUALS("!="),
    AND("and"),
    OR("or");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }
}
