package com.questrail.expectations.expr;

/**
 * Expression
 * -----------------------------------------------------------------------------
 * Node of the boolean condition language used by expectation tables.
 *
 * <p>Conditions such as {@code debug and os == "linux"} are represented as an
 * immutable tree of expression records. Equality is structural, so two
 * conditions built independently from the same text compare equal.</p>
 *
 * <p>The node set is closed:</p>
 * <ul>
 *   <li>{@link Variable}: reference to an environment property</li>
 *   <li>{@link StringLiteral} and {@link NumberLiteral}: constants</li>
 *   <li>{@link BinaryExpression}: {@code ==}, {@code !=}, {@code and}, {@code or}</li>
 *   <li>{@link UnaryExpression}: {@code not}</li>
 * </ul>
 *
 * Evaluation lives in {@link ExpressionEvaluator}; this interface carries no
 * behavior.
 */
public sealed interface Expression
        permits Variable, StringLiteral, NumberLiteral, BinaryExpression, UnaryExpression {
}
