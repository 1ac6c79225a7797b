package com.questrail.expectations.expr;

import com.questrail.expectations.api.EnvironmentDescriptor;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * ExpressionEvaluator
 * -----------------------------------------------------------------------------
 * Evaluates condition expressions against an {@link EnvironmentDescriptor}.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>A {@link Variable} yields the descriptor's value for that property,
 *       or {@code null} when the property is not bound.</li>
 *   <li>{@code ==} and {@code !=} compare numbers by numeric value and every
 *       other value by {@link Object#equals(Object)}. An unbound property is
 *       equal to nothing but another unbound property.</li>
 *   <li>{@code and} and {@code or} short-circuit left to right.</li>
 *   <li>Truthiness: {@code null} and {@code false} are false, numbers are
 *       true when non-zero, strings when non-empty.</li>
 * </ul>
 *
 * The evaluator is stateless and may be shared.
 */
public final class ExpressionEvaluator
{
    public static final ExpressionEvaluator INSTANCE = new ExpressionEvaluator();

    private ExpressionEvaluator() {}

    /**
     * Evaluates the expression as a condition.
     *
     * @param expression condition to evaluate
     * @param descriptor environment to evaluate against
     * @return the truthiness of the expression's value
     */
    public boolean test(Expression expression, EnvironmentDescriptor descriptor) {
        return isTruthy(evaluate(expression, descriptor));
    }

    /**
     * Evaluates the expression to a value.
     *
     * @return a {@link String}, {@link BigDecimal}, {@link Boolean}, another
     *         descriptor value, or {@code null} for an unbound property
     */
    public Object evaluate(Expression expression, EnvironmentDescriptor descriptor) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(descriptor, "descriptor");

        if (expression instanceof Variable v) {
            return descriptor.get(v.name()).orElse(null);
        }
        if (expression instanceof StringLiteral s) {
            return s.value();
        }
        if (expression instanceof NumberLiteral n) {
            return n.numericValue();
        }
        if (expression instanceof UnaryExpression u) {
            // NOT is the only unary operator.
            return !test(u.operand(), descriptor);
        }
        BinaryExpression b = (BinaryExpression) expression;
        return switch (b.operator()) {
            case EQUALS -> valuesEqual(evaluate(b.left(), descriptor), evaluate(b.right(), descriptor));
            case NOT_EQUALS -> !valuesEqual(evaluate(b.left(), descriptor), evaluate(b.right(), descriptor));
            case AND -> test(b.left(), descriptor) && test(b.right(), descriptor);
            case OR -> test(b.left(), descriptor) || test(b.right(), descriptor);
        };
    }

    static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return NumberLiteral.decimalOf(l).compareTo(NumberLiteral.decimalOf(r)) == 0;
        }
        return Objects.equals(left, right);
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return NumberLiteral.decimalOf(n).signum() != 0;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }
}
