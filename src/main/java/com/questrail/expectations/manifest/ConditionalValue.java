package com.questrail.expectations.manifest;

import com.questrail.expectations.api.EnvironmentDescriptor;
import com.questrail.expectations.expr.Expression;
import com.questrail.expectations.expr.ExpressionEvaluator;

import java.util.Objects;
import java.util.Optional;

/**
 * ConditionalValue
 * -----------------------------------------------------------------------------
 * One entry of an attribute's value list: an optional condition and the value
 * that applies when the condition holds.
 *
 * <p>An entry without a condition is the unconditional (default) entry and
 * always applies.</p>
 *
 * <h2>Identity</h2>
 * Entries are compared by identity, not by content. Evidence
 * gathered for an entry must stay attached to that exact entry even if
 * another entry carries the same condition text. Condition equality, where
 * needed, is checked explicitly on {@link #condition()}.
 *
 * <p>The condition is fixed for the lifetime of the entry; the value may be
 * rewritten by reconciliation.</p>
 */
public final class ConditionalValue
{
    private final Expression condition;
    private String value;

    ConditionalValue(Expression condition, String value) {
        this.condition = condition;
        this.value = Objects.requireNonNull(value, "value");
    }

    public Optional<Expression> condition() {
        return Optional.ofNullable(condition);
    }

    public boolean isUnconditional() {
        return condition == null;
    }

    public String value() {
        return value;
    }

    void setValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Returns {@code true} if this entry applies to the given environment.
     */
    public boolean appliesTo(EnvironmentDescriptor descriptor) {
        return condition == null || ExpressionEvaluator.INSTANCE.test(condition, descriptor);
    }

    boolean hasCondition(Expression other) {
        return Objects.equals(condition, other);
    }

    @Override
    public String toString() {
        return condition == null ? value : "if " + condition + ": " + value;
    }
}
