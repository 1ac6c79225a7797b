package com.questrail.expectations.condition;

import com.questrail.expectations.expr.Expression;

import java.util.List;
import java.util.Objects;

/**
 * A condition built by {@link ConditionSynthesizer}.
 *
 * @param signature the discriminator bindings the predicate requires, in
 *                  priority order
 * @param predicate conjunction of per-property tests over {@code signature}
 * @param status    the status expected when the predicate holds
 */
public record SynthesizedCondition(List<PropertyBinding> signature,
                                   Expression predicate,
                                   String status)
{
    public SynthesizedCondition {
        signature = List.copyOf(signature);
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(status, "status");
    }
}
