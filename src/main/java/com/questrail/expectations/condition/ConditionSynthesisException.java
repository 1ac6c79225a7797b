package com.questrail.expectations.condition;

/**
 * Indicates that a set of results could not be partitioned into conditions.
 *
 * <p>This happens when no prioritized environment property separates the
 * results, for example when the same environment produced different statuses,
 * or when a result lacks a property chosen as a discriminator.</p>
 */
public final class ConditionSynthesisException extends RuntimeException
{
    public ConditionSynthesisException(String message) {
        super(message);
    }
}
