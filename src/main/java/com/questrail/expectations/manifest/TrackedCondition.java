package com.questrail.expectations.manifest;

import com.questrail.expectations.api.Result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A stored {@code expected} entry together with the results recorded against
 * it since the last coalesce.
 */
public final class TrackedCondition
{
    private final ConditionalValue value;
    private final List<Result> evidence = new ArrayList<>();

    TrackedCondition(ConditionalValue value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    public ConditionalValue value() {
        return value;
    }

    public List<Result> evidence() {
        return Collections.unmodifiableList(evidence);
    }

    void add(Result result) {
        evidence.add(result);
    }
}
