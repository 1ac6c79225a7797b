package com.questrail.expectations.observability;

import com.questrail.expectations.manifest.CoalesceOutcome;

import java.time.Instant;

/**
 * Record describing the result of coalescing one test or subtest.
 *
 * @param subtest subtest name, or {@code null} for the test itself
 */
public record TestCoalescedEvent(
    Instant timestamp,
    String testPath,
    String test,
    String subtest,
    CoalesceOutcome outcome
) {
}
