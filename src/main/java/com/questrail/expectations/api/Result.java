package com.questrail.expectations.api;

import java.util.Objects;

/**
 * One observed outcome for one test under one environment.
 *
 * @param descriptor the environment the test ran under
 * @param status     the status the harness observed (e.g. {@code PASS}, {@code FAIL})
 */
public record Result(EnvironmentDescriptor descriptor, String status)
{
    public Result {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(status, "status");
    }
}
