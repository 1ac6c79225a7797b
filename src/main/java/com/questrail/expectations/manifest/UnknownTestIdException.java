package com.questrail.expectations.manifest;

import com.questrail.expectations.api.TestId;

/**
 * Thrown by {@link FileNode#get(TestId)} for a test that is not in the tree.
 *
 * <p>This is recoverable: callers normally create the test with
 * {@link TestNode#create(String, TestId)} and attach it.</p>
 */
public final class UnknownTestIdException extends RuntimeException
{
    private final TestId testId;

    public UnknownTestIdException(TestId testId) {
        super("Unknown test " + testId);
        this.testId = testId;
    }

    public TestId testId() {
        return testId;
    }
}
