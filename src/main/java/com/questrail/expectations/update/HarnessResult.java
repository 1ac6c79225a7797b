package com.questrail.expectations.update;

import com.questrail.expectations.api.TestId;

import java.util.Objects;
import java.util.Optional;

/**
 * One result reported by the test harness.
 *
 * @param testPath      path of the test file relative to the test root
 * @param testId        identity of the test within the file
 * @param testType      harness test type, e.g. {@code testharness} or {@code reftest}
 * @param subtest       subtest name, or {@code null} for a whole-test result
 * @param status        observed status
 * @param defaultStatus status the harness assumes when nothing is stored
 */
public record HarnessResult(
    String testPath,
    TestId testId,
    String testType,
    String subtest,
    String status,
    String defaultStatus
) {
    public HarnessResult {
        Objects.requireNonNull(testPath, "testPath");
        Objects.requireNonNull(testId, "testId");
        Objects.requireNonNull(testType, "testType");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(defaultStatus, "defaultStatus");
    }

    public static HarnessResult forTest(String testPath, TestId testId, String testType,
                                        String status, String defaultStatus) {
        return new HarnessResult(testPath, testId, testType, null, status, defaultStatus);
    }

    public static HarnessResult forSubtest(String testPath, TestId testId, String testType,
                                           String subtest, String status, String defaultStatus) {
        Objects.requireNonNull(subtest, "subtest");
        return new HarnessResult(testPath, testId, testType, subtest, status, defaultStatus);
    }

    public Optional<String> subtestName() {
        return Optional.ofNullable(subtest);
    }
}
