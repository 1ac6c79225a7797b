package com.questrail.expectations.api;

/**
 * TestId
 * -----------------------------------------------------------------------------
 * Identity of a test within an expectation table.
 *
 * <p>An ordinary test is identified by its URL alone. A reftest comparison is
 * identified by the triple (URL, comparison kind, reference URL), because one
 * URL may host several independent reference comparisons and each needs its
 * own expectation record.</p>
 *
 * <p>The set of identity kinds is closed:</p>
 * <ul>
 *   <li>{@link UrlTestId}</li>
 *   <li>{@link ReftestId}</li>
 * </ul>
 */
public sealed interface TestId permits UrlTestId, ReftestId {

    /**
     * Returns the URL of the test, e.g. {@code /dom/historical.html}.
     */
    String url();

    /**
     * Returns the final path segment of the URL, which is the block name used
     * for the test in its expectation table.
     */
    default String name() {
        String url = url();
        int slash = url.lastIndexOf('/');
        return slash < 0 ? url : url.substring(slash + 1);
    }
}
