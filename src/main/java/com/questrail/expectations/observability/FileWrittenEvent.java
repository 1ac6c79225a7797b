package com.questrail.expectations.observability;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Record describing a table change on disk.
 *
 * @param deleted {@code true} if the table was removed because no tests remained
 */
public record FileWrittenEvent(
    Instant timestamp,
    String testPath,
    Path path,
    int tests,
    boolean deleted
) {
}
