package com.questrail.expectations.observability;

import java.time.Instant;

/**
 * Record representing a fatal error during an expectation update.
 */
public record UpdateErrorEvent(
    Instant timestamp,
    String testPath,
    String message,
    Throwable cause
) {
}
