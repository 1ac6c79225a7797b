package com.questrail.expectations.manifest;

/**
 * Indicates that two results recorded for the same node implied different
 * default statuses. Harness evidence must agree on what "no override" means
 * for a test; this cannot be resolved automatically.
 */
public final class InconsistentDefaultException extends RuntimeException
{
    public InconsistentDefaultException(String message) {
        super(message);
    }
}
