package com.questrail.expectations.manifest;

/**
 * Indicates that two tests (or two subtests of one test) were registered
 * under the same identity. This reflects a bug in whatever built the tree.
 */
public final class DuplicateTestIdException extends RuntimeException
{
    public DuplicateTestIdException(String message) {
        super(message);
    }
}
