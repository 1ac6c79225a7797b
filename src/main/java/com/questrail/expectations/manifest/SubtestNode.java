package com.questrail.expectations.manifest;

/**
 * Expectations for one named subtest of a {@link TestNode}.
 *
 * <p>A subtest has no required attributes, so it is empty exactly when it
 * carries no attributes at all.</p>
 */
public final class SubtestNode extends TestNode
{
    SubtestNode(String name, boolean fromFile) {
        super(name, fromFile);
    }

    /**
     * Creates a detached subtest with no attributes.
     */
    public static SubtestNode create(String name) {
        return new SubtestNode(name, false);
    }

    /**
     * Returns the test this subtest belongs to.
     */
    public TestNode test() {
        return (TestNode) parent().orElseThrow(() ->
                new IllegalStateException("Subtest '" + name() + "' is not attached"));
    }

    @Override
    public boolean isEmpty() {
        return attributes().isEmpty();
    }
}
