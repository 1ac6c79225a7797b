package com.questrail.expectations.manifest;

import java.util.List;
import java.util.Optional;

/**
 * ExpectationNode
 * -----------------------------------------------------------------------------
 * Common base of the nodes in a per-file expectation tree.
 *
 * <h2>Node kinds</h2>
 * The hierarchy is closed:
 * <ul>
 *   <li>{@link FileNode}: root, one per test file</li>
 *   <li>{@link TestNode}: one per test, or per reftest comparison</li>
 *   <li>{@link SubtestNode}: a {@code TestNode} scoped under a test</li>
 * </ul>
 *
 * <h2>Ownership</h2>
 * Parents exclusively own their children. The {@link #parent()} link is a
 * plain back-reference maintained by the owning parent and cleared when the
 * child is removed.
 */
public abstract sealed class ExpectationNode permits FileNode, TestNode
{
    private final ConditionalAttributes attributes = new ConditionalAttributes();
    private ExpectationNode parent;

    ExpectationNode() {}

    public ConditionalAttributes attributes() {
        return attributes;
    }

    public Optional<ExpectationNode> parent() {
        return Optional.ofNullable(parent);
    }

    void setParent(ExpectationNode parent) {
        this.parent = parent;
    }

    /**
     * Returns the direct children of this node, in stored order.
     */
    public abstract List<? extends ExpectationNode> children();
}
