package com.questrail.expectations.manifest;

import com.questrail.expectations.api.TestId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * FileNode
 * -----------------------------------------------------------------------------
 * Root of the expectation tree for one test file.
 *
 * <p>Owns the file's {@link TestNode}s in stored order and indexes them by
 * {@link TestId}. The index and the child list are kept in 1:1
 * correspondence by {@link #addChild(TestNode)} and
 * {@link #removeChild(TestNode)}.</p>
 *
 * <p>The {@linkplain #isModified() modified} flag is raised whenever evidence
 * recorded anywhere in the tree disagrees with what is stored.</p>
 */
public final class FileNode extends ExpectationNode
{
    private final String testPath;
    private final List<TestNode> tests = new ArrayList<>();
    private final Map<TestId, TestNode> index = new HashMap<>();
    private boolean modified;

    /**
     * Creates an empty tree for a test file.
     *
     * @param testPath path of the test file relative to the test root, using
     *                 {@code /} separators (e.g. {@code dom/historical.html})
     */
    public FileNode(String testPath) {
        Objects.requireNonNull(testPath, "testPath");
        String normalized = testPath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("testPath must not be empty");
        }
        this.testPath = normalized;
    }

    public String testPath() {
        return testPath;
    }

    /**
     * Attaches a test to this file.
     *
     * @throws DuplicateTestIdException if a test with the same identity is
     *         already attached; the tree is left unchanged
     */
    public void addChild(TestNode test) {
        Objects.requireNonNull(test, "test");
        if (test instanceof SubtestNode) {
            throw new IllegalArgumentException("Subtests belong to a test, not to a file");
        }
        if (test.parent().isPresent()) {
            throw new IllegalStateException("Test '" + test.name() + "' is already attached");
        }

        test.setParent(this);
        TestId id;
        try {
            id = test.id();
        } catch (IllegalStateException e) {
            test.setParent(null);
            throw e;
        }
        if (index.containsKey(id)) {
            test.setParent(null);
            throw new DuplicateTestIdException("Duplicate test " + id + " in " + testPath);
        }
        tests.add(test);
        index.put(id, test);
    }

    public void removeChild(TestNode test) {
        Objects.requireNonNull(test, "test");
        if (!tests.contains(test)) {
            return;
        }
        // The test's attributes may have changed since it was indexed.
        index.values().removeIf(indexed -> indexed == test);
        tests.remove(test);
        test.setParent(null);
    }

    public Optional<TestNode> find(TestId id) {
        return Optional.ofNullable(index.get(id));
    }

    public boolean contains(TestId id) {
        return index.containsKey(id);
    }

    /**
     * Returns the test with the given identity.
     *
     * @throws UnknownTestIdException if no such test is attached
     */
    public TestNode get(TestId id) {
        TestNode test = index.get(id);
        if (test == null) {
            throw new UnknownTestIdException(id);
        }
        return test;
    }

    public List<TestNode> tests() {
        return Collections.unmodifiableList(tests);
    }

    @Override
    public List<TestNode> children() {
        return tests();
    }

    public boolean isModified() {
        return modified;
    }

    public void markModified() {
        modified = true;
    }

    /**
     * Builds the URL of a test named {@code name} in this file: the file's
     * directory components followed by the name.
     */
    String urlFor(String name) {
        int slash = testPath.lastIndexOf('/');
        String directory = slash < 0 ? "" : testPath.substring(0, slash + 1);
        return "/" + directory + name;
    }

    @Override
    public String toString() {
        return "FileNode[" + testPath + ", tests=" + tests.size() + "]";
    }
}
