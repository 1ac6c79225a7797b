package com.questrail.expectations.manifest;

import com.questrail.expectations.api.EnvironmentDescriptor;
import com.questrail.expectations.api.ReftestId;
import com.questrail.expectations.api.Result;
import com.questrail.expectations.api.TestId;
import com.questrail.expectations.api.UrlTestId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * TestNode
 * -----------------------------------------------------------------------------
 * Expectations for one test (or one reftest comparison) within a file.
 *
 * <h2>Evidence lifecycle</h2>
 * New run results enter only through
 * {@link #recordResult(EnvironmentDescriptor, String, String)}. The first
 * result recorded after construction or after a coalesce snapshots the stored
 * {@code expected} entries as {@linkplain #trackedConditions() tracked
 * conditions}. Recording never touches stored entries; it files each result
 * either under the first tracked entry that applies to its environment or,
 * when none applies, into {@linkplain #unplacedEvidence() unplaced evidence}.
 *
 * <p>{@link #coalesce()} then folds the pending evidence into the stored
 * entries and clears it. Recording and coalescing for the same node must not
 * interleave.</p>
 *
 * <h2>Identity</h2>
 * An ordinary test is identified by its URL. A reftest is identified by
 * (URL, {@code reftype}, {@code refurl}), taken from its attributes, so
 * several comparisons hosted by one URL are tracked independently.
 */
public sealed class TestNode extends ExpectationNode permits SubtestNode
{
    public static final String TYPE = "type";
    public static final String REFTYPE = "reftype";
    public static final String REFURL = "refurl";
    public static final String EXPECTED = "expected";
    public static final String DISABLED = "disabled";

    public static final String REFTEST = "reftest";

    private final String name;
    private final boolean fromFile;
    private final Map<String, SubtestNode> subtests = new LinkedHashMap<>();

    // Pending evidence, owned by this node and cleared only by coalesce().
    private final List<TrackedCondition> trackedConditions = new ArrayList<>();
    private final List<Result> unplacedEvidence = new ArrayList<>();

    private String defaultStatus;
    private boolean collecting;

    TestNode(String name, boolean fromFile) {
        this.name = Objects.requireNonNull(name, "name");
        this.fromFile = fromFile;
    }

    /**
     * Creates a detached node for a test that has no stored expectations yet.
     *
     * @param testType harness test type, e.g. {@code testharness} or {@code reftest}
     * @param id       identity of the test; must be a {@link ReftestId}
     *                 exactly when {@code testType} is {@code reftest}
     */
    public static TestNode create(String testType, TestId id) {
        Objects.requireNonNull(testType, "testType");
        Objects.requireNonNull(id, "id");

        boolean reftest = REFTEST.equals(testType);
        if (reftest != (id instanceof ReftestId)) {
            throw new IllegalArgumentException(
                    "Test type '" + testType + "' does not match identity " + id);
        }

        TestNode node = new TestNode(id.name(), false);
        node.attributes().set(TYPE, testType);
        if (id instanceof ReftestId ref) {
            node.attributes().set(REFTYPE, ref.refType());
            node.attributes().set(REFURL, ref.refUrl());
        }
        return node;
    }

    public String name() {
        return name;
    }

    /**
     * Returns {@code true} if this node was read from a stored table rather
     * than created for new evidence.
     */
    public boolean isFromFile() {
        return fromFile;
    }

    public String testType() {
        return attributes().get(TYPE).orElse(null);
    }

    /**
     * Returns the identity of this test.
     *
     * @throws IllegalStateException if the node is not attached to a file
     */
    public TestId id() {
        if (!(parent().orElse(null) instanceof FileNode file)) {
            throw new IllegalStateException("Test '" + name + "' is not attached to a file");
        }
        String url = file.urlFor(name);
        if (REFTEST.equals(testType())) {
            return new ReftestId(url, requiredAttribute(REFTYPE), requiredAttribute(REFURL));
        }
        return new UrlTestId(url);
    }

    private String requiredAttribute(String key) {
        return attributes().get(key).orElseThrow(() ->
                new IllegalStateException("Reftest '" + name + "' has no '" + key + "' attribute"));
    }

    /**
     * Returns the file this node belongs to, if it is attached to one.
     */
    public Optional<FileNode> root() {
        ExpectationNode node = parent().orElse(null);
        while (node != null) {
            if (node instanceof FileNode file) {
                return Optional.of(file);
            }
            node = node.parent().orElse(null);
        }
        return Optional.empty();
    }

    /**
     * Returns the harness default status adopted from the first recorded
     * result, or {@code null} before any result was recorded.
     */
    public String defaultStatus() {
        return defaultStatus;
    }

    public List<TrackedCondition> trackedConditions() {
        return Collections.unmodifiableList(trackedConditions);
    }

    public List<Result> unplacedEvidence() {
        return Collections.unmodifiableList(unplacedEvidence);
    }

    // ---------------------------------------------------------------------
    // Subtests
    // ---------------------------------------------------------------------

    public Map<String, SubtestNode> subtests() {
        return Collections.unmodifiableMap(subtests);
    }

    @Override
    public List<SubtestNode> children() {
        return List.copyOf(subtests.values());
    }

    public Optional<SubtestNode> findSubtest(String subtestName) {
        return Optional.ofNullable(subtests.get(subtestName));
    }

    /**
     * Returns the named subtest, creating and attaching an empty one on
     * first use.
     */
    public SubtestNode getOrCreateSubtest(String subtestName) {
        SubtestNode existing = subtests.get(subtestName);
        if (existing != null) {
            return existing;
        }
        SubtestNode created = new SubtestNode(subtestName, false);
        addSubtest(created);
        return created;
    }

    /**
     * Attaches a subtest.
     *
     * @throws DuplicateTestIdException if a subtest with the same name exists
     */
    public void addSubtest(SubtestNode subtest) {
        Objects.requireNonNull(subtest, "subtest");
        if (subtest.parent().isPresent()) {
            throw new IllegalStateException("Subtest '" + subtest.name() + "' is already attached");
        }
        if (subtests.containsKey(subtest.name())) {
            throw new DuplicateTestIdException(
                    "Duplicate subtest '" + subtest.name() + "' in test '" + name + "'");
        }
        subtest.setParent(this);
        subtests.put(subtest.name(), subtest);
    }

    public void removeSubtest(SubtestNode subtest) {
        Objects.requireNonNull(subtest, "subtest");
        if (subtests.get(subtest.name()) == subtest) {
            subtests.remove(subtest.name());
            subtest.setParent(null);
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /**
     * Returns {@code true} if the node carries nothing beyond its required
     * attributes and all of its subtests are empty, so it can be pruned.
     */
    public boolean isEmpty() {
        Set<String> required = new HashSet<>();
        required.add(TYPE);
        if (REFTEST.equals(testType())) {
            required.add(REFTYPE);
            required.add(REFURL);
        }
        if (!attributes().keys().equals(required)) {
            return false;
        }
        for (SubtestNode subtest : subtests.values()) {
            if (!subtest.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if the {@code disabled} attribute resolves to a
     * value in the given environment.
     */
    public boolean isDisabled(EnvironmentDescriptor descriptor) {
        return attributes().get(DISABLED, descriptor).isPresent();
    }

    // ---------------------------------------------------------------------
    // Evidence
    // ---------------------------------------------------------------------

    /**
     * Records one observed result.
     *
     * @param descriptor    environment the result was observed in
     * @param status        observed status
     * @param defaultStatus the status the harness expects for this test type
     *                      when no expectation is stored
     * @throws InconsistentDefaultException if {@code defaultStatus} differs
     *         from the default adopted from an earlier result
     */
    public void recordResult(EnvironmentDescriptor descriptor, String status, String defaultStatus) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(defaultStatus, "defaultStatus");

        if (this.defaultStatus == null) {
            this.defaultStatus = defaultStatus;
        } else if (!this.defaultStatus.equals(defaultStatus)) {
            throw new InconsistentDefaultException(
                    "Test '" + name + "' has default status " + this.defaultStatus
                            + " but a result implied " + defaultStatus);
        }

        if (!collecting) {
            resetEvidence();
            collecting = true;
        }

        Result result = new Result(descriptor, status);
        for (TrackedCondition tracked : trackedConditions) {
            if (tracked.value().appliesTo(descriptor)) {
                tracked.add(result);
                if (!status.equals(tracked.value().value())) {
                    markModified();
                }
                return;
            }
        }

        unplacedEvidence.add(result);
        markModified();
    }

    /**
     * Folds all evidence recorded since the last call into the stored
     * {@code expected} entries, then clears the pending evidence.
     *
     * @return a summary of the changes made
     */
    public CoalesceOutcome coalesce() {
        CoalesceOutcome outcome = ExpectedReconciler.reconcile(this);
        resetEvidence();
        collecting = false;
        return outcome;
    }

    /**
     * Removes all stored expectations from this node and its subtests.
     */
    public void clearExpected() {
        // Evidence filed under removed entries becomes unplaced.
        for (TrackedCondition tracked : trackedConditions) {
            unplacedEvidence.addAll(tracked.evidence());
        }
        trackedConditions.clear();
        attributes().remove(EXPECTED);
        for (SubtestNode subtest : subtests.values()) {
            subtest.clearExpected();
        }
    }

    /**
     * Rebuilds the tracked conditions from the stored {@code expected}
     * entries and drops unplaced evidence.
     */
    private void resetEvidence() {
        trackedConditions.clear();
        for (ConditionalValue value : attributes().values(EXPECTED)) {
            trackedConditions.add(new TrackedCondition(value));
        }
        unplacedEvidence.clear();
    }

    private void markModified() {
        root().ifPresent(FileNode::markModified);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + "]";
    }
}
