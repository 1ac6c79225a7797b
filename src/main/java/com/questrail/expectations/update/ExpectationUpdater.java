package com.questrail.expectations.update;

import com.questrail.expectations.api.EnvironmentDescriptor;
import com.questrail.expectations.manifest.CoalesceOutcome;
import com.questrail.expectations.manifest.FileNode;
import com.questrail.expectations.manifest.SubtestNode;
import com.questrail.expectations.manifest.TestNode;
import com.questrail.expectations.observability.FileWrittenEvent;
import com.questrail.expectations.observability.NullObservabilitySink;
import com.questrail.expectations.observability.Slf4jUpdateObservabilitySink;
import com.questrail.expectations.observability.TestCoalescedEvent;
import com.questrail.expectations.observability.UpdateErrorEvent;
import com.questrail.expectations.observability.UpdateObservabilitySink;
import com.questrail.expectations.store.ExpectationStore;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ExpectationUpdater
 * -----------------------------------------------------------------------------
 * Harness-facing entry point that folds a run's results into the stored
 * expectation tables.
 *
 * <h2>Session</h2>
 * <ol>
 *   <li>{@link #record(EnvironmentDescriptor, HarnessResult)} once per
 *       result. Tables are loaded lazily on first use and kept in memory.</li>
 *   <li>{@link #coalesceAll()} rewrites every touched test's expectations.</li>
 *   <li>{@link #writeChanges()} writes the tables that changed and ends the
 *       session.</li>
 * </ol>
 *
 * {@link #update()} runs the last two steps together.
 *
 * <h2>Errors</h2>
 * Fatal errors are reported to the {@link UpdateObservabilitySink} and then
 * rethrown unchanged.
 *
 * <p>Instances are not thread-safe and must be confined to one thread.</p>
 */
public final class ExpectationUpdater
{
    private final UpdaterConfig config;
    private final ExpectationStore store;
    private final UpdateObservabilitySink sink;

    private final Map<String, FileNode> files = new LinkedHashMap<>();

    public ExpectationUpdater(UpdaterConfig config) {
        this(config, ExpectationStore.withDefaults(config.metadataRoot()), new Slf4jUpdateObservabilitySink());
    }

    /**
     * @param sink receives update events; {@code null} discards them
     */
    public ExpectationUpdater(UpdaterConfig config, ExpectationStore store, UpdateObservabilitySink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Records one harness result observed in the given environment.
     */
    public void record(EnvironmentDescriptor descriptor, HarnessResult result) {
        Objects.requireNonNull(descriptor, "descriptor");
        Objects.requireNonNull(result, "result");

        try {
            FileNode file = fileFor(result.testPath());
            TestNode test = testFor(file, result);
            TestNode node = result.subtestName().<TestNode>map(test::getOrCreateSubtest).orElse(test);
            node.recordResult(descriptor, result.status(), result.defaultStatus());
        } catch (RuntimeException e) {
            report(result.testPath(), e);
            throw e;
        }
    }

    /**
     * Returns the in-memory tree of a test file touched in this session.
     */
    public Optional<FileNode> file(String testPath) {
        return Optional.ofNullable(files.get(normalize(testPath)));
    }

    /**
     * Coalesces every test and subtest of every loaded table, then prunes
     * empty nodes if configured to.
     */
    public void coalesceAll() {
        for (FileNode file : files.values()) {
            try {
                for (TestNode test : file.tests()) {
                    coalesce(file, test, null);
                    for (SubtestNode subtest : test.children()) {
                        coalesce(file, test, subtest);
                    }
                }
                if (config.pruneEmpty()) {
                    prune(file);
                }
            } catch (RuntimeException e) {
                report(file.testPath(), e);
                throw e;
            }
        }
    }

    /**
     * Writes every modified table, deleting tables left without tests.
     *
     * @return the paths written or deleted; with writing disabled, the paths
     *         of the tables that would have been rewritten
     */
    public List<Path> writeChanges() {
        List<Path> changed = new ArrayList<>();
        for (FileNode file : files.values()) {
            if (!file.isModified()) {
                continue;
            }
            if (!config.writeEnabled()) {
                changed.add(store.expectedPath(file.testPath()));
                continue;
            }
            try {
                persist(file).ifPresent(changed::add);
            } catch (RuntimeException e) {
                report(file.testPath(), e);
                throw e;
            }
        }
        files.clear();
        return changed;
    }

    /**
     * Coalesces all evidence and writes the result.
     */
    public List<Path> update() {
        coalesceAll();
        return writeChanges();
    }

    private FileNode fileFor(String testPath) {
        String key = normalize(testPath);
        FileNode file = files.get(key);
        if (file != null) {
            return file;
        }

        file = store.load(key).orElseGet(() -> new FileNode(key));
        if (config.ignoreExisting()) {
            for (TestNode test : file.tests()) {
                test.clearExpected();
            }
        }
        files.put(key, file);
        return file;
    }

    private static TestNode testFor(FileNode file, HarnessResult result) {
        Optional<TestNode> existing = file.find(result.testId());
        if (existing.isPresent()) {
            return existing.get();
        }

        TestNode created = TestNode.create(result.testType(), result.testId());
        file.addChild(created);
        if (!created.id().equals(result.testId())) {
            file.removeChild(created);
            throw new IllegalArgumentException(
                    "Test " + result.testId() + " does not belong to file " + file.testPath());
        }
        return created;
    }

    private void coalesce(FileNode file, TestNode test, SubtestNode subtest) {
        TestNode node = subtest == null ? test : subtest;
        CoalesceOutcome outcome = node.coalesce();
        if (outcome.changed()) {
            file.markModified();
        }
        sink.onTestCoalesced(new TestCoalescedEvent(
                Instant.now(),
                file.testPath(),
                test.name(),
                subtest == null ? null : subtest.name(),
                outcome));
    }

    private static void prune(FileNode file) {
        for (TestNode test : List.copyOf(file.tests())) {
            for (SubtestNode subtest : test.children()) {
                if (subtest.isEmpty()) {
                    test.removeSubtest(subtest);
                    file.markModified();
                }
            }
            if (test.isEmpty()) {
                file.removeChild(test);
                file.markModified();
            }
        }
    }

    private Optional<Path> persist(FileNode file) {
        Path path;
        boolean deleted = file.tests().isEmpty() && file.attributes().isEmpty();
        if (deleted) {
            // Nothing to write and no stale table to remove.
            if (!store.delete(file.testPath())) {
                return Optional.empty();
            }
            path = store.expectedPath(file.testPath());
        } else {
            path = store.write(file);
        }
        sink.onFileWritten(new FileWrittenEvent(Instant.now(), file.testPath(), path, file.tests().size(), deleted));
        return Optional.of(path);
    }

    private void report(String testPath, RuntimeException e) {
        sink.onError(new UpdateErrorEvent(Instant.now(), testPath, e.getMessage(), e));
    }

    private static String normalize(String testPath) {
        String normalized = testPath.replace('\\', '/');
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        return normalized;
    }
}
