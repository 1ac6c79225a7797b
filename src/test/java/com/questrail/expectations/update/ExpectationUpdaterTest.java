package com.questrail.expectations.update;

import com.questrail.expectations.api.EnvironmentDescriptor;
import com.questrail.expectations.api.ReftestId;
import com.questrail.expectations.api.UrlTestId;
import com.questrail.expectations.condition.ConditionSynthesisException;
import com.questrail.expectations.manifest.InconsistentDefaultException;
import com.questrail.expectations.observability.FileWrittenEvent;
import com.questrail.expectations.observability.RecordingObservabilitySink;
import com.questrail.expectations.observability.TestCoalescedEvent;
import com.questrail.expectations.observability.UpdateErrorEvent;
import com.questrail.expectations.store.ExpectationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExpectationUpdaterTest
 * -----------------------------------------------------------------------------
 * End-to-end tests for {@link ExpectationUpdater}: tables on disk are loaded,
 * updated from harness results and written back.
 */
final class ExpectationUpdaterTest
{
    private static final UrlTestId HISTORICAL = new UrlTestId("/dom/historical.html");

    @TempDir
    Path root;

    private RecordingObservabilitySink sink;
    private ExpectationStore store;

    @BeforeEach
    void setUp()
    {
        sink = new RecordingObservabilitySink();
        store = ExpectationStore.withDefaults(root);
    }

    @Test
    void newFailuresWrittenToNewTable() throws IOException
    {
        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());

        updater.record(os("linux"), testResult("OK"));
        updater.record(os("win"), testResult("OK"));
        updater.record(os("linux"), subtestResult("first", "PASS"));
        updater.record(os("win"), subtestResult("first", "FAIL"));

        List<Path> written = updater.update();

        Path table = root.resolve("dom").resolve("historical.html.ini");
        assertEquals(List.of(table), written);
        assertEquals(String.join("\n",
                "[historical.html]",
                "  type: testharness",
                "  [first]",
                "    expected:",
                "      if os == \"win\": FAIL",
                ""), Files.readString(table, StandardCharsets.UTF_8));
        assertTrue(sink.hasEventOfType(FileWrittenEvent.class));
        assertEquals(2, sink.getEventsOfType(TestCoalescedEvent.class).size());
    }

    @Test
    void existingTableUpdatedInPlace() throws IOException
    {
        Path table = store.expectedPath("dom/historical.html");
        Files.createDirectories(table.getParent());
        Files.writeString(table, String.join("\n",
                "[historical.html]",
                "  type: testharness",
                "  expected:",
                "    if debug and os == \"linux\": TIMEOUT",
                "    ERROR",
                ""), StandardCharsets.UTF_8);

        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        updater.record(env("win", false), testResult("OK"));
        updater.record(env("mac", false), testResult("OK"));
        updater.update();

        assertEquals(String.join("\n",
                "[historical.html]",
                "  type: testharness",
                "  expected:",
                "    if debug and os == \"linux\": TIMEOUT",
                ""), Files.readString(table, StandardCharsets.UTF_8));
    }

    @Test
    void tableLeftWithoutTestsIsDeleted() throws IOException
    {
        Path table = store.expectedPath("dom/historical.html");
        Files.createDirectories(table.getParent());
        Files.writeString(table, "[historical.html]\n  type: testharness\n  expected: FAIL\n",
                StandardCharsets.UTF_8);

        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        updater.record(os("linux"), testResult("OK"));
        updater.update();

        assertFalse(Files.exists(table));
        FileWrittenEvent event = sink.getEventsOfType(FileWrittenEvent.class).get(0);
        assertTrue(event.deleted());
    }

    @Test
    void matchingResultsLeaveTableUntouched() throws IOException
    {
        Path table = store.expectedPath("dom/historical.html");
        Files.createDirectories(table.getParent());
        String text = "[historical.html]\n  type: testharness\n  expected: FAIL\n";
        Files.writeString(table, text, StandardCharsets.UTF_8);

        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        updater.record(os("linux"), testResult("FAIL"));

        assertTrue(updater.update().isEmpty());
        assertFalse(sink.hasEventOfType(FileWrittenEvent.class));
        assertEquals(text, Files.readString(table, StandardCharsets.UTF_8));
    }

    @Test
    void ignoreExistingDropsStoredExpectations() throws IOException
    {
        Path table = store.expectedPath("dom/historical.html");
        Files.createDirectories(table.getParent());
        Files.writeString(table, String.join("\n",
                "[historical.html]",
                "  type: testharness",
                "  expected:",
                "    if os == \"mac\": CRASH",
                "    ERROR",
                ""), StandardCharsets.UTF_8);

        ExpectationUpdater updater = updater(UpdaterConfig.builder()
                .withMetadataRoot(root)
                .withIgnoreExisting(true)
                .build());
        updater.record(os("linux"), testResult("TIMEOUT"));
        updater.update();

        assertEquals("[historical.html]\n  type: testharness\n  expected: TIMEOUT\n",
                Files.readString(table, StandardCharsets.UTF_8));
    }

    @Test
    void writeDisabledComputesWithoutWriting()
    {
        ExpectationUpdater updater = updater(UpdaterConfig.builder()
                .withMetadataRoot(root)
                .withWriteEnabled(false)
                .build());
        updater.record(os("linux"), testResult("TIMEOUT"));

        updater.coalesceAll();
        assertEquals("TIMEOUT", updater.file("dom/historical.html").orElseThrow()
                .get(HISTORICAL).attributes().get("expected").orElseThrow());

        List<Path> changed = updater.writeChanges();

        assertEquals(List.of(store.expectedPath("dom/historical.html")), changed);
        assertFalse(Files.exists(changed.get(0)));
    }

    @Test
    void pruningCanBeDisabled() throws IOException
    {
        ExpectationUpdater updater = updater(UpdaterConfig.builder()
                .withMetadataRoot(root)
                .withPruneEmpty(false)
                .build());
        updater.record(os("linux"), testResult("OK"));
        updater.update();

        assertEquals("[historical.html]\n  type: testharness\n",
                Files.readString(store.expectedPath("dom/historical.html"), StandardCharsets.UTF_8));
    }

    @Test
    void reftestComparisonsWrittenSeparately() throws IOException
    {
        ReftestId equal = new ReftestId("/css/a.html", "==", "/css/a-ref.html");
        ReftestId notEqual = new ReftestId("/css/a.html", "!=", "/css/a-notref.html");

        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        updater.record(os("linux"), HarnessResult.forTest("css/a.html", equal, "reftest", "FAIL", "PASS"));
        updater.record(os("linux"), HarnessResult.forTest("css/a.html", notEqual, "reftest", "PASS", "PASS"));
        updater.update();

        assertEquals(String.join("\n",
                "[a.html]",
                "  type: reftest",
                "  reftype: ==",
                "  refurl: /css/a-ref.html",
                "  expected: FAIL",
                ""), Files.readString(store.expectedPath("css/a.html"), StandardCharsets.UTF_8));
    }

    @Test
    void inconsistentDefaultReportedAndRethrown()
    {
        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        updater.record(os("linux"), testResult("OK"));

        HarnessResult conflicting = HarnessResult.forTest("dom/historical.html", HISTORICAL, "testharness", "OK", "PASS");
        assertThrows(InconsistentDefaultException.class, () -> updater.record(os("win"), conflicting));

        UpdateErrorEvent error = sink.getEventsOfType(UpdateErrorEvent.class).get(0);
        assertEquals("dom/historical.html", error.testPath());
        assertInstanceOf(InconsistentDefaultException.class, error.cause());
    }

    @Test
    void inseparableEvidenceReportedAndRethrown()
    {
        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        updater.record(EnvironmentDescriptor.builder().with("browser", "a").build(), testResult("OK"));
        updater.record(EnvironmentDescriptor.builder().with("browser", "b").build(), testResult("ERROR"));

        assertThrows(ConditionSynthesisException.class, updater::coalesceAll);
        assertTrue(sink.hasEventOfType(UpdateErrorEvent.class));
    }

    @Test
    void updaterWithoutSinkStillWritesAndRethrows() throws IOException
    {
        ExpectationUpdater updater = new ExpectationUpdater(
                UpdaterConfig.builder().withMetadataRoot(root).build(), store, null);
        updater.record(os("linux"), testResult("TIMEOUT"));
        updater.update();

        assertEquals("[historical.html]\n  type: testharness\n  expected: TIMEOUT\n",
                Files.readString(store.expectedPath("dom/historical.html"), StandardCharsets.UTF_8));

        updater.record(os("linux"), testResult("OK"));
        HarnessResult conflicting = HarnessResult.forTest("dom/historical.html", HISTORICAL, "testharness", "OK", "PASS");
        assertThrows(InconsistentDefaultException.class, () -> updater.record(os("win"), conflicting));
    }

    @Test
    void testOutsideFileRejected()
    {
        ExpectationUpdater updater = updater(UpdaterConfig.builder().withMetadataRoot(root).build());
        HarnessResult misplaced = HarnessResult.forTest("dom/historical.html",
                new UrlTestId("/html/historical.html"), "testharness", "OK", "OK");

        assertThrows(IllegalArgumentException.class, () -> updater.record(os("linux"), misplaced));
        assertTrue(updater.file("dom/historical.html").orElseThrow().tests().isEmpty());
    }

    @Test
    void configRequiresMetadataRoot()
    {
        assertThrows(NullPointerException.class, () -> UpdaterConfig.builder().build());
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private ExpectationUpdater updater(UpdaterConfig config) {
        return new ExpectationUpdater(config, store, sink);
    }

    private static HarnessResult testResult(String status) {
        return HarnessResult.forTest("dom/historical.html", HISTORICAL, "testharness", status, "OK");
    }

    private static HarnessResult subtestResult(String subtest, String status) {
        return HarnessResult.forSubtest("dom/historical.html", HISTORICAL, "testharness", subtest, status, "PASS");
    }

    private static EnvironmentDescriptor os(String os) {
        return EnvironmentDescriptor.builder().with("os", os).build();
    }

    private static EnvironmentDescriptor env(String os, boolean debug) {
        return EnvironmentDescriptor.builder().with("os", os).with("debug", debug).build();
    }
}
