package com.questrail.expectations.manifest;

import com.questrail.expectations.api.EnvironmentDescriptor;
import com.questrail.expectations.api.UrlTestId;
import com.questrail.expectations.codec.impl.ConditionParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for evidence recording on {@link TestNode}: placement of results
 * against stored entries, the modified flag and default status tracking.
 */
final class TestNodeRecordResultTest
{
    private FileNode file;
    private TestNode test;

    @BeforeEach
    void setUp()
    {
        file = new FileNode("dom/a.html");
        test = TestNode.create("testharness", new UrlTestId("/dom/a.html"));
        file.addChild(test);
    }

    @Test
    void resultFiledUnderFirstMatchingEntryOnly()
    {
        test.attributes().set(TestNode.EXPECTED, "FAIL", ConditionParser.parse("os == \"win\"", 0));
        test.attributes().set(TestNode.EXPECTED, "TIMEOUT", ConditionParser.parse("debug", 0));

        test.recordResult(env("win", true), "FAIL", "PASS");

        assertEquals(2, test.trackedConditions().size());
        assertEquals(1, test.trackedConditions().get(0).evidence().size());
        assertTrue(test.trackedConditions().get(1).evidence().isEmpty());
        assertTrue(test.unplacedEvidence().isEmpty());
    }

    @Test
    void unmatchedResultIsUnplaced()
    {
        test.attributes().set(TestNode.EXPECTED, "FAIL", ConditionParser.parse("os == \"win\"", 0));

        test.recordResult(env("linux", false), "PASS", "PASS");

        assertEquals(1, test.unplacedEvidence().size());
        assertEquals("PASS", test.unplacedEvidence().get(0).status());
    }

    @Test
    void recordingLeavesStoredEntriesUntouched()
    {
        ConditionalValue win = test.attributes().set(TestNode.EXPECTED, "FAIL", ConditionParser.parse("os == \"win\"", 0));

        test.recordResult(env("win", false), "PASS", "PASS");

        assertEquals("FAIL", win.value());
        assertEquals(1, test.attributes().values(TestNode.EXPECTED).size());
    }

    @Test
    void agreeingResultDoesNotMarkFileModified()
    {
        test.attributes().set(TestNode.EXPECTED, "FAIL");

        test.recordResult(env("linux", false), "FAIL", "PASS");
        assertFalse(file.isModified());

        test.recordResult(env("win", false), "PASS", "PASS");
        assertTrue(file.isModified());
    }

    @Test
    void unplacedResultMarksFileModified()
    {
        test.recordResult(env("linux", false), "PASS", "PASS");
        assertTrue(file.isModified());
    }

    @Test
    void firstResultFixesDefaultStatus()
    {
        assertNull(test.defaultStatus());

        test.recordResult(env("linux", false), "PASS", "PASS");
        assertEquals("PASS", test.defaultStatus());

        assertThrows(InconsistentDefaultException.class,
                () -> test.recordResult(env("win", false), "OK", "OK"));
    }

    @Test
    void subtestHasItsOwnDefault()
    {
        test.recordResult(env("linux", false), "OK", "OK");
        SubtestNode subtest = test.getOrCreateSubtest("first");

        assertDoesNotThrow(() -> subtest.recordResult(env("linux", false), "FAIL", "PASS"));
        assertEquals("PASS", subtest.defaultStatus());
        assertSame(subtest, test.getOrCreateSubtest("first"));
        assertSame(test, subtest.test());
        assertSame(file, subtest.root().orElseThrow());
    }

    @Test
    void duplicateSubtestRejected()
    {
        test.addSubtest(SubtestNode.create("first"));
        assertThrows(DuplicateTestIdException.class, () -> test.addSubtest(SubtestNode.create("first")));
    }

    @Test
    void disabledResolvesPerEnvironment()
    {
        test.attributes().set(TestNode.DISABLED, "flaky on windows", ConditionParser.parse("os == \"win\"", 0));

        assertTrue(test.isDisabled(env("win", false)));
        assertFalse(test.isDisabled(env("linux", false)));
    }

    @Test
    void emptinessIgnoresRequiredAttributes()
    {
        assertTrue(test.isEmpty());

        SubtestNode subtest = test.getOrCreateSubtest("first");
        assertTrue(test.isEmpty());

        subtest.attributes().set(TestNode.EXPECTED, "FAIL");
        assertFalse(subtest.isEmpty());
        assertFalse(test.isEmpty());
    }

    private static EnvironmentDescriptor env(String os, boolean debug) {
        return EnvironmentDescriptor.builder().with("os", os).with("debug", debug).build();
    }
}
