package com.questrail.expectations.manifest;

import com.questrail.expectations.codec.ManifestBlock;
import com.questrail.expectations.codec.ManifestEntry;
import com.questrail.expectations.codec.ManifestParseException;
import com.questrail.expectations.codec.ManifestValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ExpectationTreeBuilder
 * -----------------------------------------------------------------------------
 * Converts between the syntax-level {@link ManifestBlock} form of a table and
 * the {@link FileNode} expectation tree.
 *
 * <h2>Structure</h2>
 * <ul>
 *   <li>Root block entries become file attributes.</li>
 *   <li>Child blocks become {@link TestNode}s.</li>
 *   <li>Grandchild blocks become {@link SubtestNode}s.</li>
 * </ul>
 *
 * Nesting below a subtest is rejected. Attribute entries are copied verbatim
 * in both directions, so a table that is loaded and written back unchanged
 * keeps its order.
 */
public final class ExpectationTreeBuilder
{
    /**
     * Builds the tree for one test file.
     *
     * @throws ManifestParseException if blocks are nested too deeply
     * @throws DuplicateTestIdException if two blocks resolve to the same test
     */
    public FileNode build(ManifestBlock root, String testPath) {
        Objects.requireNonNull(root, "root");
        FileNode file = new FileNode(testPath);
        copyEntries(root, file.attributes());

        for (ManifestBlock testBlock : root.children()) {
            TestNode test = new TestNode(testBlock.name(), true);
            copyEntries(testBlock, test.attributes());

            for (ManifestBlock subtestBlock : testBlock.children()) {
                if (!subtestBlock.children().isEmpty()) {
                    ManifestBlock nested = subtestBlock.children().get(0);
                    throw new ManifestParseException(
                            "Block '" + nested.name() + "' is nested below subtest '" + subtestBlock.name() + "'",
                            nested.line());
                }
                SubtestNode subtest = new SubtestNode(subtestBlock.name(), true);
                copyEntries(subtestBlock, subtest.attributes());
                test.addSubtest(subtest);
            }

            file.addChild(test);
        }
        return file;
    }

    /**
     * Returns the syntax-level form of a tree, ready for encoding.
     */
    public ManifestBlock toBlock(FileNode file) {
        Objects.requireNonNull(file, "file");
        List<ManifestBlock> tests = new ArrayList<>();
        for (TestNode test : file.tests()) {
            List<ManifestBlock> subtests = new ArrayList<>();
            for (SubtestNode subtest : test.children()) {
                subtests.add(new ManifestBlock(subtest.name(), entriesOf(subtest.attributes()), List.of()));
            }
            tests.add(new ManifestBlock(test.name(), entriesOf(test.attributes()), subtests));
        }
        return ManifestBlock.root(entriesOf(file.attributes()), tests);
    }

    private static void copyEntries(ManifestBlock block, ConditionalAttributes attributes) {
        for (ManifestEntry entry : block.entries()) {
            for (ManifestValue value : entry.values()) {
                attributes.append(entry.key(), value.value(), value.condition());
            }
        }
    }

    private static List<ManifestEntry> entriesOf(ConditionalAttributes attributes) {
        List<ManifestEntry> entries = new ArrayList<>();
        for (String key : attributes.keys()) {
            List<ManifestValue> values = new ArrayList<>();
            for (ConditionalValue value : attributes.values(key)) {
                values.add(new ManifestValue(value.condition().orElse(null), value.value()));
            }
            // An attribute whose entries were all removed is not written.
            if (!values.isEmpty()) {
                entries.add(new ManifestEntry(key, values));
            }
        }
        return entries;
    }
}
