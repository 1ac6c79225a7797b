package com.questrail.expectations.codec.impl;

import com.questrail.expectations.codec.ManifestBlock;
import com.questrail.expectations.codec.ManifestEncoder;
import com.questrail.expectations.codec.ManifestEntry;
import com.questrail.expectations.codec.ManifestValue;

import java.util.Objects;

/**
 * Concrete implementation of {@link ManifestEncoder}.
 *
 * <p>Output layout: two spaces of indentation per level, a block's attributes
 * before its child blocks, simple attributes on one line and list attributes
 * with one value per line.</p>
 */
public final class DefaultManifestEncoder implements ManifestEncoder
{
    private static final String INDENT = "  ";

    @Override
    public String encode(ManifestBlock root) {
        Objects.requireNonNull(root, "root");
        if (!root.isRoot()) {
            throw new IllegalArgumentException("Only a root block can be encoded");
        }

        StringBuilder out = new StringBuilder();
        writeContents(root, 0, out);
        return out.toString();
    }

    private static void writeContents(ManifestBlock block, int depth, StringBuilder out) {
        for (ManifestEntry entry : block.entries()) {
            writeEntry(entry, depth, out);
        }
        for (ManifestBlock child : block.children()) {
            indent(depth, out);
            out.append('[').append(ManifestText.escapeHeading(child.name())).append("]\n");
            writeContents(child, depth + 1, out);
        }
    }

    private static void writeEntry(ManifestEntry entry, int depth, StringBuilder out) {
        indent(depth, out);
        out.append(entry.key()).append(':');
        if (entry.isSimple()) {
            out.append(' ');
            writeValue(entry.values().get(0).value(), out);
            out.append('\n');
            return;
        }

        out.append('\n');
        for (ManifestValue value : entry.values()) {
            indent(depth + 1, out);
            if (!value.isUnconditional()) {
                out.append("if ").append(ConditionFormatter.format(value.condition())).append(": ");
            }
            writeValue(value.value(), out);
            out.append('\n');
        }
    }

    private static void writeValue(String value, StringBuilder out) {
        if (ManifestText.needsQuoting(value)) {
            ManifestText.appendQuoted(value, out);
        } else {
            out.append(value);
        }
    }

    private static void indent(int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth));
    }
}
