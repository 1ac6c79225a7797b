package com.questrail.expectations.codec;

import java.util.List;

/**
 * Syntax-level block of an expectation table.
 *
 * @param name     heading text, or {@code null} for the root of a file
 * @param entries  attributes declared directly in the block, in order
 * @param children nested blocks, in order
 * @param line     line of the heading in the decoded text, or {@code 0} for
 *                 the root and for blocks built in code
 */
public record ManifestBlock(String name,
                            List<ManifestEntry> entries,
                            List<ManifestBlock> children,
                            int line)
{
    public ManifestBlock {
        entries = List.copyOf(entries);
        children = List.copyOf(children);
    }

    public ManifestBlock(String name, List<ManifestEntry> entries, List<ManifestBlock> children) {
        this(name, entries, children, 0);
    }

    public static ManifestBlock root(List<ManifestEntry> entries, List<ManifestBlock> children) {
        return new ManifestBlock(null, entries, children);
    }

    public boolean isRoot() {
        return name == null;
    }
}
