package com.questrail.expectations.codec;

import java.util.List;
import java.util.Objects;

/**
 * A named attribute with its ordered value list.
 */
public record ManifestEntry(String key, List<ManifestValue> values)
{
    public ManifestEntry {
        Objects.requireNonNull(key, "key");
        values = List.copyOf(values);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Attribute '" + key + "' has no values");
        }
    }

    /**
     * Returns {@code true} if the attribute is a single unconditional value,
     * which is written on the key's own line.
     */
    public boolean isSimple() {
        return values.size() == 1 && values.get(0).isUnconditional();
    }
}
