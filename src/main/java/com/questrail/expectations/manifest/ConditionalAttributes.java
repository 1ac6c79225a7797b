package com.questrail.expectations.manifest;

import com.questrail.expectations.api.EnvironmentDescriptor;
import com.questrail.expectations.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * ConditionalAttributes
 * -----------------------------------------------------------------------------
 * Ordered, named attribute storage where each attribute holds an ordered list
 * of {@link ConditionalValue} entries.
 *
 * <h2>Lookup</h2>
 * Entries are evaluated top to bottom and the first one that applies wins,
 * which is exactly how a stored table is read at run time.
 *
 * <h2>Insertion</h2>
 * {@link #set(String, String, Expression)} follows the table's layout rules:
 * <ul>
 *   <li>An existing entry with an equal condition is updated in place.</li>
 *   <li>A new conditional entry goes before a trailing unconditional entry,
 *       so the default stays last.</li>
 *   <li>Otherwise the entry is appended.</li>
 * </ul>
 *
 * Attribute names keep their insertion order.
 */
public final class ConditionalAttributes
{
    private final Map<String, List<ConditionalValue>> attributes = new LinkedHashMap<>();

    public boolean has(String key) {
        return attributes.containsKey(key);
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(attributes.keySet());
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    /**
     * Returns the entries of an attribute, in stored order.
     *
     * @return an unmodifiable view; empty if the attribute is absent
     */
    public List<ConditionalValue> values(String key) {
        List<ConditionalValue> values = attributes.get(key);
        return values == null ? List.of() : Collections.unmodifiableList(values);
    }

    /**
     * Returns the value of the attribute's unconditional entry, if one is
     * stored.
     */
    public Optional<String> get(String key) {
        for (ConditionalValue value : values(key)) {
            if (value.isUnconditional()) {
                return Optional.of(value.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the attribute for an environment (first applicable entry).
     */
    public Optional<String> get(String key, EnvironmentDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        for (ConditionalValue value : values(key)) {
            if (value.appliesTo(descriptor)) {
                return Optional.of(value.value());
            }
        }
        return Optional.empty();
    }

    /**
     * Sets the unconditional value of an attribute.
     */
    public ConditionalValue set(String key, String value) {
        return set(key, value, null);
    }

    /**
     * Sets the value of an attribute under a condition.
     *
     * @param condition condition, or {@code null} for the unconditional entry
     * @return the entry that now holds {@code value}
     */
    public ConditionalValue set(String key, String value, Expression condition) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");

        List<ConditionalValue> values = attributes.computeIfAbsent(key, k -> new ArrayList<>());
        for (ConditionalValue existing : values) {
            if (existing.hasCondition(condition)) {
                existing.setValue(value);
                return existing;
            }
        }

        ConditionalValue created = new ConditionalValue(condition, value);
        if (!values.isEmpty() && values.get(values.size() - 1).isUnconditional()) {
            values.add(values.size() - 1, created);
        } else {
            values.add(created);
        }
        return created;
    }

    /**
     * Appends an entry verbatim, without the layout rules of {@code set}.
     * Used when loading a stored table so its order is preserved exactly.
     */
    ConditionalValue append(String key, String value, Expression condition) {
        ConditionalValue created = new ConditionalValue(condition, value);
        attributes.computeIfAbsent(key, k -> new ArrayList<>()).add(created);
        return created;
    }

    /**
     * Removes one entry, matched by identity. The attribute itself stays
     * present even when its last entry is removed.
     *
     * @return {@code true} if the entry was found
     */
    public boolean removeValue(String key, ConditionalValue value) {
        List<ConditionalValue> values = attributes.get(key);
        if (values == null) {
            return false;
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == value) {
                values.remove(i);
                return true;
            }
        }
        return false;
    }

    public void remove(String key) {
        attributes.remove(key);
    }
}
