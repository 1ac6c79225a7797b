package com.questrail.expectations.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * EnvironmentDescriptor
 * -----------------------------------------------------------------------------
 * Immutable description of the environment a test ran under.
 *
 * <p>A descriptor maps property names (for example {@code os},
 * {@code processor}, {@code debug}, {@code version}, {@code bits}) to scalar
 * values. The harness supplies one descriptor per run; the reconciliation
 * engine only reads it.</p>
 *
 * <h2>Value types</h2>
 * Property values are restricted to:
 * <ul>
 *   <li>{@link String}</li>
 *   <li>{@link Number}</li>
 *   <li>{@link Boolean}</li>
 * </ul>
 *
 * Any other value, including {@code null}, and NaN or infinite
 * floating-point numbers are rejected at construction.
 *
 * <h2>Ordering</h2>
 * Insertion order of properties is preserved for diagnostics. Equality is
 * order-independent.
 */
public final class EnvironmentDescriptor
{
    private static final EnvironmentDescriptor EMPTY = new EnvironmentDescriptor(Map.of());

    private final Map<String, Object> properties;

    private EnvironmentDescriptor(Map<String, Object> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Creates a descriptor from the given property map.
     *
     * @param properties property name to scalar value
     * @return a new descriptor
     * @throws IllegalArgumentException if a key is blank or a value is not a
     *         {@code String}, {@code Number} or {@code Boolean}
     */
    public static EnvironmentDescriptor of(Map<String, ?> properties) {
        Objects.requireNonNull(properties, "properties");

        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : properties.entrySet()) {
            copy.put(checkName(entry.getKey()), checkValue(entry.getKey(), entry.getValue()));
        }
        return new EnvironmentDescriptor(copy);
    }

    public static EnvironmentDescriptor empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the value bound to the given property, if any.
     */
    public Optional<Object> get(String name) {
        return Optional.ofNullable(properties.get(name));
    }

    public boolean has(String name) {
        return properties.containsKey(name);
    }

    public Set<String> propertyNames() {
        return properties.keySet();
    }

    public Map<String, Object> asMap() {
        return properties;
    }

    private static String checkName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name must not be blank");
        }
        return name;
    }

    private static Object checkValue(String name, Object value) {
        if ((value instanceof Double || value instanceof Float)
                && !Double.isFinite(((Number) value).doubleValue())) {
            throw new IllegalArgumentException("Property '" + name + "' must be finite (was " + value + ")");
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        throw new IllegalArgumentException(
                "Property '" + name + "' must be a string, number or boolean (was "
                        + (value == null ? "null" : value.getClass().getSimpleName()) + ")"
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnvironmentDescriptor that)) return false;
        return properties.equals(that.properties);
    }

    @Override
    public int hashCode() {
        return properties.hashCode();
    }

    @Override
    public String toString() {
        return "EnvironmentDescriptor" + properties;
    }

    public static final class Builder {
        private final Map<String, Object> properties = new LinkedHashMap<>();

        public Builder with(String name, String value) {
            properties.put(checkName(name), checkValue(name, value));
            return this;
        }

        public Builder with(String name, Number value) {
            properties.put(checkName(name), checkValue(name, value));
            return this;
        }

        public Builder with(String name, boolean value) {
            properties.put(checkName(name), value);
            return this;
        }

        public EnvironmentDescriptor build() {
            return new EnvironmentDescriptor(properties);
        }
    }
}
