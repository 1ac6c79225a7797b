package com.questrail.expectations.runinfo;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.expectations.api.EnvironmentDescriptor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a run-info JSON file into an {@link EnvironmentDescriptor}.
 *
 * <p>The file holds one flat object, for example
 * {@code {"os": "linux", "debug": false, "bits": 64}}. Strings, booleans and
 * numbers become properties, {@code null} members are skipped, and nested
 * arrays or objects are rejected.</p>
 */
public final class RunInfoReader
{
    private final ObjectMapper mapper;

    public RunInfoReader() {
        this(new ObjectMapper());
    }

    public RunInfoReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public EnvironmentDescriptor read(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read run info " + path, e);
        }
    }

    public EnvironmentDescriptor read(InputStream in) {
        Objects.requireNonNull(in, "in");
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse run info", e);
        }
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Run info must be a JSON object");
        }

        Map<String, Object> properties = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isNull()) {
                continue;
            }
            if (value.isTextual()) {
                properties.put(field.getKey(), value.textValue());
            } else if (value.isBoolean()) {
                properties.put(field.getKey(), value.booleanValue());
            } else if (value.isNumber()) {
                properties.put(field.getKey(), value.numberValue());
            } else {
                throw new IllegalArgumentException(
                        "Run info property '" + field.getKey() + "' must be a string, number or boolean");
            }
        }
        return EnvironmentDescriptor.of(properties);
    }
}
