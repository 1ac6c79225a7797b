package com.questrail.expectations.store;

import com.questrail.expectations.codec.ManifestDecoder;
import com.questrail.expectations.codec.ManifestEncoder;
import com.questrail.expectations.codec.ManifestParseException;
import com.questrail.expectations.codec.impl.DefaultManifestDecoder;
import com.questrail.expectations.codec.impl.DefaultManifestEncoder;
import com.questrail.expectations.manifest.ExpectationTreeBuilder;
import com.questrail.expectations.manifest.FileNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * ExpectationStore
 * -----------------------------------------------------------------------------
 * Reads and writes the on-disk expectation tables under a metadata root.
 *
 * <h2>Layout</h2>
 * The table for test file {@code dom/historical.html} lives at
 * {@code <metadataRoot>/dom/historical.html.ini}.
 *
 * <h2>Failures</h2>
 * <ul>
 *   <li>A missing table is not an error: {@link #load(String)} returns empty.</li>
 *   <li>Malformed table text raises {@link ManifestParseException}.</li>
 *   <li>Any other I/O failure raises {@link UncheckedIOException}.</li>
 * </ul>
 */
public final class ExpectationStore
{
    private static final Logger log = LoggerFactory.getLogger(ExpectationStore.class);

    public static final String TABLE_SUFFIX = ".ini";

    private final Path metadataRoot;
    private final ManifestDecoder decoder;
    private final ManifestEncoder encoder;
    private final ExpectationTreeBuilder builder;

    public ExpectationStore(Path metadataRoot,
                            ManifestDecoder decoder,
                            ManifestEncoder encoder,
                            ExpectationTreeBuilder builder) {
        this.metadataRoot = Objects.requireNonNull(metadataRoot, "metadataRoot");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    /**
     * Creates a store using the default text codec.
     */
    public static ExpectationStore withDefaults(Path metadataRoot) {
        return new ExpectationStore(metadataRoot,
                new DefaultManifestDecoder(),
                new DefaultManifestEncoder(),
                new ExpectationTreeBuilder());
    }

    public Path metadataRoot() {
        return metadataRoot;
    }

    /**
     * Returns the path of the table for a test file.
     */
    public Path expectedPath(String testPath) {
        Objects.requireNonNull(testPath, "testPath");
        String relative = testPath.replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        if (relative.isEmpty()) {
            throw new IllegalArgumentException("testPath must not be empty");
        }
        Path path = metadataRoot;
        for (String segment : relative.split("/")) {
            if (!segment.isEmpty()) {
                path = path.resolve(segment);
            }
        }
        return path.resolveSibling(path.getFileName() + TABLE_SUFFIX);
    }

    /**
     * Loads the table for a test file.
     *
     * @return the tree, or empty if no table exists
     * @throws ManifestParseException if the table is malformed
     */
    public Optional<FileNode> load(String testPath) {
        Path path = expectedPath(testPath);
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.debug("No expectation table at {}", path);
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }

        try {
            return Optional.of(builder.build(decoder.decode(text), testPath));
        } catch (ManifestParseException e) {
            log.warn("Malformed expectation table {}: {}", path, e.getMessage());
            throw e;
        }
    }

    /**
     * Writes the table for a file, creating parent directories as needed.
     *
     * @return the path written
     */
    public Path write(FileNode file) {
        Objects.requireNonNull(file, "file");
        Path path = expectedPath(file.testPath());
        String text = encoder.encode(builder.toBlock(file));
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(path, text, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
        return path;
    }

    /**
     * Deletes the table for a test file.
     *
     * @return {@code true} if a table existed
     */
    public boolean delete(String testPath) {
        Path path = expectedPath(testPath);
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete " + path, e);
        }
    }
}
