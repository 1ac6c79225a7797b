package com.questrail.expectations.update;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration for an {@link ExpectationUpdater}.
 *
 * @param metadataRoot   directory holding the expectation tables
 * @param ignoreExisting drop stored {@code expected} entries when a table is
 *                       loaded, so the new run alone determines them
 * @param pruneEmpty     remove tests and subtests left with no expectations
 * @param writeEnabled   write changed tables back to disk; when off the
 *                       update is computed but nothing is written
 */
public record UpdaterConfig(
    Path metadataRoot,
    boolean ignoreExisting,
    boolean pruneEmpty,
    boolean writeEnabled
) {
    public UpdaterConfig {
        Objects.requireNonNull(metadataRoot, "metadataRoot");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path metadataRoot;
        private boolean ignoreExisting = false;
        private boolean pruneEmpty = true;
        private boolean writeEnabled = true;

        public Builder withMetadataRoot(Path metadataRoot) {
            this.metadataRoot = metadataRoot;
            return this;
        }

        public Builder withIgnoreExisting(boolean ignoreExisting) {
            this.ignoreExisting = ignoreExisting;
            return this;
        }

        public Builder withPruneEmpty(boolean pruneEmpty) {
            this.pruneEmpty = pruneEmpty;
            return this;
        }

        public Builder withWriteEnabled(boolean writeEnabled) {
            this.writeEnabled = writeEnabled;
            return this;
        }

        public UpdaterConfig build() {
            return new UpdaterConfig(metadataRoot, ignoreExisting, pruneEmpty, writeEnabled);
        }
    }
}
