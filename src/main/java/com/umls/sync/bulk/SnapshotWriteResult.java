package com.umls.sync.bulk;

import java.nio.file.Path;

/**
 * Result of writing a snapshot to an import directory.
 */
public record SnapshotWriteResult(
        Path directory,
        long concepts,
        long codes,
        long memberships,
        long assertions,
        SnapshotManifest manifest
) {
    public String importCommand() {
        return manifest.importCommand();
    }

    @Override
    public String toString() {
        return "SnapshotWriteResult{directory=" + directory +
                ", concepts=" + concepts +
                ", codes=" + codes +
                ", memberships=" + memberships +
                ", assertions=" + assertions + '}';
    }
}
