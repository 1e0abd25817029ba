package com.libragraph.depot.core.model;

import com.libragraph.depot.util.FileId;

import java.time.Instant;
import java.util.Comparator;
import java.util.Objects;

/**
 * One stored binary: a single version in the {@code container + filename} lineage.
 *
 * <p>Content lives in the chunk store under {@link #id()} and is owned by this record alone.
 */
public record FileVersion(
        FileId id,
        String filename,
        String container,
        Instant uploadedAt,
        long length,
        String contentType,
        FileMetadata metadata
) {

    /** Newest first: {@code uploadedAt} descending, then id descending. */
    public static final Comparator<FileVersion> NEWEST_FIRST =
            Comparator.comparing(FileVersion::uploadedAt)
                    .thenComparing(FileVersion::id)
                    .reversed();

    public FileVersion {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(filename, "filename cannot be null");
        Objects.requireNonNull(container, "container cannot be null");
        Objects.requireNonNull(uploadedAt, "uploadedAt cannot be null");
        metadata = metadata != null ? metadata : FileMetadata.empty();
    }

    public FileVersion withContainer(String newContainer) {
        return new FileVersion(id, filename, newContainer, uploadedAt, length, contentType, metadata);
    }

    public FileVersion withMetadata(FileMetadata newMetadata) {
        return new FileVersion(id, filename, container, uploadedAt, length, contentType, newMetadata);
    }
}
