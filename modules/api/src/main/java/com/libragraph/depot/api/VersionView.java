package com.libragraph.depot.api;

import com.libragraph.depot.core.model.FileVersion;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link FileVersion}; the id crosses the boundary as its hex string.
 */
public record VersionView(
        String id,
        String filename,
        String container,
        Instant uploadedAt,
        long length,
        String contentType,
        Map<String, Object> metadata
) {

    public static VersionView of(FileVersion v) {
        return new VersionView(v.id().toString(), v.filename(), v.container(), v.uploadedAt(),
                v.length(), v.contentType(), v.metadata().asMap());
    }

    public static List<VersionView> of(List<FileVersion> versions) {
        return versions.stream().map(VersionView::of).toList();
    }
}
