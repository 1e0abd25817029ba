package com.libragraph.depot.core.model;

import java.util.Objects;

/**
 * Descriptor handed to the chunk store alongside the content stream of an upload.
 */
public record NewFile(String filename, String container, String contentType, FileMetadata metadata) {

    public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    public NewFile {
        Objects.requireNonNull(filename, "filename cannot be null");
        Objects.requireNonNull(container, "container cannot be null");
        contentType = contentType != null && !contentType.isBlank() ? contentType : DEFAULT_CONTENT_TYPE;
        metadata = metadata != null ? metadata : FileMetadata.empty();
    }
}
