package com.libragraph.depot.core.model;

import java.io.InputStream;
import java.util.Map;
import java.util.Objects;

/**
 * One file of an upload: name, type hint, custom metadata and the content to consume.
 */
public record UploadRequest(String filename, String contentType, Map<String, Object> metadata,
                            InputStream content) {

    public UploadRequest {
        Objects.requireNonNull(content, "content cannot be null");
        metadata = metadata != null ? metadata : Map.of();
    }

    public static UploadRequest of(String filename, String contentType, InputStream content) {
        return new UploadRequest(filename, contentType, Map.of(), content);
    }
}
