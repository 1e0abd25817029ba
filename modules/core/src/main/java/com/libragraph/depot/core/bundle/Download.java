package com.libragraph.depot.core.bundle;

import java.io.IOException;
import java.util.Objects;

/**
 * A resolved download: the selection is known and only streaming remains.
 *
 * @param name        file name offered to the client
 * @param contentType MIME type of the response body
 * @param inline      display in place rather than save as an attachment
 * @param archive     body is a zip of several entries
 */
public record Download(String name, String contentType, boolean inline, boolean archive, Writer writer) {

    public static final String ZIP_CONTENT_TYPE = "application/zip";

    @FunctionalInterface
    public interface Writer {
        void writeTo(BundleSink sink) throws IOException;
    }

    public Download {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(contentType, "contentType cannot be null");
        Objects.requireNonNull(writer, "writer cannot be null");
    }

    public void writeTo(BundleSink sink) throws IOException {
        writer.writeTo(sink);
    }
}
