package com.libragraph.depot.types;

import java.util.List;
import java.util.Optional;

/**
 * Addressable fields of a stored file version.
 *
 * <p>Each field has a canonical name plus the aliases used by the
 * GridFS-style document model ({@code _id}, {@code uploadDate},
 * {@code metadata.container}, {@code metadata.mimetype}).
 */
public enum FileField {
    ID("id", "_id"),
    FILENAME("filename"),
    CONTAINER("container", "metadata.container"),
    UPLOADED_AT("uploadedAt", "uploadDate"),
    LENGTH("length"),
    CONTENT_TYPE("contentType", "metadata.mimetype"),
    METADATA("metadata");

    private final String label;
    private final List<String> aliases;

    FileField(String label, String... aliases) {
        this.label = label;
        this.aliases = List.of(aliases);
    }

    public String label() {
        return label;
    }

    public List<String> aliases() {
        return aliases;
    }

    /** Looks a field up by canonical name or alias. */
    public static Optional<FileField> find(String name) {
        for (FileField f : values()) {
            if (f.label.equals(name) || f.aliases.contains(name)) return Optional.of(f);
        }
        return Optional.empty();
    }

    public static FileField fromName(String name) {
        return find(name).orElseThrow(
                () -> new IllegalArgumentException("Unknown FileField name: " + name));
    }
}
