package com.libragraph.depot.core.store;

import com.libragraph.depot.util.FileId;

/**
 * Thrown when a read targets content whose record or chunks no longer exist.
 */
public class ContentNotFoundException extends RuntimeException {

    private final FileId id;

    public ContentNotFoundException(FileId id) {
        super("Content not found: " + id);
        this.id = id;
    }

    public FileId id() {
        return id;
    }
}
