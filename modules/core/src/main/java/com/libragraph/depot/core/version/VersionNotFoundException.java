package com.libragraph.depot.core.version;

import com.libragraph.depot.core.query.Filter;
import com.libragraph.depot.util.FileId;

/**
 * Thrown when a lookup that needs exactly one version finds none.
 */
public class VersionNotFoundException extends RuntimeException {

    public VersionNotFoundException(String message) {
        super(message);
    }

    public static VersionNotFoundException matching(Filter filter) {
        return new VersionNotFoundException("No file version matches " + filter);
    }

    public static VersionNotFoundException withId(FileId id) {
        return new VersionNotFoundException("File version not found: " + id);
    }
}
