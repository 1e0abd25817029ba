package com.libragraph.depot.core.bundle;

/**
 * Thrown when a download selects no files.
 */
public class EmptyBundleException extends RuntimeException {

    public EmptyBundleException(String message) {
        super(message);
    }
}
