package com.libragraph.depot.core.store;

/**
 * Wraps I/O and database failures of the chunk store.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageUnavailableException(String message) {
        super(message);
    }
}
