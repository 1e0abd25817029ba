package com.libragraph.depot.api;

import com.libragraph.depot.core.bundle.EmptyBundleException;
import com.libragraph.depot.core.query.InvalidFilterException;
import com.libragraph.depot.core.store.ContentNotFoundException;
import com.libragraph.depot.core.store.StorageUnavailableException;
import com.libragraph.depot.core.version.VersionNotFoundException;
import jakarta.ws.rs.core.Response;

import java.util.concurrent.CompletionException;

/**
 * HTTP status for each failure of the storage layer.
 */
public final class ErrorStatus {

    private ErrorStatus() {}

    public static Response.Status of(Throwable error) {
        Throwable e = unwrap(error);
        if (e instanceof VersionNotFoundException
                || e instanceof ContentNotFoundException
                || e instanceof EmptyBundleException) {
            return Response.Status.NOT_FOUND;
        }
        if (e instanceof InvalidFilterException || e instanceof IllegalArgumentException) {
            return Response.Status.BAD_REQUEST;
        }
        if (e instanceof StorageUnavailableException) {
            return Response.Status.SERVICE_UNAVAILABLE;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }

    /** Strips the wrapper Mutiny adds around checked failures. */
    static Throwable unwrap(Throwable error) {
        Throwable e = error;
        while (e instanceof CompletionException && e.getCause() != null) {
            e = e.getCause();
        }
        return e;
    }
}
