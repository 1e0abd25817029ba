package com.libragraph.depot.core.bundle;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Destination of a download. Opened at most once, when the first byte is ready.
 */
public interface BundleSink {

    OutputStream open() throws IOException;

    /**
     * Signals that the output is incomplete and must not be presented as a
     * finished download. Called at most once, after {@link #open()}.
     */
    void abort(Throwable cause);

    static BundleSink of(OutputStream out) {
        return new OutputStreamBundleSink(out);
    }
}
