package com.libragraph.depot.core.bundle;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Sink over a caller-owned stream. The stream is not closed here.
 */
public class OutputStreamBundleSink implements BundleSink {

    private final OutputStream out;
    private boolean opened;
    private Throwable abortCause;

    public OutputStreamBundleSink(OutputStream out) {
        this.out = Objects.requireNonNull(out, "out cannot be null");
    }

    @Override
    public OutputStream open() throws IOException {
        if (opened) {
            throw new IOException("Sink already opened");
        }
        opened = true;
        return out;
    }

    @Override
    public void abort(Throwable cause) {
        abortCause = cause;
    }

    public boolean isOpened() {
        return opened;
    }

    public boolean isAborted() {
        return abortCause != null;
    }

    public Throwable abortCause() {
        return abortCause;
    }
}
