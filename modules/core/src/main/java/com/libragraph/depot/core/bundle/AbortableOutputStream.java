package com.libragraph.depot.core.bundle;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Pass-through stream that refuses every write once aborted, so nothing
 * (a zip central directory in particular) reaches the sink after a failure.
 * Never closes the underlying stream; the sink's owner does.
 */
class AbortableOutputStream extends FilterOutputStream {

    private volatile boolean aborted;

    AbortableOutputStream(OutputStream out) {
        super(out);
    }

    void abort() {
        aborted = true;
    }

    boolean isAborted() {
        return aborted;
    }

    @Override
    public void write(int b) throws IOException {
        ensureWritable();
        out.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        ensureWritable();
        out.write(b, off, len);
    }

    @Override
    public void flush() throws IOException {
        ensureWritable();
        out.flush();
    }

    @Override
    public void close() throws IOException {
        if (!aborted) {
            out.flush();
        }
    }

    private void ensureWritable() throws IOException {
        if (aborted) {
            throw new IOException("Output aborted");
        }
    }
}
