package com.libragraph.depot.core.store;

import com.libragraph.depot.util.FileId;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * Reads a file's chunks in order, fetching each one only when the previous is exhausted.
 *
 * <p>Holds at most one chunk in memory. A chunk that disappears mid-read fails
 * the stream with an {@link IOException}.
 */
public class ChunkedInputStream extends InputStream {

    /** Fetches chunk {@code n} of a file. */
    @FunctionalInterface
    public interface ChunkReader {
        Optional<byte[]> read(FileId id, int n);
    }

    private final FileId id;
    private final long length;
    private final ChunkReader reader;

    private byte[] chunk = new byte[0];
    private int chunkPos;
    private int nextChunk;
    private long consumed;
    private boolean closed;

    public ChunkedInputStream(FileId id, long length, ChunkReader reader) {
        this.id = id;
        this.length = length;
        this.reader = reader;
    }

    @Override
    public int read() throws IOException {
        byte[] one = new byte[1];
        int n = read(one, 0, 1);
        return n == -1 ? -1 : one[0] & 0xff;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        ensureOpen();
        if (len == 0) {
            return 0;
        }
        if (chunkPos == chunk.length && !fetchNext()) {
            return -1;
        }
        int n = Math.min(len, chunk.length - chunkPos);
        System.arraycopy(chunk, chunkPos, b, off, n);
        chunkPos += n;
        consumed += n;
        return n;
    }

    @Override
    public int available() throws IOException {
        ensureOpen();
        return chunk.length - chunkPos;
    }

    @Override
    public void close() {
        closed = true;
        chunk = new byte[0];
        chunkPos = 0;
    }

    private boolean fetchNext() throws IOException {
        while (consumed < length) {
            int n = nextChunk++;
            byte[] next;
            try {
                next = reader.read(id, n)
                        .orElseThrow(() -> new IOException("Chunk " + n + " of " + id + " is missing"));
            } catch (StorageUnavailableException e) {
                throw new IOException("Failed to read chunk " + n + " of " + id, e);
            }
            if (next.length > 0) {
                chunk = next;
                chunkPos = 0;
                return true;
            }
        }
        return false;
    }

    private void ensureOpen() throws IOException {
        if (closed) {
            throw new IOException("Stream closed: " + id);
        }
    }
}
